package buzzscope.model.service.monitor;

import buzzscope.model.domain.NotificationEvent;

import java.io.IOException;

/** Where alerts go. Delivery mechanics (mail, MQTT, webhooks) live behind this. */
public interface NotificationSink {
    void deliver(NotificationEvent event) throws IOException;
}
