package buzzscope.model.service.monitor;

import buzzscope.model.domain.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger("buzzscope.notifications");

    @Override public void deliver(NotificationEvent e) {
        log.info("[{}] '{}' {} by {} ({} interactions) {}", e.platform(), e.keyword(),
                abbreviate(e.post().title() != null ? e.post().title() : e.post().body()),
                e.post().author() == null ? "unknown" : e.post().author(),
                e.post().interactionCount(), e.post().url() == null ? "" : e.post().url());
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        String one = s.replaceAll("\\s+", " ").trim();
        return one.length() <= 80 ? one : one.substring(0, 77) + "...";
    }
}
