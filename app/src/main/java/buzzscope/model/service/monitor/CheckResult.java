package buzzscope.model.service.monitor;

import buzzscope.model.domain.NotificationEvent;
import buzzscope.model.domain.NotifiedSet;

import java.util.List;
import java.util.Map;

/**
 * @param events     new posts, in keyword order
 * @param next       the previous set plus every post in {@code events}
 * @param perKeyword new events per normalized keyword
 * @param warnings   keywords or platforms that could not be checked
 */
public record CheckResult(
        List<NotificationEvent> events,
        NotifiedSet next,
        Map<String, Integer> perKeyword,
        List<String> warnings
) {
    public CheckResult {
        events = List.copyOf(events);
        perKeyword = Map.copyOf(perKeyword);
        warnings = List.copyOf(warnings);
    }
}
