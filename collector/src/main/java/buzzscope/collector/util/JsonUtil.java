package buzzscope.collector.util;

import buzzscope.collector.core.CollectorError;
import buzzscope.collector.core.CollectorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class JsonUtil {
    private static final ObjectMapper M = new ObjectMapper();

    private JsonUtil() {}

    public static JsonNode readTree(String json) throws CollectorException {
        try {
            return M.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CollectorException(CollectorError.NETWORK_ERROR, "unparseable response: " + e.getOriginalMessage(), e);
        }
    }

    /** Text of a field, or null when missing, JSON null or blank. */
    public static String text(JsonNode n, String field) {
        JsonNode v = n == null ? null : n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    /** Numeric field that may also arrive as a string (YouTube statistics do). */
    public static long number(JsonNode n, String field) {
        JsonNode v = n == null ? null : n.get(field);
        if (v == null || v.isNull()) return 0L;
        if (v.isNumber()) return v.asLong();
        try { return Long.parseLong(v.asText().trim()); }
        catch (NumberFormatException e) { return 0L; }
    }
}
