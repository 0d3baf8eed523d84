package buzzscope.collector.util;

import buzzscope.collector.core.CollectorError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HttpUtilTest {

    @Test
    void classifiesStatusCodes() {
        assertEquals(CollectorError.RATE_LIMITED, HttpUtil.classify(429, "", "https://x").error());
        assertEquals(CollectorError.AUTH_INVALID, HttpUtil.classify(401, "", "https://x").error());
        assertEquals(CollectorError.AUTH_INVALID, HttpUtil.classify(403, "{\"reason\":\"forbidden\"}", "https://x").error());
        assertEquals(CollectorError.RATE_LIMITED, HttpUtil.classify(403, "{\"reason\":\"quotaExceeded\"}", "https://x").error());
        assertEquals(CollectorError.NETWORK_ERROR, HttpUtil.classify(503, null, "https://x").error());
    }

    @Test
    void keysNeverReachMessages() {
        String msg = HttpUtil.classify(400, "", "https://api.example/v3/search?q=x&key=SECRET").getMessage();
        assertFalse(msg.contains("SECRET"), msg);
        assertEquals("https://api.example/v3/search?...", HttpUtil.redact("https://api.example/v3/search?key=SECRET"));
    }
}
