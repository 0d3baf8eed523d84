package buzzscope.collector.util;

import buzzscope.collector.core.CollectorError;
import buzzscope.collector.core.CollectorException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

public final class HttpUtil {
    private static final HttpClient C = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_2)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    private HttpUtil() {}

    public static String get(String url, String userAgent, Duration timeout) throws CollectorException {
        return get(url, Map.of(), userAgent, timeout);
    }

    public static String get(String url, Map<String,String> headers, String userAgent, Duration timeout)
            throws CollectorException {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url)).GET().timeout(timeout);
        b.header("User-Agent", userAgent);
        if (headers != null) headers.forEach(b::header);

        HttpResponse<String> resp;
        try {
            resp = C.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new CollectorException(CollectorError.NETWORK_ERROR, "timeout for " + redact(url), e);
        } catch (IOException e) {
            throw new CollectorException(CollectorError.NETWORK_ERROR,
                    "I/O failure for " + redact(url) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectorException(CollectorError.NETWORK_ERROR, "interrupted: " + redact(url), e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw classify(resp.statusCode(), resp.body(), url);
        }
        return resp.body();
    }

    /** Maps a non-2xx status to the collector error taxonomy. */
    public static CollectorException classify(int status, String body, String url) {
        String msg = "HTTP " + status + " for " + redact(url);
        if (status == 429) return new CollectorException(CollectorError.RATE_LIMITED, msg);
        if (status == 401 || status == 403) {
            // YouTube reports quota exhaustion as 403
            if (body != null && (body.contains("quotaExceeded") || body.contains("rateLimitExceeded"))) {
                return new CollectorException(CollectorError.RATE_LIMITED, msg);
            }
            return new CollectorException(CollectorError.AUTH_INVALID, msg);
        }
        return new CollectorException(CollectorError.NETWORK_ERROR, msg);
    }

    public static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    /** Strips the query string so API keys never reach the logs. */
    static String redact(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q) + "?...";
    }
}
