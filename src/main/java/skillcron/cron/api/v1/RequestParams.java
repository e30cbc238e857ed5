package skillcron.cron.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;

/**
 * Query string helpers shared by the v1 controllers.
 */
final class RequestParams {

    private RequestParams() {
    }

    static String string(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    /**
     * Positive integer parameter, clamped to {@code max}.
     *
     * @throws IllegalArgumentException if present but not a positive integer
     */
    static int limit(FullHttpRequest req, String name, int defaultValue, int max) {
        String raw = string(req, name);
        if (raw == null) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + raw);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return Math.min(value, max);
    }
}
