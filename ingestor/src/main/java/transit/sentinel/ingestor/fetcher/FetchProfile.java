package transit.sentinel.ingestor.fetcher;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request shape and retry policy for one feed endpoint.
 *
 * @param maxAttempts total attempts, including the first
 * @param initialBackoff wait before the second attempt; doubled for each later one
 */
public record FetchProfile(
        String accept,
        String acceptEncoding,
        Map<String, String> headers,
        boolean conditionalGet,
        Decompression decompression,
        Duration timeout,
        String userAgent,
        int maxAttempts,
        Duration initialBackoff
) {
    public enum Decompression {AUTO, GZIP, DEFLATE, NONE, TRY_SMART}

    public FetchProfile {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        decompression = decompression == null ? Decompression.AUTO : decompression;
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
    }

    public static FetchProfile defaults() {
        return new FetchProfile(
                "application/x-protobuf, application/octet-stream",
                "gzip, deflate",
                Map.of(),
                true,
                Decompression.AUTO,
                Duration.ofSeconds(10),
                "transit-sentinel/1.0",
                3,
                Duration.ofSeconds(1)
        );
    }

    public static FetchProfile trafiklab() {
        FetchProfile d = defaults();
        return new FetchProfile(d.accept, d.acceptEncoding, Map.of("Accept-Language", "en"), true,
                Decompression.AUTO, Duration.ofSeconds(15), "transit-sentinel/1.0 (trafiklab)",
                d.maxAttempts, d.initialBackoff);
    }

    public static FetchProfile named(String profile) {
        return "trafiklab".equalsIgnoreCase(profile == null ? "" : profile.trim()) ? trafiklab() : defaults();
    }

    public FetchProfile withRetry(int attempts, Duration backoff) {
        return new FetchProfile(accept, acceptEncoding, headers, conditionalGet, decompression, timeout,
                userAgent, attempts, backoff);
    }

    /**
     * Parses {@code "K=V,K2:V2"}; pairs may be separated by comma or semicolon, keys from values by
     * '=' or ':'.
     */
    public static Map<String, String> parseHeaders(String raw) {
        if (raw == null || raw.isBlank()) return Map.of();
        Map<String, String> res = new LinkedHashMap<>();
        for (String p : raw.split("[,;]")) {
            String[] kv = p.split("[:=]", 2);
            if (kv.length == 2) {
                String k = kv[0].trim();
                if (!k.isEmpty()) res.put(k, kv[1].trim());
            }
        }
        return res;
    }
}
