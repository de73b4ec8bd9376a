package transit.sentinel.quality;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

final class Checks {

    private Checks() {}

    static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    static Rejection missing(String rule, String field) {
        return new Rejection(RejectionReason.MISSING_REQUIRED_FIELD, rule, field, null,
                field + " is required");
    }

    static Rejection outOfRange(String rule, String field, Object value, String bounds) {
        return new Rejection(RejectionReason.OUT_OF_RANGE, rule, field, render(value),
                field + " " + render(value) + " outside " + bounds);
    }

    /**
     * @return a stale-data rejection when {@code ts} is older than {@code maxAge} at {@code now}
     */
    static Rejection freshness(String rule, String field, Instant ts, Instant now, Duration maxAge) {
        long ageSeconds = Duration.between(ts, now).getSeconds();
        if (Duration.between(ts, now).compareTo(maxAge) <= 0) {
            return null;
        }
        return new Rejection(RejectionReason.STALE_DATA, rule, field, ts.toString(),
                String.format(Locale.ROOT, "%s is %ds old, exceeds %ds limit", field, ageSeconds, maxAge.getSeconds()));
    }

    static String render(Object value) {
        if (value == null) return null;
        if (value instanceof Double d) return String.format(Locale.ROOT, "%.4f", d);
        return String.valueOf(value);
    }
}
