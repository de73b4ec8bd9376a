package transit.sentinel.quality;

import java.time.Instant;
import java.util.Optional;

/**
 * A named predicate over an already-decoded record. Rules are pure: the only time they see is the
 * {@code now} they are handed.
 */
public interface QualityRule<T> {

    String name();

    Optional<Rejection> check(T record, Instant now);

    static <T> QualityRule<T> of(String name, Check<T> check) {
        return new QualityRule<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<Rejection> check(T record, Instant now) {
                return Optional.ofNullable(check.apply(name, record, now));
            }

            @Override
            public String toString() {
                return "QualityRule[" + name + "]";
            }
        };
    }

    @FunctionalInterface
    interface Check<T> {
        /**
         * @return the rejection, or {@code null} when the record passes
         */
        Rejection apply(String ruleName, T record, Instant now);
    }
}
