package transit.sentinel.quality;

import java.util.Objects;

/**
 * Outcome of running one record through the gate: either the accepted record or the rejection.
 */
public record ValidationResult<T>(T record, Rejection rejection) {

    public ValidationResult {
        Objects.requireNonNull(record, "record");
    }

    public static <T> ValidationResult<T> accepted(T record) {
        return new ValidationResult<>(record, null);
    }

    public static <T> ValidationResult<T> rejected(T record, Rejection rejection) {
        return new ValidationResult<>(record, Objects.requireNonNull(rejection, "rejection"));
    }

    public boolean isAccepted() {
        return rejection == null;
    }
}
