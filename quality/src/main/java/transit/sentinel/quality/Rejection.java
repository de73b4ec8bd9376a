package transit.sentinel.quality;

import java.util.Objects;

/**
 * Why a record failed the gate.
 *
 * @param rule name of the first rule that failed
 * @param fieldName offending field, {@code null} for cross-field rules
 * @param fieldValue offending value rendered as text, {@code null} when the field was absent
 */
public record Rejection(
        RejectionReason reason,
        String rule,
        String fieldName,
        String fieldValue,
        String message
) {
    public Rejection {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(message, "message");
    }
}
