package transit.sentinel.quality;

import transit.sentinel.model.AlertType;
import transit.sentinel.model.Severity;

/**
 * Closed set of reasons a record can fail the gate, each mapped to the alert it raises.
 */
public enum RejectionReason {
    MISSING_REQUIRED_FIELD(AlertType.VALIDATION_ERROR, Severity.MEDIUM),
    OUT_OF_RANGE(AlertType.VALIDATION_ERROR, Severity.MEDIUM),
    UNKNOWN_ENUM_CODE(AlertType.VALIDATION_ERROR, Severity.LOW),
    SCHEDULE_ORDER_VIOLATION(AlertType.VALIDATION_ERROR, Severity.MEDIUM),
    DELAY_OUT_OF_BOUNDS(AlertType.VALIDATION_ERROR, Severity.MEDIUM),
    SPEED_VIOLATION(AlertType.SPEED_VIOLATION, Severity.HIGH),
    STALE_DATA(AlertType.STALE_DATA, Severity.MEDIUM),
    GEOGRAPHIC_VIOLATION(AlertType.GEOGRAPHIC_VIOLATION, Severity.HIGH);

    private final AlertType alertType;
    private final Severity severity;

    RejectionReason(AlertType alertType, Severity severity) {
        this.alertType = alertType;
        this.severity = severity;
    }

    public AlertType alertType() {
        return alertType;
    }

    public Severity severity() {
        return severity;
    }
}
