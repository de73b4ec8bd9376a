package transit.sentinel.model;

public enum AlertType {
    VALIDATION_ERROR,
    STALE_DATA,
    GEOGRAPHIC_VIOLATION,
    SPEED_VIOLATION
}
