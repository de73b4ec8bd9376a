package transit.sentinel.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
