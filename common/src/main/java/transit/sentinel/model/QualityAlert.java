package transit.sentinel.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A record that failed the quality gate. Alerts are published to the alert topic and kept in the
 * store's quarantine log; a rejected record is never dropped without one.
 */
public record QualityAlert(
        String alertId,
        AlertType alertType,
        Severity severity,
        EntityType entityType,
        String entityId,
        String agencyId,
        String errorMessage,
        String fieldName,
        String fieldValue,
        Instant detectedAt
) {
    public QualityAlert {
        Objects.requireNonNull(alertId, "alertId");
        Objects.requireNonNull(alertType, "alertType");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(errorMessage, "errorMessage");
        Objects.requireNonNull(detectedAt, "detectedAt");
    }
}
