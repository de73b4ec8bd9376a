package transit.sentinel.quality;

import transit.sentinel.model.EntityType;
import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Turns gate rejections into quality alerts.
 */
public final class QualityAlerts {

    private static final DateTimeFormatter ID_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private QualityAlerts() {}

    public static QualityAlert fromRejection(Rejection rejection, EntityType entityType, String entityId,
                                             String agencyId, Instant detectedAt) {
        RejectionReason reason = rejection.reason();
        return new QualityAlert(
                newAlertId(detectedAt),
                reason.alertType(),
                reason.severity(),
                entityType,
                entityId == null ? "" : entityId,
                agencyId,
                "[" + reason + "] " + rejection.message(),
                rejection.fieldName(),
                rejection.fieldValue(),
                detectedAt);
    }

    public static QualityAlert of(ValidationResult<?> result, Instant detectedAt) {
        if (result.isAccepted()) {
            throw new IllegalArgumentException("Accepted record has no alert");
        }
        Object rec = result.record();
        if (rec instanceof VehiclePosition p) {
            return fromRejection(result.rejection(), EntityType.VEHICLE_POSITION, p.vehicleId(), p.agencyId(), detectedAt);
        }
        if (rec instanceof TripUpdate u) {
            return fromRejection(result.rejection(), EntityType.TRIP_UPDATE, u.entityId(), u.agencyId(), detectedAt);
        }
        if (rec instanceof WeatherObservation w) {
            return fromRejection(result.rejection(), EntityType.WEATHER_OBSERVATION, w.entityId(), w.agencyId(), detectedAt);
        }
        throw new IllegalArgumentException("Unsupported record type " + rec.getClass().getName());
    }

    /**
     * @return {@code dqa_<yyyyMMdd_HHmmss>_<8 hex chars>}
     */
    public static String newAlertId(Instant at) {
        return "dqa_" + ID_STAMP.format(at) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
