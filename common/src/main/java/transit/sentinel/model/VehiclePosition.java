package transit.sentinel.model;

import java.time.Instant;

/**
 * One vehicle position as decoded from the feed. Optional fields are {@code null} when absent;
 * nothing here is guaranteed valid until the record has passed the quality gate.
 *
 * @param speed metres per second
 * @param timestamp position timestamp, or the feed timestamp when the entity had none
 */
public record VehiclePosition(
        String vehicleId,
        String tripId,
        String routeId,
        double latitude,
        double longitude,
        Double bearing,
        Double speed,
        Instant timestamp,
        Instant feedTimestamp,
        Integer currentStopSequence,
        String stopId,
        VehicleStopStatus currentStatus,
        CongestionLevel congestionLevel,
        OccupancyStatus occupancyStatus,
        String agencyId
) {
    public VehiclePosition withTimestamp(Instant ts) {
        return new VehiclePosition(vehicleId, tripId, routeId, latitude, longitude, bearing, speed,
                ts, feedTimestamp, currentStopSequence, stopId, currentStatus, congestionLevel,
                occupancyStatus, agencyId);
    }
}
