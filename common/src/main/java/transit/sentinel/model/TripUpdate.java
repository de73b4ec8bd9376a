package transit.sentinel.model;

import java.time.Instant;

/**
 * One stop-time update. A feed trip update entity fans out into one of these per stop, each
 * carrying the parent trip, route and vehicle ids.
 *
 * @param arrivalDelay seconds, negative when early
 * @param departureDelay seconds, negative when early
 * @param timestamp observation time of the parent trip update
 */
public record TripUpdate(
        String tripId,
        String routeId,
        String vehicleId,
        Integer stopSequence,
        String stopId,
        Integer arrivalDelay,
        Integer departureDelay,
        Instant arrivalTime,
        Instant departureTime,
        ScheduleRelationship scheduleRelationship,
        String agencyId,
        Instant timestamp
) {
    public TripUpdate {
        if (scheduleRelationship == null) {
            scheduleRelationship = ScheduleRelationship.SCHEDULED;
        }
    }

    public String entityId() {
        return stopSequence == null ? tripId : tripId + ":" + stopSequence;
    }
}
