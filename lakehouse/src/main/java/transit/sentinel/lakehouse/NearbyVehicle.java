package transit.sentinel.lakehouse;

import java.time.Instant;

/**
 * A vehicle's latest validated position and its great-circle distance from the query point.
 *
 * @param speed metres per second, {@code null} when the feed did not report one
 */
public record NearbyVehicle(
        String vehicleId,
        String routeId,
        double latitude,
        double longitude,
        Double speed,
        Instant timestamp,
        double distanceMeters
) {}
