package transit.sentinel.lakehouse;

import java.time.Instant;

/**
 * One aggregate row for a (bucket, agency, route).
 *
 * @param avgSpeedKmh {@code null} when no observation in the bucket reported a speed
 */
public record VehicleMetricsRow(
        long bucketSeconds,
        Instant bucketStart,
        String agencyId,
        String routeId,
        long totalVehicles,
        Double avgSpeedKmh,
        Double maxSpeedKmh,
        double avgCongestionScore,
        long totalObservations
) {}
