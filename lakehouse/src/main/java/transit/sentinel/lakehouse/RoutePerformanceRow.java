package transit.sentinel.lakehouse;

import java.time.LocalDate;

/**
 * Daily schedule adherence for one route. Delays are seconds; on-time means within [-60, +300].
 */
public record RoutePerformanceRow(
        LocalDate day,
        String agencyId,
        String routeId,
        Double avgDelaySeconds,
        Integer maxDelaySeconds,
        Integer minDelaySeconds,
        Double onTimePercentage,
        long totalTrips
) {}
