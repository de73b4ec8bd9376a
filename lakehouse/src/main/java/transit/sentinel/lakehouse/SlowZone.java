package transit.sentinel.lakehouse;

import java.util.List;

/**
 * Area of roughly 1 km (coordinates rounded to two decimals) whose average reported speed is under
 * the requested threshold.
 *
 * @param routes distinct routes observed in the zone, sorted
 */
public record SlowZone(
        double latitude,
        double longitude,
        double avgSpeedKmh,
        long observations,
        List<String> routes
) {
    public SlowZone {
        routes = List.copyOf(routes);
    }
}
