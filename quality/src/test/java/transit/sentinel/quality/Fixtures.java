package transit.sentinel.quality;

import transit.sentinel.model.CongestionLevel;
import transit.sentinel.model.OccupancyStatus;
import transit.sentinel.model.ScheduleRelationship;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.VehicleStopStatus;
import transit.sentinel.model.WeatherCondition;
import transit.sentinel.model.WeatherObservation;

import java.time.Instant;

final class Fixtures {

    static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {}

    static VehiclePosition position(String vehicleId, double speed, Instant ts) {
        return new VehiclePosition(vehicleId, "trip-1", "100", 45.5152, -122.6784, 90.0, speed,
                ts, ts, 3, "stop-7", VehicleStopStatus.IN_TRANSIT_TO, CongestionLevel.RUNNING_SMOOTHLY,
                OccupancyStatus.MANY_SEATS_AVAILABLE, "trimet");
    }

    static VehiclePosition at(double lat, double lon) {
        return new VehiclePosition("4012", null, null, lat, lon, null, null,
                NOW, NOW, null, null, null, null, null, "trimet");
    }

    static TripUpdate tripUpdate(Integer arrivalDelay, Instant arrival, Instant departure) {
        return new TripUpdate("trip-1", "100", "4012", 5, "stop-9", arrivalDelay, arrivalDelay,
                arrival, departure, ScheduleRelationship.SCHEDULED, "trimet", NOW);
    }

    static WeatherObservation weather(double temperature, Instant observedAt) {
        return new WeatherObservation(45.52, -122.68, temperature, 0.2, 14.0, 61,
                WeatherCondition.RAIN, observedAt, "trimet");
    }
}
