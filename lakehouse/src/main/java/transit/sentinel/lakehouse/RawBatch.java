package transit.sentinel.lakehouse;

import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.time.Instant;
import java.util.List;

/**
 * Everything decoded in one cycle, appended to the raw layer in a single transaction.
 *
 * @param ingestedAt the time the batch was validated at; promotion re-checks freshness against it.
 *                   {@code null} means the store's clock at append time.
 */
public record RawBatch(
        List<VehiclePosition> positions,
        List<TripUpdate> tripUpdates,
        List<WeatherObservation> weather,
        Instant ingestedAt
) {
    public RawBatch {
        positions = positions == null ? List.of() : List.copyOf(positions);
        tripUpdates = tripUpdates == null ? List.of() : List.copyOf(tripUpdates);
        weather = weather == null ? List.of() : List.copyOf(weather);
    }

    public RawBatch(List<VehiclePosition> positions, List<TripUpdate> tripUpdates, List<WeatherObservation> weather) {
        this(positions, tripUpdates, weather, null);
    }

    public static RawBatch ofPositions(List<VehiclePosition> positions) {
        return new RawBatch(positions, List.of(), List.of());
    }

    public static RawBatch ofWeather(List<WeatherObservation> weather) {
        return new RawBatch(List.of(), List.of(), weather);
    }

    public int size() {
        return positions.size() + tripUpdates.size() + weather.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
