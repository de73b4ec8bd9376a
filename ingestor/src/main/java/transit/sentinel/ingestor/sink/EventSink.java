package transit.sentinel.ingestor.sink;

import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.util.List;

/**
 * Outbound path for accepted records and quality alerts. Delivery guarantees belong to the
 * implementation.
 */
public interface EventSink {

    void publishPositions(List<VehiclePosition> positions);

    void publishTripUpdates(List<TripUpdate> updates);

    void publishWeather(List<WeatherObservation> observations);

    void publishAlerts(List<QualityAlert> alerts);
}
