package transit.sentinel.ingestor.decoder;

import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;

import java.time.Instant;
import java.util.List;

/**
 * @param headerTimestamp header timestamp in epoch seconds as sent, 0 when absent
 * @param feedTimestamp header timestamp, or the decode time when the header had none
 */
public record DecodedFeed(
        List<VehiclePosition> positions,
        List<TripUpdate> tripUpdates,
        long headerTimestamp,
        Instant feedTimestamp,
        DecodeStats stats
) {
    public DecodedFeed {
        positions = List.copyOf(positions);
        tripUpdates = List.copyOf(tripUpdates);
    }
}
