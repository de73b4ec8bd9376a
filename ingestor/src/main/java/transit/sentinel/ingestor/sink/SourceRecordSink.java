package transit.sentinel.ingestor.sink;

import org.apache.avro.generic.GenericRecord;
import org.apache.kafka.connect.data.Schema;
import org.apache.kafka.connect.source.SourceRecord;
import transit.sentinel.avro.TransitRecords;
import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Buffers published events as Kafka Connect {@link SourceRecord}s until the task drains them.
 * Keys are strings (vehicle id, trip id, agency id, entity id) for partition affinity; values are
 * Avro binary under {@link Schema#BYTES_SCHEMA}.
 */
public class SourceRecordSink implements EventSink {

    public record Topics(String positions, String tripUpdates, String weather, String alerts) {
        public Topics {
            Objects.requireNonNull(positions, "positions");
            Objects.requireNonNull(tripUpdates, "tripUpdates");
            Objects.requireNonNull(weather, "weather");
            Objects.requireNonNull(alerts, "alerts");
        }
    }

    private final Topics topics;
    private final Map<String, String> sourcePartition;
    private final List<SourceRecord> buffer = new ArrayList<>();
    private Map<String, Object> sourceOffset = Map.of();

    public SourceRecordSink(String feedName, Topics topics) {
        this.topics = Objects.requireNonNull(topics, "topics");
        this.sourcePartition = Map.of("feed", Objects.requireNonNull(feedName, "feedName"));
    }

    public Map<String, String> sourcePartition() {
        return sourcePartition;
    }

    /**
     * Sets the source offset stamped on every record added until the next call.
     */
    public synchronized void beginCycle(Map<String, ?> offset) {
        this.sourceOffset = new HashMap<>(offset);
    }

    public synchronized List<SourceRecord> drain() {
        List<SourceRecord> out = new ArrayList<>(buffer);
        buffer.clear();
        return out;
    }

    public synchronized int pending() {
        return buffer.size();
    }

    @Override
    public synchronized void publishPositions(List<VehiclePosition> positions) {
        for (VehiclePosition p : positions) {
            add(topics.positions(), p.vehicleId(), TransitRecords.toRecord(p));
        }
    }

    @Override
    public synchronized void publishTripUpdates(List<TripUpdate> updates) {
        for (TripUpdate u : updates) {
            add(topics.tripUpdates(), u.tripId(), TransitRecords.toRecord(u));
        }
    }

    @Override
    public synchronized void publishWeather(List<WeatherObservation> observations) {
        for (WeatherObservation w : observations) {
            add(topics.weather(), w.agencyId(), TransitRecords.toRecord(w));
        }
    }

    @Override
    public synchronized void publishAlerts(List<QualityAlert> alerts) {
        for (QualityAlert a : alerts) {
            String key = a.entityId() != null ? a.entityId() : a.alertId();
            add(topics.alerts(), key, TransitRecords.toRecord(a));
        }
    }

    private void add(String topic, String key, GenericRecord value) {
        buffer.add(new SourceRecord(
                sourcePartition, sourceOffset,
                topic, null,
                Schema.STRING_SCHEMA, key,
                Schema.BYTES_SCHEMA, TransitRecords.encode(value)
        ));
    }
}
