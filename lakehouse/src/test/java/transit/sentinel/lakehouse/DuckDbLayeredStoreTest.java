package transit.sentinel.lakehouse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import transit.sentinel.model.AlertType;
import transit.sentinel.model.CongestionLevel;
import transit.sentinel.model.EntityType;
import transit.sentinel.model.OccupancyStatus;
import transit.sentinel.model.QualityAlert;
import transit.sentinel.model.ScheduleRelationship;
import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.VehicleStopStatus;
import transit.sentinel.model.WeatherCondition;
import transit.sentinel.model.WeatherObservation;
import transit.sentinel.quality.GeoBounds;
import transit.sentinel.quality.QualityAlerts;
import transit.sentinel.quality.QualityConfig;
import transit.sentinel.quality.QualityGate;
import transit.sentinel.quality.RejectionReason;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DuckDbLayeredStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:30:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private MutableClock clock;
    private Connection conn;
    private DuckDbLayeredStore store;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(NOW);
        store = newStore();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private DuckDbLayeredStore newStore() throws Exception {
        conn = DriverManager.getConnection(StoreConfig.IN_MEMORY_URL);
        return new DuckDbLayeredStore(conn, new QualityGate(QualityConfig.defaults()), StoreConfig.inMemory(), clock);
    }

    @Test
    void promotesValidPositionsOnce() {
        store.appendRaw(RawBatch.ofPositions(List.of(
                position("4012", "100", 12.5, NOW.minusSeconds(30)),
                position("4013", "100", 40.0, NOW.minusSeconds(30)))));

        PromotionSummary first = store.promote();
        PromotionSummary second = store.promote();

        assertEquals(2, first.positions().scanned());
        assertEquals(1, first.positions().promoted());
        assertEquals(1, first.positions().rejected().get(RejectionReason.SPEED_VIOLATION));
        assertEquals(0, second.positions().scanned());
        assertEquals(1, store.metrics().validatedVehiclePositions());
        assertEquals(2, store.metrics().rawVehiclePositions());
        assertEquals(0.5, store.metrics().qualityRate(), 1e-9);
    }

    @Test
    void dedupKeysOnVehicleAndPositionTimestamp() {
        VehiclePosition p = position("4012", "100", 12.5, NOW.minusSeconds(30));
        store.appendRaw(RawBatch.ofPositions(List.of(p, p)));
        PromotionResult first = store.promote().positions();

        store.appendRaw(RawBatch.ofPositions(List.of(p, p.withTimestamp(NOW.minusSeconds(10)))));
        PromotionResult second = store.promote().positions();

        assertEquals(1, first.promoted());
        assertEquals(1, first.duplicates());
        assertEquals(1, second.promoted());
        assertEquals(1, second.duplicates());
        assertEquals(2, store.metrics().validatedVehiclePositions());
        assertEquals(4, store.metrics().rawVehiclePositions());
    }

    @Test
    void backlogOutsidePromotionWindowIsNotPromoted() {
        store.appendRaw(RawBatch.ofPositions(List.of(position("4012", "100", 12.5, NOW.minusSeconds(60)))));
        clock.advance(Duration.ofMinutes(15));

        PromotionResult result = store.promote().positions();

        assertEquals(1, result.scanned());
        assertEquals(1, result.expired());
        assertEquals(0, result.promoted());
        assertEquals(0, result.rejectedTotal());
    }

    @Test
    void emptyStoreHasZeroQualityRate() {
        LayerMetrics m = store.metrics();

        assertEquals(0.0, m.qualityRate());
        assertEquals(0, m.count(LakehouseSchema.AGG_VEHICLE_METRICS));
        assertEquals(0, m.totalAlerts());
    }

    @Test
    void fiftyVehiclesAggregateIntoOneHourBucket() {
        List<VehiclePosition> batch = new ArrayList<>();
        double sumKmh = 0;
        for (int i = 0; i < 50; i++) {
            double speed = 10.0 + i * (20.0 / 49);
            sumKmh += speed * 3.6;
            batch.add(position("bus-" + i, "100", speed, NOW.minusSeconds(i)));
        }
        store.appendRaw(RawBatch.ofPositions(batch));

        assertEquals(50, store.promote().positions().promoted());
        assertEquals(1, store.aggregateWindow(HOUR));

        List<VehicleMetricsRow> rows = store.latestVehicleMetrics("trimet", HOUR, 10);
        assertEquals(1, rows.size());
        VehicleMetricsRow row = rows.get(0);
        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), row.bucketStart());
        assertEquals(50, row.totalVehicles());
        assertEquals(50, row.totalObservations());
        assertEquals(sumKmh / 50, row.avgSpeedKmh(), 1e-9);
        assertEquals(30.0 * 3.6, row.maxSpeedKmh(), 1e-9);
        assertEquals(1.0, row.avgCongestionScore(), 1e-9);
    }

    @Test
    void aggregationIsIdempotentAndIndependentOfBatching() throws Exception {
        List<VehiclePosition> all = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            all.add(position("bus-" + (i % 7), i % 2 == 0 ? "100" : "200", 5.0 + i, NOW.minusSeconds(i * 10L)));
        }

        store.appendRaw(RawBatch.ofPositions(all));
        store.promote();
        store.aggregateWindow(HOUR);
        assertEquals(0, store.aggregateWindow(HOUR));
        List<VehicleMetricsRow> once = store.latestVehicleMetrics("trimet", HOUR, 10);

        try (DuckDbLayeredStore split = newStore()) {
            split.appendRaw(RawBatch.ofPositions(all.subList(0, 9)));
            split.promote();
            split.aggregateWindow(HOUR);
            split.appendRaw(RawBatch.ofPositions(all.subList(9, 20)));
            split.promote();
            split.aggregateWindow(HOUR);
            List<VehicleMetricsRow> twice = split.latestVehicleMetrics("trimet", HOUR, 10);

            assertEquals(2, once.size());
            assertEquals(once.size(), twice.size());
            for (int i = 0; i < once.size(); i++) {
                VehicleMetricsRow a = once.get(i);
                VehicleMetricsRow b = twice.get(i);
                assertEquals(a.routeId(), b.routeId());
                assertEquals(a.totalVehicles(), b.totalVehicles());
                assertEquals(a.totalObservations(), b.totalObservations());
                assertEquals(a.avgSpeedKmh(), b.avgSpeedKmh(), 1e-9);
                assertEquals(a.maxSpeedKmh(), b.maxSpeedKmh(), 1e-9);
            }
        }
    }

    @Test
    void positionsWithoutRouteAreNotAggregated() {
        store.appendRaw(RawBatch.ofPositions(List.of(position("4012", null, 12.5, NOW))));
        store.promote();

        assertEquals(0, store.aggregateWindow(HOUR));
        assertEquals(0, store.metrics().count(LakehouseSchema.AGG_VEHICLE_METRICS));
    }

    @Test
    void rejectsBucketThatIsNotWholeSeconds() {
        assertThrows(IllegalArgumentException.class, () -> store.aggregateWindow(Duration.ofMillis(1500)));
    }

    @Test
    void routePerformanceRollsUpDailyDelays() {
        store.appendRaw(new RawBatch(List.of(), List.of(
                tripUpdate("t1", 1, 0),
                tripUpdate("t1", 2, 120),
                tripUpdate("t2", 1, 600)), List.of()));
        assertEquals(3, store.promote().tripUpdates().promoted());

        assertEquals(1, store.aggregateRoutePerformance());

        RoutePerformanceRow row = store.routePerformance("trimet").get(0);
        assertEquals(LocalDate.of(2024, 5, 1), row.day());
        assertEquals(240.0, row.avgDelaySeconds(), 1e-9);
        assertEquals(600, row.maxDelaySeconds());
        assertEquals(0, row.minDelaySeconds());
        assertEquals(200.0 / 3, row.onTimePercentage(), 1e-9);
        assertEquals(2, row.totalTrips());
    }

    @Test
    void weatherUsesItsOwnWindow() {
        WeatherObservation w = new WeatherObservation(45.52, -122.68, 11.0, 0.0, 9.0, 3,
                WeatherCondition.OVERCAST, NOW.minus(Duration.ofMinutes(40)), "trimet");
        store.appendRaw(RawBatch.ofWeather(List.of(w, w)));

        PromotionResult result = store.promote().weather();

        assertEquals(1, result.promoted());
        assertEquals(1, result.duplicates());
    }

    @Test
    void recordsAlertsByType() {
        store.recordAlerts(List.of(
                alert(RejectionReason.SPEED_VIOLATION),
                alert(RejectionReason.SPEED_VIOLATION),
                alert(RejectionReason.STALE_DATA)));

        LayerMetrics m = store.metrics();

        assertEquals(2L, m.alertsByType().get(AlertType.SPEED_VIOLATION));
        assertEquals(1L, m.alertsByType().get(AlertType.STALE_DATA));
        assertEquals(3, m.totalAlerts());
    }

    @Test
    void failedPromotionRollsBackEveryKind() throws Exception {
        store.appendRaw(new RawBatch(
                List.of(position("4012", "100", 12.5, NOW.minusSeconds(5))),
                List.of(tripUpdate("t1", 1, 30)),
                List.of()));
        try (Statement st = conn.createStatement()) {
            st.execute("DROP TABLE validated_trip_updates");
        }
        conn.commit();

        assertThrows(StorageException.class, () -> store.promote());

        store.initSchema();
        LayerMetrics afterFailure = store.metrics();
        assertEquals(0, afterFailure.validatedVehiclePositions());
        assertEquals(0, afterFailure.count(LakehouseSchema.VALIDATED_TRIP_UPDATES));
        assertEquals(1, afterFailure.rawVehiclePositions());

        PromotionSummary retried = store.promote();

        assertEquals(1, retried.positions().promoted());
        assertEquals(1, retried.tripUpdates().promoted());
    }

    @Test
    void promotionChecksFreshnessAgainstTheBatchIngestionTime() {
        VehiclePosition p = position("4012", "100", 12.5, NOW.minusSeconds(5));
        clock.advance(Duration.ofMinutes(6));

        store.appendRaw(new RawBatch(List.of(p), List.of(), List.of(), NOW));
        store.appendRaw(RawBatch.ofPositions(List.of(p.withTimestamp(NOW.minusSeconds(4)))));
        PromotionResult result = store.promote().positions();

        assertEquals(2, result.scanned());
        assertEquals(1, result.promoted());
        assertEquals(1, result.rejected().get(RejectionReason.STALE_DATA));
    }

    @Test
    void findsLatestPositionsWithinRadius() {
        store.appendRaw(RawBatch.ofPositions(List.of(
                positionAt("4012", "100", 45.5152, -122.6784, 12.5, NOW.minusSeconds(60)),
                positionAt("4012", "100", 45.5200, -122.6784, 12.5, NOW.minusSeconds(10)),
                positionAt("4013", "200", 45.5152, -122.6784, 3.0, NOW.minusSeconds(30)),
                positionAt("4020", "100", 45.6000, -122.6784, 8.0, NOW.minusSeconds(30)))));
        store.promote();

        List<NearbyVehicle> near = store.vehiclesNear("trimet", 45.5152, -122.6784, 1000);

        assertEquals(2, near.size());
        assertEquals("4013", near.get(0).vehicleId());
        assertEquals(0.0, near.get(0).distanceMeters(), 1e-6);
        assertEquals("4012", near.get(1).vehicleId());
        assertEquals(45.52, near.get(1).latitude(), 1e-9);
        assertEquals(NOW.minusSeconds(10), near.get(1).timestamp());
        assertEquals(533.7, near.get(1).distanceMeters(), 0.5);
        assertTrue(store.vehiclesNear("other-agency", 45.5152, -122.6784, 1000).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.vehiclesNear("trimet", 45.5, -122.6, 0));
    }

    @Test
    void heatMapCountsObservationsPerCell() {
        store.appendRaw(RawBatch.ofPositions(List.of(
                positionAt("a", "100", 45.53, -122.67, 5.0, NOW.minusSeconds(30)),
                positionAt("a", "100", 45.54, -122.68, 5.0, NOW.minusSeconds(20)),
                positionAt("b", "100", 45.57, -122.61, 5.0, NOW.minusSeconds(20)),
                positionAt("c", "200", 45.12, -122.95, 5.0, NOW.minusSeconds(20)),
                positionAt("d", "200", 46.00, -122.00, 5.0, NOW.minusSeconds(20)),
                positionAt("e", "200", 47.00, -122.50, 5.0, NOW.minusSeconds(20)))));
        store.promote();

        List<HeatMapCell> cells = store.heatMap("trimet", new GeoBounds(45.0, -123.0, 46.0, -122.0), 10);

        assertEquals(3, cells.size());
        HeatMapCell busiest = cells.get(0);
        assertEquals(5, busiest.latCell());
        assertEquals(3, busiest.lonCell());
        assertEquals(3, busiest.observations());
        assertEquals(2, busiest.vehicles());
        assertEquals(45.55, busiest.centerLatitude(), 1e-9);
        assertEquals(-122.65, busiest.centerLongitude(), 1e-9);
        assertEquals(1, cells.get(1).latCell());
        assertEquals(0, cells.get(1).lonCell());
        assertEquals(9, cells.get(2).latCell());
        assertEquals(9, cells.get(2).lonCell());
        assertThrows(IllegalArgumentException.class,
                () -> store.heatMap("trimet", new GeoBounds(45.0, -123.0, 45.0, -122.0), 10));
    }

    @Test
    void slowZonesAverageReportedSpeeds() {
        store.appendRaw(RawBatch.ofPositions(List.of(
                positionAt("a", "200", 45.521, -122.681, 1.0, NOW.minusSeconds(30)),
                positionAt("b", "100", 45.522, -122.679, 2.0, NOW.minusSeconds(30)),
                positionAt("c", "100", 45.600, -122.600, 5.0, NOW.minusSeconds(30)),
                positionAt("d", "100", 45.700, -122.700, 0.5, NOW.minusSeconds(30)),
                positionAt("e", "300", 45.800, -122.800, null, NOW.minusSeconds(30)))));
        store.promote();

        List<SlowZone> zones = store.slowZones("trimet", 10.0, 50);

        assertEquals(2, zones.size());
        assertEquals(45.70, zones.get(0).latitude(), 1e-9);
        assertEquals(1.8, zones.get(0).avgSpeedKmh(), 1e-9);
        assertEquals(List.of("100"), zones.get(0).routes());
        SlowZone downtown = zones.get(1);
        assertEquals(45.52, downtown.latitude(), 1e-9);
        assertEquals(-122.68, downtown.longitude(), 1e-9);
        assertEquals(5.4, downtown.avgSpeedKmh(), 1e-9);
        assertEquals(2, downtown.observations());
        assertEquals(List.of("100", "200"), downtown.routes());
        assertEquals(1, store.slowZones("trimet", 10.0, 1).size());
    }

    private static VehiclePosition position(String vehicleId, String routeId, double speed, Instant ts) {
        return positionAt(vehicleId, routeId, 45.5152, -122.6784, speed, ts);
    }

    private static VehiclePosition positionAt(String vehicleId, String routeId, double lat, double lon,
                                              Double speed, Instant ts) {
        return new VehiclePosition(vehicleId, "trip-" + vehicleId, routeId, lat, lon, 180.0, speed,
                ts, ts, 2, "stop-1", VehicleStopStatus.IN_TRANSIT_TO, CongestionLevel.RUNNING_SMOOTHLY,
                OccupancyStatus.FEW_SEATS_AVAILABLE, "trimet");
    }

    private static TripUpdate tripUpdate(String tripId, int seq, int delay) {
        return new TripUpdate(tripId, "100", "4012", seq, "stop-" + seq, delay, delay, null, null,
                ScheduleRelationship.SCHEDULED, "trimet", NOW.minusSeconds(20));
    }

    private static QualityAlert alert(RejectionReason reason) {
        return new QualityAlert(QualityAlerts.newAlertId(NOW), reason.alertType(), reason.severity(),
                EntityType.VEHICLE_POSITION, "4012", "trimet", "test", null, null, NOW);
    }
}
