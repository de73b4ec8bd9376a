package transit.sentinel.quality;

import transit.sentinel.model.TripUpdate;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accepts or rejects one record at a time against the ordered rule lists. The gate holds only
 * immutable configuration, so a single instance is shared by every worker thread.
 */
public final class QualityGate {

    private final QualityConfig config;
    private final Clock clock;
    private final List<QualityRule<VehiclePosition>> positionRules;
    private final List<QualityRule<TripUpdate>> tripUpdateRules;
    private final List<QualityRule<WeatherObservation>> weatherRules;

    public QualityGate(QualityConfig config) {
        this(config, Clock.systemUTC());
    }

    public QualityGate(QualityConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.positionRules = VehiclePositionRules.build(config);
        this.tripUpdateRules = TripUpdateRules.build(config);
        this.weatherRules = WeatherObservationRules.build(config);
    }

    public QualityConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public ValidationResult<VehiclePosition> validate(VehiclePosition position) {
        return validate(position, clock.instant());
    }

    public ValidationResult<VehiclePosition> validate(VehiclePosition position, Instant now) {
        return apply(positionRules, position, now);
    }

    public ValidationResult<TripUpdate> validate(TripUpdate update) {
        return validate(update, clock.instant());
    }

    public ValidationResult<TripUpdate> validate(TripUpdate update, Instant now) {
        return apply(tripUpdateRules, update, now);
    }

    public ValidationResult<WeatherObservation> validate(WeatherObservation observation) {
        return validate(observation, clock.instant());
    }

    public ValidationResult<WeatherObservation> validate(WeatherObservation observation, Instant now) {
        return apply(weatherRules, observation, now);
    }

    private static <T> ValidationResult<T> apply(List<QualityRule<T>> rules, T record, Instant now) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(now, "now");
        for (QualityRule<T> rule : rules) {
            Optional<Rejection> rejection = rule.check(record, now);
            if (rejection.isPresent()) {
                return ValidationResult.rejected(record, rejection.get());
            }
        }
        return ValidationResult.accepted(record);
    }
}
