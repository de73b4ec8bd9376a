package transit.sentinel.enrichment.weather;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transit.sentinel.model.VehiclePosition;
import transit.sentinel.model.WeatherObservation;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches weather for an agency's service area and turns it into observations. Lookups go through a
 * cache keyed by coordinates rounded to two decimals; fetch failures are logged and yield nothing.
 */
public class WeatherEnrichment {

    private static final Logger log = LoggerFactory.getLogger(WeatherEnrichment.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final WeatherApi api;
    private final TtlCache<String, CurrentWeather> cache;

    public WeatherEnrichment(WeatherApi api, TtlCache<String, CurrentWeather> cache) {
        this.api = Objects.requireNonNull(api, "api");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public Optional<WeatherObservation> currentWeather(double latitude, double longitude, String agencyId) {
        String key = cacheKey(latitude, longitude);
        Optional<CurrentWeather> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Using cached weather for {}", key);
            return Optional.of(cached.get().toObservation(latitude, longitude, agencyId));
        }

        Optional<CurrentWeather> fetched;
        try {
            fetched = api.current(latitude, longitude);
        } catch (WeatherApiException e) {
            log.error("Weather fetch failed for {}: {}", key, e.getMessage(), e);
            return Optional.empty();
        }
        if (fetched.isEmpty()) {
            log.warn("No current weather in response for {}", key);
            return Optional.empty();
        }
        cache.put(key, fetched.get());
        WeatherObservation obs = fetched.get().toObservation(latitude, longitude, agencyId);
        log.info("Weather at {}: {}°C, {}", key, obs.temperatureCelsius(), obs.weatherCondition());
        return Optional.of(obs);
    }

    /**
     * One observation at the service-area centre stands in for the whole fleet.
     */
    public Optional<WeatherObservation> correlateWithVehicles(List<VehiclePosition> positions,
                                                              double centerLatitude, double centerLongitude,
                                                              String agencyId) {
        if (positions.isEmpty()) {
            log.warn("No vehicle positions to correlate weather with");
            return Optional.empty();
        }
        Optional<WeatherObservation> weather = currentWeather(centerLatitude, centerLongitude, agencyId);
        weather.ifPresent(w -> {
            if (w.weatherCondition().isSevere()) {
                log.warn("Severe weather for {} vehicles of {}: {} ({}°C, {} mm)", positions.size(), agencyId,
                        w.weatherCondition(), w.temperatureCelsius(), w.precipitationMm());
            } else {
                log.info("Weather for {} vehicles of {}: {} ({}°C)", positions.size(), agencyId,
                        w.weatherCondition(), w.temperatureCelsius());
            }
        });
        return weather;
    }

    public List<HourlyForecast> hourlyForecast(double latitude, double longitude, int hoursAhead) {
        try {
            List<HourlyForecast> forecast = api.hourly(latitude, longitude, Math.min(hoursAhead, 168));
            log.info("Retrieved {} hourly forecasts", forecast.size());
            return forecast;
        } catch (WeatherApiException e) {
            log.error("Hourly forecast failed: {}", e.getMessage(), e);
            return List.of();
        }
    }

    public TtlCache.Stats cacheStats() {
        return cache.stats();
    }

    static String cacheKey(double latitude, double longitude) {
        return String.format(Locale.ROOT, "%.2f,%.2f", latitude, longitude);
    }
}
