package transit.sentinel.enrichment.weather;

import java.util.List;
import java.util.Optional;

/**
 * Source of weather data. Implementations throw {@link WeatherApiException} on transport or parse
 * failures.
 */
public interface WeatherApi {

    /**
     * @return empty when the response carried no current conditions
     */
    Optional<CurrentWeather> current(double latitude, double longitude);

    List<HourlyForecast> hourly(double latitude, double longitude, int hoursAhead);
}
