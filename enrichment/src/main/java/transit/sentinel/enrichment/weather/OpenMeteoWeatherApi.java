package transit.sentinel.enrichment.weather;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Open-Meteo forecast endpoint. Times come back without an offset because every request asks for
 * {@code timezone=UTC}; they are read as UTC.
 */
public class OpenMeteoWeatherApi implements WeatherApi {

    public static final String DEFAULT_BASE_URL = "https://api.open-meteo.com/v1";

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final Duration timeout;

    public OpenMeteoWeatherApi(String baseUrl, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/")
                ? baseUrl.substring(0, baseUrl.length() - 1)
                : baseUrl;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public Optional<CurrentWeather> current(double latitude, double longitude) {
        ForecastResponse resp = get(String.format(Locale.ROOT,
                "/forecast?latitude=%.4f&longitude=%.4f&current_weather=true&temperature_unit=celsius"
                        + "&windspeed_unit=kmh&precipitation_unit=mm&timezone=UTC",
                latitude, longitude));
        CurrentWeatherDto c = resp.current_weather;
        if (c == null) {
            return Optional.empty();
        }
        double temperature = c.temperature != null ? c.temperature : orZero(c.temperature_2m);
        double wind = c.windspeed != null ? c.windspeed : orZero(c.windspeed_10m);
        int code = c.weathercode == null ? 0 : c.weathercode;
        return Optional.of(new CurrentWeather(temperature, wind, orZero(c.precipitation), code, parseTime(c.time)));
    }

    @Override
    public List<HourlyForecast> hourly(double latitude, double longitude, int hoursAhead) {
        if (hoursAhead <= 0) {
            return List.of();
        }
        int days = Math.min(hoursAhead / 24 + 1, 7);
        ForecastResponse resp = get(String.format(Locale.ROOT,
                "/forecast?latitude=%.4f&longitude=%.4f&hourly=temperature_2m,precipitation,windspeed_10m,weathercode"
                        + "&temperature_unit=celsius&windspeed_unit=kmh&precipitation_unit=mm&forecast_days=%d&timezone=UTC",
                latitude, longitude, days));
        HourlyDto h = resp.hourly;
        if (h == null || h.time == null) {
            return List.of();
        }
        int n = Math.min(hoursAhead, h.time.size());
        List<HourlyForecast> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new HourlyForecast(
                    parseTime(h.time.get(i)),
                    at(h.temperature_2m, i),
                    at(h.precipitation, i),
                    at(h.windspeed_10m, i),
                    at(h.weathercode, i)));
        }
        return out;
    }

    private ForecastResponse get(String path) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WeatherApiException("HTTP GET failed: " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WeatherApiException("Interrupted during GET " + path, e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new WeatherApiException("HTTP " + resp.statusCode() + " for " + path);
        }
        try {
            return mapper.readValue(resp.body(), ForecastResponse.class);
        } catch (IOException e) {
            throw new WeatherApiException("Unparseable weather response for " + path, e);
        }
    }

    /**
     * Accepts both offset timestamps and the naive {@code yyyy-MM-ddTHH:mm} form, which is taken as UTC.
     */
    static Instant parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new WeatherApiException("Weather response has no time");
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new WeatherApiException("Bad time '" + raw + "'", e);
            }
        }
    }

    private static double orZero(Double v) {
        return v == null ? 0.0 : v;
    }

    private static <T> T at(List<T> values, int i) {
        return values != null && i < values.size() ? values.get(i) : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ForecastResponse {
        public CurrentWeatherDto current_weather;
        public HourlyDto hourly;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CurrentWeatherDto {
        public String time;
        public Double temperature;
        public Double temperature_2m;
        public Double windspeed;
        public Double windspeed_10m;
        public Double precipitation;
        public Integer weathercode;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class HourlyDto {
        public List<String> time;
        public List<Double> temperature_2m;
        public List<Double> precipitation;
        public List<Double> windspeed_10m;
        public List<Integer> weathercode;
    }
}
