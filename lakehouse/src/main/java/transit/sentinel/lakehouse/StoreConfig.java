package transit.sentinel.lakehouse;

import java.time.Duration;
import java.util.Objects;

/**
 * @param jdbcUrl DuckDB JDBC url; {@code jdbc:duckdb:} opens a private in-memory database
 * @param promotionWindow raw positions and trip updates older than this at promotion time are not promoted
 * @param weatherPromotionWindow same, for weather observations
 * @param defaultBucket bucket size used when the caller does not pass one
 */
public record StoreConfig(
        String jdbcUrl,
        Duration promotionWindow,
        Duration weatherPromotionWindow,
        Duration defaultBucket
) {
    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    public StoreConfig {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        if (!jdbcUrl.startsWith("jdbc:duckdb:")) {
            throw new IllegalArgumentException("Not a DuckDB url: " + jdbcUrl);
        }
        requirePositive(promotionWindow, "promotionWindow");
        requirePositive(weatherPromotionWindow, "weatherPromotionWindow");
        requirePositive(defaultBucket, "defaultBucket");
    }

    public static StoreConfig inMemory() {
        return new StoreConfig(IN_MEMORY_URL, Duration.ofMinutes(10), Duration.ofHours(1), Duration.ofHours(1));
    }

    /**
     * @param path database file; blank means in-memory
     */
    public static StoreConfig file(String path) {
        StoreConfig d = inMemory();
        String url = path == null || path.isBlank() ? IN_MEMORY_URL : IN_MEMORY_URL + path;
        return new StoreConfig(url, d.promotionWindow(), d.weatherPromotionWindow(), d.defaultBucket());
    }

    public StoreConfig withPromotionWindow(Duration window) {
        return new StoreConfig(jdbcUrl, window, weatherPromotionWindow, defaultBucket);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
