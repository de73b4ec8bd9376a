package transit.sentinel.quality;

import java.util.Locale;

/**
 * Inclusive latitude/longitude box.
 */
public record GeoBounds(
        double minLatitude,
        double minLongitude,
        double maxLatitude,
        double maxLongitude
) {
    public static final GeoBounds WORLD = new GeoBounds(-90.0, -180.0, 90.0, 180.0);

    public GeoBounds {
        if (minLatitude > maxLatitude) throw new IllegalArgumentException("minLatitude must be <= maxLatitude");
        if (minLongitude > maxLongitude) throw new IllegalArgumentException("minLongitude must be <= maxLongitude");
        if (minLatitude < -90.0 || maxLatitude > 90.0) throw new IllegalArgumentException("latitude outside [-90, 90]");
        if (minLongitude < -180.0 || maxLongitude > 180.0) throw new IllegalArgumentException("longitude outside [-180, 180]");
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= minLatitude && latitude <= maxLatitude
                && longitude >= minLongitude && longitude <= maxLongitude;
    }

    /**
     * Parses {@code "minLat,minLon,maxLat,maxLon"}.
     */
    public static GeoBounds parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("bounds must not be blank");
        }
        String[] parts = raw.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("bounds must be minLat,minLon,maxLat,maxLon: " + raw);
        }
        try {
            return new GeoBounds(
                    Double.parseDouble(parts[0].trim()),
                    Double.parseDouble(parts[1].trim()),
                    Double.parseDouble(parts[2].trim()),
                    Double.parseDouble(parts[3].trim())
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bounds must be numeric: " + raw, e);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%.4f,%.4f .. %.4f,%.4f]",
                minLatitude, minLongitude, maxLatitude, maxLongitude);
    }
}
