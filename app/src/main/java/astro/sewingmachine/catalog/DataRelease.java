package astro.sewingmachine.catalog;

/**
 * Survey data release a catalog belongs to. Releases up to 13 key spectra by numeric
 * {@code LOCATION_ID}; later ones by {@code FIELD} name.
 */
public record DataRelease(int number) {

    public static final DataRelease DEFAULT = new DataRelease(16);

    static final String LOCATION_ID_COLUMN = "LOCATION_ID";
    static final String FIELD_COLUMN = "FIELD";
    static final String OBJECT_ID_COLUMN = "APOGEE_ID";

    public DataRelease {
        if (number < 1) {
            throw new IllegalArgumentException("data release must be positive: " + number);
        }
    }

    public static DataRelease from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String normalized = raw.trim();
        if (normalized.regionMatches(true, 0, "DR", 0, 2)) {
            normalized = normalized.substring(2);
        }
        try {
            return new DataRelease(Integer.parseInt(normalized));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported data release: " + raw, ex);
        }
    }

    public String locationColumn() {
        return number <= 13 ? LOCATION_ID_COLUMN : FIELD_COLUMN;
    }

    public String objectIdColumn() {
        return OBJECT_ID_COLUMN;
    }

    @Override
    public String toString() {
        return "DR" + number;
    }
}
