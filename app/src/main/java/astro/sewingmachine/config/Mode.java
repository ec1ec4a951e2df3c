package astro.sewingmachine.config;

/**
 * What a run measures: every spectrum of a catalog, or a single spectrum file.
 */
public enum Mode {
    CATALOG,
    SPECTRUM;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return CATALOG;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }
}
