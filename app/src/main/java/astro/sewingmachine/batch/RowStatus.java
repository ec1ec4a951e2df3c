package astro.sewingmachine.batch;

/**
 * How a catalog row ended up.
 */
public enum RowStatus {
    MEASURED,
    UNAVAILABLE,
    FORMAT_ERROR,
    FAILED
}
