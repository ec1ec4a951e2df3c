package astro.sewingmachine.batch;

import java.util.Objects;

/**
 * Measurements of one catalog row. Rows that are not {@link RowStatus#MEASURED} are all NaN.
 */
public record CatalogRow(String id, RowStatus status, SpectrumMeasurement measurement) {

    public CatalogRow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(measurement, "measurement");
    }
}
