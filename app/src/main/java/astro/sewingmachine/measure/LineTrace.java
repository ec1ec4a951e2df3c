package astro.sewingmachine.measure;

import java.util.Objects;

/**
 * Intermediate values of one line measurement, enough to draw the continuum pixels (kept and
 * clipped), the fitted continuum, the integrated region and the resulting equivalent width.
 */
public record LineTrace(String label, ContinuumFitResult continuum, IntegrationResult integration, MeasurementResult result) {

    public LineTrace {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(continuum, "continuum");
        Objects.requireNonNull(result, "result");
    }

    /**
     * Whether the line got as far as integration.
     */
    public boolean integrated() {
        return integration != null;
    }
}
