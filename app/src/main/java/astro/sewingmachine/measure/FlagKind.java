package astro.sewingmachine.measure;

/**
 * Conditions recorded while measuring one line.
 */
public enum FlagKind {
    /** Fewer than two usable continuum pixels; the line was not measured. */
    CONTINUUM_ALL_BAD,
    /** At least one continuum pixel was dropped for near-zero flux. */
    CONTINUUM_BAD_PIXEL,
    /** Sigma clipping left fewer than two continuum pixels; the line was not measured. */
    CONTINUUM_ALL_CLIPPED,
    /** A near-zero flux sample contributed to the integral. */
    INTEGRATION_BAD_PIXEL,
    /** The integration window is not covered by the spectrum. */
    INTEGRATION_OUT_OF_RANGE;

    public boolean isFailure() {
        return this == CONTINUUM_ALL_BAD || this == CONTINUUM_ALL_CLIPPED || this == INTEGRATION_OUT_OF_RANGE;
    }
}
