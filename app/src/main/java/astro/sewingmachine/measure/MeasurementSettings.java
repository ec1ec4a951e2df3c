package astro.sewingmachine.measure;

/**
 * Tunables of a single-line measurement.
 *
 * @param sigmaClip         whether to run one clip-and-refit pass on the continuum
 * @param sigma             clipping threshold in units of the residual standard deviation
 * @param excludeBadPixels  whether continuum pixels below {@code badPixelThreshold} are dropped
 * @param badPixelThreshold flux below which a pixel counts as bad
 * @param propagateErrors   whether an uncertainty is computed from the error channel
 */
public record MeasurementSettings(boolean sigmaClip,
                                  double sigma,
                                  boolean excludeBadPixels,
                                  double badPixelThreshold,
                                  boolean propagateErrors) {

    public static final double DEFAULT_SIGMA = 2.0;
    public static final double DEFAULT_BAD_PIXEL_THRESHOLD = 1e-4;

    public MeasurementSettings {
        if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("sigma must be a positive number: " + sigma);
        }
        if (!Double.isFinite(badPixelThreshold)) {
            throw new IllegalArgumentException("badPixelThreshold must be finite: " + badPixelThreshold);
        }
    }

    public static MeasurementSettings defaults() {
        return new MeasurementSettings(true, DEFAULT_SIGMA, true, DEFAULT_BAD_PIXEL_THRESHOLD, true);
    }

    public MeasurementSettings withSigmaClip(boolean enabled) {
        return new MeasurementSettings(enabled, sigma, excludeBadPixels, badPixelThreshold, propagateErrors);
    }

    public MeasurementSettings withSigma(double value) {
        return new MeasurementSettings(sigmaClip, value, excludeBadPixels, badPixelThreshold, propagateErrors);
    }

    public MeasurementSettings withPropagateErrors(boolean enabled) {
        return new MeasurementSettings(sigmaClip, sigma, excludeBadPixels, badPixelThreshold, enabled);
    }

    boolean isBadPixel(double flux) {
        return !(flux >= badPixelThreshold);
    }
}
