package astro.sewingmachine.measure;

/**
 * Straight-line continuum {@code flux = slope * wavelength + intercept}, meaningful only over
 * the wavelengths it was fitted to.
 */
public record ContinuumFit(double slope, double intercept) {

    public double evaluate(double wavelength) {
        return slope * wavelength + intercept;
    }
}
