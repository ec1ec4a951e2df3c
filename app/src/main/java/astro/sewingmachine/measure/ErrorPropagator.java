package astro.sewingmachine.measure;

import astro.sewingmachine.linelist.Window;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.Objects;

/**
 * Equivalent-width uncertainty as the quadrature sum of the flux errors over the same
 * edge-interpolated samples the integral uses. The errors stay in flux units.
 */
public class ErrorPropagator {

    /**
     * @return the uncertainty, or NaN when the spectrum has no error channel or does not cover the window
     */
    public double propagate(Spectrum spectrum, Window window) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(window, "window");
        if (!spectrum.hasErrors() || !AugmentedSamples.covered(spectrum, window)) {
            return Double.NaN;
        }
        AugmentedSamples samples = AugmentedSamples.ofError(spectrum, window);
        double sumOfSquares = 0.0;
        for (int k = 0; k < samples.size(); k++) {
            double error = samples.value(k);
            sumOfSquares += error * error;
        }
        return Math.sqrt(sumOfSquares);
    }
}
