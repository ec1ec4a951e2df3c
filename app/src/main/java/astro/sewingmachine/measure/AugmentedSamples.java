package astro.sewingmachine.measure;

import astro.sewingmachine.linelist.Window;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.function.DoubleUnaryOperator;
import java.util.function.IntToDoubleFunction;

/**
 * Samples of one spectrum channel across a window: the value interpolated at the blue edge,
 * every grid sample strictly inside the window, and the value interpolated at the red edge.
 */
final class AugmentedSamples {

    private final double[] wavelength;
    private final double[] values;

    private AugmentedSamples(double[] wavelength, double[] values) {
        this.wavelength = wavelength;
        this.values = values;
    }

    static AugmentedSamples ofFlux(Spectrum spectrum, Window window) {
        return build(spectrum, window, spectrum::flux, spectrum::interpolateFlux);
    }

    static AugmentedSamples ofError(Spectrum spectrum, Window window) {
        return build(spectrum, window, spectrum::error, spectrum::interpolateError);
    }

    /**
     * Whether both window edges lie within the spectrum's wavelength range.
     */
    static boolean covered(Spectrum spectrum, Window window) {
        return spectrum.covers(window.lo()) && spectrum.covers(window.hi());
    }

    private static AugmentedSamples build(Spectrum spectrum, Window window,
                                          IntToDoubleFunction sample, DoubleUnaryOperator interpolate) {
        int from = spectrum.firstIndexAbove(window.lo());
        int to = spectrum.firstIndexAtOrAbove(window.hi());
        int interior = Math.max(0, to - from);
        double[] wavelength = new double[interior + 2];
        double[] values = new double[interior + 2];
        wavelength[0] = window.lo();
        values[0] = interpolate.applyAsDouble(window.lo());
        for (int k = 0; k < interior; k++) {
            wavelength[k + 1] = spectrum.wavelength(from + k);
            values[k + 1] = sample.applyAsDouble(from + k);
        }
        wavelength[interior + 1] = window.hi();
        values[interior + 1] = interpolate.applyAsDouble(window.hi());
        return new AugmentedSamples(wavelength, values);
    }

    int size() {
        return wavelength.length;
    }

    double wavelength(int index) {
        return wavelength[index];
    }

    double value(int index) {
        return values[index];
    }

    double[] wavelengths() {
        return wavelength.clone();
    }

    double[] values() {
        return values.clone();
    }
}
