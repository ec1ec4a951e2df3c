package astro.sewingmachine.measure;

import astro.sewingmachine.linelist.LineDefinition;
import astro.sewingmachine.linelist.Window;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Spectra on a regular grid for measurement tests.
 */
public final class SyntheticSpectra {

    public static final Window INTEGRATION = new Window(5015, 5025);
    public static final List<Window> CONTINUUM = List.of(new Window(5000, 5010), new Window(5030, 5040));

    private SyntheticSpectra() {
    }

    /**
     * Grid points at half-integer wavelengths from 4990.5 to 5049.5.
     */
    public static double[] halfPixelGrid() {
        return grid(4990.5, 5049.5, 1.0);
    }

    public static double[] grid(double start, double end, double step) {
        int size = (int) Math.round((end - start) / step) + 1;
        double[] wavelength = new double[size];
        for (int i = 0; i < size; i++) {
            wavelength[i] = start + i * step;
        }
        return wavelength;
    }

    public static Spectrum spectrum(double[] wavelength, DoubleUnaryOperator flux, double error) {
        double[] fluxValues = Arrays.stream(wavelength).map(flux).toArray();
        double[] errorValues = new double[wavelength.length];
        Arrays.fill(errorValues, error);
        return Spectrum.of(wavelength, fluxValues, errorValues);
    }

    public static Spectrum spectrum(DoubleUnaryOperator flux) {
        return spectrum(halfPixelGrid(), flux, 0.01);
    }

    /**
     * Flat unit continuum with a box-shaped dip to {@code 1 - depth} strictly inside the integration window.
     */
    public static DoubleUnaryOperator boxDip(double depth) {
        return lambda -> INTEGRATION.containsStrictly(lambda) ? 1.0 - depth : 1.0;
    }

    public static DoubleUnaryOperator gaussianLine(double centre, double width, double depth, double slope) {
        return lambda -> (1.0 + slope * (lambda - 5000.0))
                * (1.0 - depth * Math.exp(-0.5 * Math.pow((lambda - centre) / width, 2)));
    }

    public static LineDefinition line(String label) {
        return new LineDefinition(label, INTEGRATION, CONTINUUM);
    }
}
