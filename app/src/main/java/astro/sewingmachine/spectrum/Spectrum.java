package astro.sewingmachine.spectrum;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Sampled spectrum: ascending, duplicate-free wavelengths with flux and an optional flux
 * error channel. Instances are immutable.
 */
public final class Spectrum {

    private final double[] wavelength;
    private final double[] flux;
    private final double[] error;

    private Spectrum(double[] wavelength, double[] flux, double[] error) {
        this.wavelength = wavelength;
        this.flux = flux;
        this.error = error;
    }

    public static Spectrum of(double[] wavelength, double[] flux) {
        return of(wavelength, flux, null);
    }

    /**
     * Builds a spectrum from parallel arrays, sorting by wavelength and keeping the first sample
     * of any repeated wavelength. {@code error} may be {@code null}.
     */
    public static Spectrum of(double[] wavelength, double[] flux, double[] error) {
        Objects.requireNonNull(wavelength, "wavelength");
        Objects.requireNonNull(flux, "flux");
        if (wavelength.length != flux.length) {
            throw new IllegalArgumentException("wavelength and flux lengths differ: " + wavelength.length + " vs " + flux.length);
        }
        if (error != null && error.length != wavelength.length) {
            throw new IllegalArgumentException("wavelength and error lengths differ: " + wavelength.length + " vs " + error.length);
        }
        for (double value : wavelength) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("wavelengths must be finite");
            }
        }
        int[] order = IntStream.range(0, wavelength.length)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> wavelength[i]))
                .mapToInt(Integer::intValue)
                .toArray();
        double[] sortedWavelength = new double[order.length];
        double[] sortedFlux = new double[order.length];
        double[] sortedError = error == null ? null : new double[order.length];
        int size = 0;
        for (int index : order) {
            if (size > 0 && sortedWavelength[size - 1] == wavelength[index]) {
                continue;
            }
            sortedWavelength[size] = wavelength[index];
            sortedFlux[size] = flux[index];
            if (sortedError != null) {
                sortedError[size] = error[index];
            }
            size++;
        }
        if (size < 2) {
            throw new IllegalArgumentException("a spectrum needs at least two distinct wavelengths");
        }
        return new Spectrum(Arrays.copyOf(sortedWavelength, size),
                Arrays.copyOf(sortedFlux, size),
                sortedError == null ? null : Arrays.copyOf(sortedError, size));
    }

    public int size() {
        return wavelength.length;
    }

    public double wavelength(int index) {
        return wavelength[index];
    }

    public double flux(int index) {
        return flux[index];
    }

    public boolean hasErrors() {
        return error != null;
    }

    public double error(int index) {
        if (error == null) {
            throw new IllegalStateException("spectrum has no error channel");
        }
        return error[index];
    }

    public double minWavelength() {
        return wavelength[0];
    }

    public double maxWavelength() {
        return wavelength[wavelength.length - 1];
    }

    public boolean covers(double lambda) {
        return lambda >= minWavelength() && lambda <= maxWavelength();
    }

    public double interpolateFlux(double lambda) {
        return interpolate(flux, lambda);
    }

    public double interpolateError(double lambda) {
        if (error == null) {
            throw new IllegalStateException("spectrum has no error channel");
        }
        return interpolate(error, lambda);
    }

    /**
     * Index of the first sample with wavelength strictly greater than {@code lambda}.
     */
    public int firstIndexAbove(double lambda) {
        int position = Arrays.binarySearch(wavelength, lambda);
        return position >= 0 ? position + 1 : -position - 1;
    }

    /**
     * Index of the first sample with wavelength greater than or equal to {@code lambda}.
     */
    public int firstIndexAtOrAbove(double lambda) {
        int position = Arrays.binarySearch(wavelength, lambda);
        return position >= 0 ? position : -position - 1;
    }

    /**
     * Linear interpolation of {@code values} at {@code lambda}; NaN outside the sampled range.
     */
    private double interpolate(double[] values, double lambda) {
        int position = Arrays.binarySearch(wavelength, lambda);
        if (position >= 0) {
            return values[position];
        }
        int upper = -position - 1;
        if (upper == 0 || upper == wavelength.length) {
            return Double.NaN;
        }
        int lower = upper - 1;
        double fraction = (lambda - wavelength[lower]) / (wavelength[upper] - wavelength[lower]);
        return values[lower] + fraction * (values[upper] - values[lower]);
    }
}
