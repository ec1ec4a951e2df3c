package astro.sewingmachine.measure;

import astro.sewingmachine.linelist.Window;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Places a linear continuum through the pixels of a line's continuum windows, dropping
 * near-zero pixels and, optionally, clipping outliers once before refitting.
 */
public class ContinuumFitter {

    private static final int MIN_SAMPLES = 2;

    private final MeasurementSettings settings;

    public ContinuumFitter(MeasurementSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ContinuumFitResult fit(Spectrum spectrum, List<Window> windows) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(windows, "windows");
        int[] indices = maskedIndices(spectrum, windows);
        int count = indices.length;
        double[] wavelength = new double[count];
        double[] flux = new double[count];
        boolean[] usable = new boolean[count];
        Set<FlagKind> flags = EnumSet.noneOf(FlagKind.class);

        int usableCount = 0;
        for (int k = 0; k < count; k++) {
            wavelength[k] = spectrum.wavelength(indices[k]);
            flux[k] = spectrum.flux(indices[k]);
            usable[k] = !settings.excludeBadPixels() || !settings.isBadPixel(flux[k]);
            if (usable[k]) {
                usableCount++;
            } else {
                flags.add(FlagKind.CONTINUUM_BAD_PIXEL);
            }
        }
        if (usableCount < MIN_SAMPLES) {
            flags.add(FlagKind.CONTINUUM_ALL_BAD);
            return new ContinuumFitResult(wavelength, flux, usable, new boolean[count], Optional.empty(), Optional.empty(), flags);
        }

        ContinuumFit initial = regress(wavelength, flux, usable);
        if (!settings.sigmaClip()) {
            return new ContinuumFitResult(wavelength, flux, usable, usable, Optional.of(initial), Optional.of(initial), flags);
        }

        boolean[] kept = clip(wavelength, flux, usable, initial);
        int keptCount = 0;
        for (boolean value : kept) {
            if (value) {
                keptCount++;
            }
        }
        if (keptCount < MIN_SAMPLES) {
            flags.add(FlagKind.CONTINUUM_ALL_CLIPPED);
            return new ContinuumFitResult(wavelength, flux, usable, kept, Optional.of(initial), Optional.empty(), flags);
        }
        ContinuumFit refit = regress(wavelength, flux, kept);
        return new ContinuumFitResult(wavelength, flux, usable, kept, Optional.of(initial), Optional.of(refit), flags);
    }

    /**
     * Single pass: pixels whose absolute residual exceeds {@code sigma} times the population
     * standard deviation of the residuals are dropped.
     */
    private boolean[] clip(double[] wavelength, double[] flux, boolean[] usable, ContinuumFit fit) {
        double[] residual = new double[wavelength.length];
        double[] usableResiduals = new double[wavelength.length];
        int usableCount = 0;
        for (int k = 0; k < wavelength.length; k++) {
            residual[k] = flux[k] - fit.evaluate(wavelength[k]);
            if (usable[k]) {
                usableResiduals[usableCount++] = residual[k];
            }
        }
        double std = new StandardDeviation(false).evaluate(usableResiduals, 0, usableCount);
        double threshold = settings.sigma() * std;
        boolean[] kept = new boolean[wavelength.length];
        for (int k = 0; k < wavelength.length; k++) {
            kept[k] = usable[k] && !(Math.abs(residual[k]) > threshold);
        }
        return kept;
    }

    private static ContinuumFit regress(double[] wavelength, double[] flux, boolean[] include) {
        SimpleRegression regression = new SimpleRegression(true);
        for (int k = 0; k < wavelength.length; k++) {
            if (include[k]) {
                regression.addData(wavelength[k], flux[k]);
            }
        }
        return new ContinuumFit(regression.getSlope(), regression.getIntercept());
    }

    /**
     * Indices of all samples inside any of the windows, ascending and without repeats.
     */
    private static int[] maskedIndices(Spectrum spectrum, List<Window> windows) {
        boolean[] mask = new boolean[spectrum.size()];
        for (Window window : windows) {
            int index = spectrum.firstIndexAtOrAbove(window.lo());
            while (index < spectrum.size() && spectrum.wavelength(index) <= window.hi()) {
                mask[index] = true;
                index++;
            }
        }
        int[] indices = new int[spectrum.size()];
        int count = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                indices[count++] = i;
            }
        }
        return Arrays.copyOf(indices, count);
    }
}
