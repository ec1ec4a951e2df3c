package astro.sewingmachine.measure;

import astro.sewingmachine.linelist.Window;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Integrates {@code 1 - flux / continuum} over an integration window with the trapezoidal
 * rule. The window edges are included as linearly interpolated fractional pixels, so the
 * integral covers exactly {@code [lo, hi]}.
 */
public class LineIntegrator {

    private final double badPixelThreshold;

    public LineIntegrator(double badPixelThreshold) {
        this.badPixelThreshold = badPixelThreshold;
    }

    public IntegrationResult integrate(Spectrum spectrum, Window window, ContinuumFit continuumFit) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(continuumFit, "continuumFit");
        Set<FlagKind> flags = EnumSet.noneOf(FlagKind.class);
        if (!AugmentedSamples.covered(spectrum, window)) {
            flags.add(FlagKind.INTEGRATION_OUT_OF_RANGE);
            return new IntegrationResult(Double.NaN, new double[0], new double[0], new double[0], flags);
        }

        AugmentedSamples samples = AugmentedSamples.ofFlux(spectrum, window);
        int size = samples.size();
        double[] continuum = new double[size];
        double[] depth = new double[size];
        for (int k = 0; k < size; k++) {
            double flux = samples.value(k);
            if (!(flux >= badPixelThreshold)) {
                flags.add(FlagKind.INTEGRATION_BAD_PIXEL);
            }
            continuum[k] = continuumFit.evaluate(samples.wavelength(k));
            depth[k] = 1.0 - flux / continuum[k];
        }

        double ew = 0.0;
        for (int k = 0; k < size - 1; k++) {
            double step = samples.wavelength(k + 1) - samples.wavelength(k);
            ew += 0.5 * (depth[k] + depth[k + 1]) * step;
        }
        return new IntegrationResult(ew, samples.wavelengths(), samples.values(), continuum, flags);
    }
}
