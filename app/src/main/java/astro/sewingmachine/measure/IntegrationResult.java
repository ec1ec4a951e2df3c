package astro.sewingmachine.measure;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Equivalent width of one window together with the samples it was integrated over. The arrays
 * are copied on the way in and out; equality compares them by reference.
 */
public record IntegrationResult(double ew,
                                double[] wavelength,
                                double[] flux,
                                double[] continuum,
                                Set<FlagKind> flags) {

    public IntegrationResult {
        wavelength = wavelength.clone();
        flux = flux.clone();
        continuum = continuum.clone();
        Objects.requireNonNull(flags, "flags");
        flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    @Override
    public double[] wavelength() {
        return wavelength.clone();
    }

    @Override
    public double[] flux() {
        return flux.clone();
    }

    @Override
    public double[] continuum() {
        return continuum.clone();
    }
}
