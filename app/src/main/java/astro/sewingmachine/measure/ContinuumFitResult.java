package astro.sewingmachine.measure;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of placing the continuum for one line. The sample arrays hold every pixel inside the
 * continuum windows in wavelength order; {@code usable} marks those that passed the bad-pixel
 * check and {@code kept} those that also survived clipping. The arrays are copied on the way in
 * and out; equality compares them by reference.
 */
public record ContinuumFitResult(double[] wavelength,
                                 double[] flux,
                                 boolean[] usable,
                                 boolean[] kept,
                                 Optional<ContinuumFit> initialFit,
                                 Optional<ContinuumFit> fit,
                                 Set<FlagKind> flags) {

    public ContinuumFitResult {
        wavelength = wavelength.clone();
        flux = flux.clone();
        usable = usable.clone();
        kept = kept.clone();
        Objects.requireNonNull(initialFit, "initialFit");
        Objects.requireNonNull(fit, "fit");
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
    public boolean[] usable() {
        return usable.clone();
    }

    @Override
    public boolean[] kept() {
        return kept.clone();
    }

    public boolean succeeded() {
        return fit.isPresent();
    }

    public int keptCount() {
        int count = 0;
        for (boolean value : kept) {
            if (value) {
                count++;
            }
        }
        return count;
    }
}
