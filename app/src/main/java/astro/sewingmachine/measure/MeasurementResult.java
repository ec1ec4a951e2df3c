package astro.sewingmachine.measure;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Equivalent width of one line in one spectrum with its uncertainty and flags. Both numbers
 * are NaN when they could not be determined.
 */
public record MeasurementResult(double ew, double error, Set<FlagKind> flags) {

    public MeasurementResult {
        Objects.requireNonNull(flags, "flags");
        flags = flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static MeasurementResult failed(Collection<FlagKind> flags) {
        return new MeasurementResult(Double.NaN, Double.NaN, flags.isEmpty() ? Set.of() : EnumSet.copyOf(flags));
    }

    public static MeasurementResult unavailable() {
        return new MeasurementResult(Double.NaN, Double.NaN, Set.of());
    }

    public boolean hasFlag(FlagKind flag) {
        return flags.contains(flag);
    }

    public boolean isMeasured() {
        return !Double.isNaN(ew);
    }
}
