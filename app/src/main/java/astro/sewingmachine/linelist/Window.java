package astro.sewingmachine.linelist;

/**
 * Closed wavelength interval {@code [lo, hi]}.
 */
public record Window(double lo, double hi) {

    public Window {
        if (!Double.isFinite(lo) || !Double.isFinite(hi)) {
            throw new IllegalArgumentException("window bounds must be finite: [" + lo + ", " + hi + "]");
        }
        if (lo >= hi) {
            throw new IllegalArgumentException("window lower bound must be below upper bound: [" + lo + ", " + hi + "]");
        }
    }

    public boolean contains(double wavelength) {
        return wavelength >= lo && wavelength <= hi;
    }

    public boolean containsStrictly(double wavelength) {
        return wavelength > lo && wavelength < hi;
    }

    public boolean overlaps(Window other) {
        return lo <= other.hi && other.lo <= hi;
    }

    public double width() {
        return hi - lo;
    }
}
