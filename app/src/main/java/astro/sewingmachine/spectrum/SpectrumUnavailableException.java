package astro.sewingmachine.spectrum;

/**
 * Signals that a spectrum could not be found or read for a catalog entry.
 */
public class SpectrumUnavailableException extends RuntimeException {

    public SpectrumUnavailableException(String message) {
        super(message);
    }

    public SpectrumUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
