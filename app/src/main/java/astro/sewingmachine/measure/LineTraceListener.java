package astro.sewingmachine.measure;

/**
 * Receives the intermediate values of every line measurement, e.g. to plot them.
 * Implementations must tolerate calls from several worker threads.
 */
@FunctionalInterface
public interface LineTraceListener {

    LineTraceListener NONE = (spectrumId, trace) -> { };

    void onLine(String spectrumId, LineTrace trace);
}
