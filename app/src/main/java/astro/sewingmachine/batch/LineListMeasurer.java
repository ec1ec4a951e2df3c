package astro.sewingmachine.batch;

import astro.sewingmachine.linelist.LineDefinition;
import astro.sewingmachine.linelist.LineList;
import astro.sewingmachine.measure.LineMeasurer;
import astro.sewingmachine.measure.LineTrace;
import astro.sewingmachine.measure.LineTraceListener;
import astro.sewingmachine.measure.MeasurementResult;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies a {@link LineMeasurer} to every line of a line list for one spectrum.
 */
public class LineListMeasurer {

    private final LineMeasurer lineMeasurer;
    private final LineTraceListener traceListener;

    public LineListMeasurer(LineMeasurer lineMeasurer) {
        this(lineMeasurer, LineTraceListener.NONE);
    }

    public LineListMeasurer(LineMeasurer lineMeasurer, LineTraceListener traceListener) {
        this.lineMeasurer = Objects.requireNonNull(lineMeasurer, "lineMeasurer");
        this.traceListener = Objects.requireNonNull(traceListener, "traceListener");
    }

    public SpectrumMeasurement measure(Spectrum spectrum, LineList lineList) {
        return measure("spectrum", spectrum, lineList);
    }

    public SpectrumMeasurement measure(String spectrumId, Spectrum spectrum, LineList lineList) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(lineList, "lineList");
        List<MeasurementResult> results = new ArrayList<>(lineList.size());
        for (LineDefinition line : lineList) {
            LineTrace trace = lineMeasurer.trace(spectrum, line);
            traceListener.onLine(spectrumId, trace);
            results.add(trace.result());
        }
        return new SpectrumMeasurement(lineList.labels(), results);
    }
}
