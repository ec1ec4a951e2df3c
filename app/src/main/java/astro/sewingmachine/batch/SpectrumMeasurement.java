package astro.sewingmachine.batch;

import astro.sewingmachine.measure.FlagKind;
import astro.sewingmachine.measure.MeasurementResult;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Results for every line of a line list in one spectrum, in line-list order.
 */
public record SpectrumMeasurement(List<String> labels, List<MeasurementResult> results) {

    public SpectrumMeasurement {
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        if (labels.size() != results.size()) {
            throw new IllegalArgumentException("labels and results differ in length: " + labels.size() + " vs " + results.size());
        }
    }

    /**
     * All-NaN row for a spectrum that could not be measured.
     */
    public static SpectrumMeasurement unavailable(List<String> labels) {
        return new SpectrumMeasurement(labels, Collections.nCopies(labels.size(), MeasurementResult.unavailable()));
    }

    public int size() {
        return results.size();
    }

    public double[] ews() {
        return results.stream().mapToDouble(MeasurementResult::ew).toArray();
    }

    public double[] errors() {
        return results.stream().mapToDouble(MeasurementResult::error).toArray();
    }

    public List<Set<FlagKind>> flags() {
        return results.stream().map(MeasurementResult::flags).collect(Collectors.toUnmodifiableList());
    }
}
