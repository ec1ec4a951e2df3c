package astro.sewingmachine.output;

import astro.sewingmachine.batch.CatalogMeasurement;
import astro.sewingmachine.batch.CatalogRow;
import astro.sewingmachine.measure.FlagKind;
import astro.sewingmachine.measure.MeasurementResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes catalog results as three CSV tables sharing one layout: {@code <prefix>_ew.csv},
 * {@code <prefix>_err.csv} and {@code <prefix>_flags.csv}. The first column holds the row id,
 * the others follow line-list order.
 */
public class ResultTableWriter {

    static final String EW_SUFFIX = "_ew.csv";
    static final String ERROR_SUFFIX = "_err.csv";
    static final String FLAGS_SUFFIX = "_flags.csv";

    public List<Path> write(Path prefix, CatalogMeasurement measurement) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(measurement, "measurement");
        List<Path> written = new ArrayList<>();
        written.add(writeTable(sibling(prefix, EW_SUFFIX), measurement, result -> formatNumber(result.ew())));
        written.add(writeTable(sibling(prefix, ERROR_SUFFIX), measurement, result -> formatNumber(result.error())));
        written.add(writeTable(sibling(prefix, FLAGS_SUFFIX), measurement, result -> formatFlags(result)));
        return written;
    }

    private Path writeTable(Path target, CatalogMeasurement measurement, Function<MeasurementResult, String> cell) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                writer.write("id");
                for (String label : measurement.labels()) {
                    writer.write(',');
                    writer.write(escape(label));
                }
                writer.newLine();
                for (CatalogRow row : measurement.rows()) {
                    writer.write(escape(row.id()));
                    for (MeasurementResult result : row.measurement().results()) {
                        writer.write(',');
                        writer.write(cell.apply(result));
                    }
                    writer.newLine();
                }
            }
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write result table: " + target, ex);
        }
    }

    private static Path sibling(Path prefix, String suffix) {
        return prefix.resolveSibling(prefix.getFileName().toString() + suffix);
    }

    static String formatNumber(double value) {
        return Double.isNaN(value) ? "NaN" : Double.toString(value);
    }

    private static String formatFlags(MeasurementResult result) {
        return result.flags().stream()
                .map(FlagKind::name)
                .collect(Collectors.joining("|"));
    }

    private static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
