package astro.sewingmachine.config;

import astro.sewingmachine.catalog.DataRelease;
import astro.sewingmachine.measure.MeasurementSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable run configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path lineList,
        Optional<Path> catalog,
        Optional<Path> spectrum,
        Path spectraRoot,
        String spectrumPathTemplate,
        DataRelease dataRelease,
        Path outputPrefix,
        MeasurementSettings measurementSettings,
        int threads,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(lineList, "lineList");
        catalog = catalog == null ? Optional.empty() : catalog;
        spectrum = spectrum == null ? Optional.empty() : spectrum;
        Objects.requireNonNull(spectraRoot, "spectraRoot");
        spectrumPathTemplate = requireNonBlank(spectrumPathTemplate, "spectrumPathTemplate");
        if (!spectrumPathTemplate.contains("{id}")) {
            throw new IllegalArgumentException("spectrum path template must contain {id}: " + spectrumPathTemplate);
        }
        Objects.requireNonNull(dataRelease, "dataRelease");
        Objects.requireNonNull(outputPrefix, "outputPrefix");
        Objects.requireNonNull(measurementSettings, "measurementSettings");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        if (mode == Mode.CATALOG && catalog.isEmpty()) {
            throw new IllegalArgumentException("a catalog must be given in catalog mode");
        }
        if (mode == Mode.SPECTRUM && spectrum.isEmpty()) {
            throw new IllegalArgumentException("a spectrum file must be given in spectrum mode");
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
