package astro.sewingmachine.config;

import astro.sewingmachine.catalog.DataRelease;
import astro.sewingmachine.cli.CliArguments;
import astro.sewingmachine.measure.MeasurementSettings;
import astro.sewingmachine.spectrum.FitsSpectrumProvider;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LINELIST = "SEWING_LINELIST";
    static final String ENV_CATALOG = "SEWING_CATALOG";
    static final String ENV_SPECTRA_ROOT = "SEWING_SPECTRA_ROOT";
    static final String ENV_SPECTRUM_PATH_TEMPLATE = "SEWING_SPECTRUM_PATH_TEMPLATE";
    static final String ENV_DATA_RELEASE = "SEWING_DATA_RELEASE";
    static final String ENV_OUTPUT_PREFIX = "SEWING_OUTPUT_PREFIX";
    static final String ENV_SIGMA = "SEWING_SIGMA";
    static final String ENV_SIGMA_CLIP = "SEWING_SIGMA_CLIP";
    static final String ENV_BAD_PIXEL_THRESHOLD = "SEWING_BAD_PIXEL_THRESHOLD";
    static final String ENV_THREADS = "SEWING_THREADS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OUTPUT_PREFIX = "ews";
    private static final int DEFAULT_THREADS = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path lineList = resolvePath(arguments.lineList(), ENV_LINELIST)
                .orElseThrow(() -> new IllegalArgumentException("a line list must be provided (--linelist or " + ENV_LINELIST + ")"));
        Optional<Path> spectrum = Optional.ofNullable(arguments.spectrum());
        Optional<Path> catalog = resolvePath(arguments.catalog(), ENV_CATALOG);
        Mode mode = resolveMode(arguments, spectrum);
        if (mode == Mode.SPECTRUM && arguments.catalog() != null) {
            throw new IllegalArgumentException("--catalog and --spectrum cannot be combined");
        }
        if (mode == Mode.SPECTRUM) {
            catalog = Optional.empty();
        }

        Path spectraRoot = resolvePath(arguments.spectraRoot(), ENV_SPECTRA_ROOT).orElse(Path.of("."));
        String pathTemplate = firstNonBlank(arguments.spectrumPathTemplate(), ENV_SPECTRUM_PATH_TEMPLATE,
                FitsSpectrumProvider.DEFAULT_PATH_TEMPLATE);
        DataRelease dataRelease = DataRelease.from(firstNonBlank(arguments.dataRelease(), ENV_DATA_RELEASE, null));
        Path outputPrefix = resolvePath(arguments.outputPrefix(), ENV_OUTPUT_PREFIX).orElse(Path.of(DEFAULT_OUTPUT_PREFIX));

        MeasurementSettings settings = resolveMeasurementSettings(arguments);
        int threads = resolveThreads(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(mode, lineList, catalog, spectrum, spectraRoot, pathTemplate, dataRelease, outputPrefix,
                settings, threads, logFormat);
    }

    private Mode resolveMode(CliArguments arguments, Optional<Path> spectrum) {
        if (arguments.mode() != null) {
            return arguments.mode();
        }
        return spectrum.isPresent() ? Mode.SPECTRUM : Mode.CATALOG;
    }

    private MeasurementSettings resolveMeasurementSettings(CliArguments arguments) {
        boolean sigmaClip = !arguments.noSigmaClip() && environmentReader.get(ENV_SIGMA_CLIP)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseBoolean)
                .orElse(true);
        double sigma = Optional.ofNullable(arguments.sigma())
                .or(() -> environmentReader.get(ENV_SIGMA)
                        .filter(ConfigLoader::isNotBlank)
                        .map(raw -> parseDouble(raw, ENV_SIGMA)))
                .orElse(MeasurementSettings.DEFAULT_SIGMA);
        double threshold = Optional.ofNullable(arguments.badPixelThreshold())
                .or(() -> environmentReader.get(ENV_BAD_PIXEL_THRESHOLD)
                        .filter(ConfigLoader::isNotBlank)
                        .map(raw -> parseDouble(raw, ENV_BAD_PIXEL_THRESHOLD)))
                .orElse(MeasurementSettings.DEFAULT_BAD_PIXEL_THRESHOLD);
        return new MeasurementSettings(sigmaClip, sigma, !arguments.keepBadPixels(), threshold, !arguments.noErrors());
    }

    private int resolveThreads(CliArguments arguments) {
        Integer threads = arguments.threads();
        if (threads != null) {
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1");
            }
            return threads;
        }
        return environmentReader.get(ENV_THREADS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(DEFAULT_THREADS);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw) {
        String value = raw.trim();
        return value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes");
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_THREADS + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_THREADS + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String key) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, ex);
        }
    }
}
