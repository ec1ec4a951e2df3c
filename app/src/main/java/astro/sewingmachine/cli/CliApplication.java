package astro.sewingmachine.cli;

import astro.sewingmachine.batch.CatalogMeasurement;
import astro.sewingmachine.batch.CatalogMeasurer;
import astro.sewingmachine.batch.CatalogRow;
import astro.sewingmachine.batch.LineListMeasurer;
import astro.sewingmachine.batch.RowStatus;
import astro.sewingmachine.batch.SpectrumMeasurement;
import astro.sewingmachine.catalog.CatalogEntry;
import astro.sewingmachine.catalog.CatalogFormatException;
import astro.sewingmachine.catalog.CatalogReader;
import astro.sewingmachine.config.Config;
import astro.sewingmachine.config.ConfigLoader;
import astro.sewingmachine.config.SystemEnvironmentReader;
import astro.sewingmachine.linelist.LineList;
import astro.sewingmachine.linelist.LineListParseException;
import astro.sewingmachine.linelist.LineListParser;
import astro.sewingmachine.logging.LoggingConfigurator;
import astro.sewingmachine.measure.LineMeasurer;
import astro.sewingmachine.output.ResultTableWriter;
import astro.sewingmachine.spectrum.FitsSpectrumProvider;
import astro.sewingmachine.spectrum.Spectrum;
import astro.sewingmachine.spectrum.SpectrumProvider;
import astro.sewingmachine.spectrum.SpectrumUnavailableException;
import astro.sewingmachine.spectrum.TextSpectrumReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and measurement pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;
    private static final int PROGRESS_INTERVAL = 500;

    private final ConfigLoader configLoader;
    private final LineListParser lineListParser;
    private final Function<Config, SpectrumProvider> spectrumProviderFactory;
    private final ResultTableWriter resultTableWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new LineListParser(),
                config -> new FitsSpectrumProvider(config.spectraRoot(), config.spectrumPathTemplate()),
                new ResultTableWriter());
    }

    CliApplication(ConfigLoader configLoader, LineListParser lineListParser,
                   Function<Config, SpectrumProvider> spectrumProviderFactory, ResultTableWriter resultTableWriter) {
        this.configLoader = configLoader;
        this.lineListParser = lineListParser;
        this.spectrumProviderFactory = spectrumProviderFactory;
        this.resultTableWriter = resultTableWriter;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode: linelist={} settings={}", config.mode(), config.lineList(), config.measurementSettings());

        try {
            LineList lineList = lineListParser.parse(config.lineList());
            LOGGER.info("Loaded {} lines: {}", lineList.size(), String.join(", ", lineList.labels()));
            LineListMeasurer lineListMeasurer = new LineListMeasurer(new LineMeasurer(config.measurementSettings()));
            CatalogMeasurement measurement = switch (config.mode()) {
                case CATALOG -> measureCatalog(config, lineList, lineListMeasurer);
                case SPECTRUM -> measureSpectrum(config, lineList, lineListMeasurer);
            };
            List<Path> written = resultTableWriter.write(config.outputPrefix(), measurement);
            written.forEach(path -> LOGGER.info("Wrote {}", path));
            return 0;
        } catch (LineListParseException ex) {
            LOGGER.error("Invalid line list: {}", ex.getMessage());
        } catch (CatalogFormatException ex) {
            LOGGER.error("Invalid catalog: {}", ex.getMessage(), ex);
        } catch (SpectrumUnavailableException ex) {
            LOGGER.error("Spectrum unavailable: {}", ex.getMessage());
        } catch (UncheckedIOException ex) {
            LOGGER.error("Failed to write results: {}", ex.getMessage(), ex);
        }
        return EXIT_FAILURE;
    }

    private CatalogMeasurement measureCatalog(Config config, LineList lineList, LineListMeasurer lineListMeasurer) {
        Path catalogPath = config.catalog().orElseThrow();
        List<CatalogEntry> entries = CatalogReader.forPath(catalogPath).read(catalogPath, config.dataRelease());
        SpectrumProvider provider = spectrumProviderFactory.apply(config);
        CatalogMeasurer catalogMeasurer = new CatalogMeasurer(provider, lineListMeasurer, config.threads(), PROGRESS_INTERVAL);
        return catalogMeasurer.measure(entries, lineList);
    }

    private CatalogMeasurement measureSpectrum(Config config, LineList lineList, LineListMeasurer lineListMeasurer) {
        Path spectrumPath = config.spectrum().orElseThrow();
        Spectrum spectrum = new TextSpectrumReader().read(spectrumPath);
        String id = spectrumPath.getFileName().toString();
        SpectrumMeasurement measurement = lineListMeasurer.measure(id, spectrum, lineList);
        for (int i = 0; i < lineList.size(); i++) {
            LOGGER.info("{}: EW={} err={} flags={}", lineList.labels().get(i),
                    measurement.results().get(i).ew(), measurement.results().get(i).error(), measurement.results().get(i).flags());
        }
        return new CatalogMeasurement(lineList.labels(), List.of(new CatalogRow(id, RowStatus.MEASURED, measurement)));
    }
}
