package astro.sewingmachine.cli;

import astro.sewingmachine.config.LogFormat;
import astro.sewingmachine.config.Mode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "sewingmachine", mixinStandardHelpOptions = true, version = "sewingmachine 0.1.0",
        description = "Measures spectral-line equivalent widths in stellar spectra")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Run mode: catalog or spectrum (default: spectrum when --spectrum is given)")
    private Mode mode;

    @CommandLine.Option(names = {"-l", "--linelist"}, description = "Line list file (columns Label, i_b, i_r, cont)", paramLabel = "FILE")
    private Path lineList;

    @CommandLine.Option(names = {"-c", "--catalog"}, description = "Catalog of spectra to measure (FITS binary table or CSV)", paramLabel = "FILE")
    private Path catalog;

    @CommandLine.Option(names = {"-s", "--spectrum"}, description = "Single text spectrum to measure (wavelength, flux[, error])", paramLabel = "FILE")
    private Path spectrum;

    @CommandLine.Option(names = "--spectra-root", description = "Directory holding the catalog's spectrum files", paramLabel = "DIR")
    private Path spectraRoot;

    @CommandLine.Option(names = "--path-template", description = "Spectrum path below the root, with {location} and {id} placeholders", paramLabel = "TEMPLATE")
    private String spectrumPathTemplate;

    @CommandLine.Option(names = "--data-release", description = "Survey data release of the catalog, e.g. 16 or DR13", paramLabel = "DR")
    private String dataRelease;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Prefix of the result tables", paramLabel = "PREFIX")
    private Path outputPrefix;

    @CommandLine.Option(names = "--sigma", description = "Continuum clipping threshold in standard deviations", paramLabel = "N")
    private Double sigma;

    @CommandLine.Option(names = "--no-sigma-clip", description = "Fit the continuum without clipping outliers")
    private boolean noSigmaClip;

    @CommandLine.Option(names = "--keep-bad-pixels", description = "Keep near-zero continuum pixels in the fit")
    private boolean keepBadPixels;

    @CommandLine.Option(names = "--bad-pixel-threshold", description = "Flux below which a pixel counts as bad", paramLabel = "FLUX")
    private Double badPixelThreshold;

    @CommandLine.Option(names = "--no-errors", description = "Skip error propagation")
    private boolean noErrors;

    @CommandLine.Option(names = {"-t", "--threads"}, description = "Worker threads for catalog runs", paramLabel = "COUNT")
    private Integer threads;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Mode mode() {
        return mode;
    }

    public Path lineList() {
        return lineList;
    }

    public Path catalog() {
        return catalog;
    }

    public Path spectrum() {
        return spectrum;
    }

    public Path spectraRoot() {
        return spectraRoot;
    }

    public String spectrumPathTemplate() {
        return spectrumPathTemplate;
    }

    public String dataRelease() {
        return dataRelease;
    }

    public Path outputPrefix() {
        return outputPrefix;
    }

    public Double sigma() {
        return sigma;
    }

    public boolean noSigmaClip() {
        return noSigmaClip;
    }

    public boolean keepBadPixels() {
        return keepBadPixels;
    }

    public Double badPixelThreshold() {
        return badPixelThreshold;
    }

    public boolean noErrors() {
        return noErrors;
    }

    public Integer threads() {
        return threads;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
