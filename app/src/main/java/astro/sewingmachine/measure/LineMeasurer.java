package astro.sewingmachine.measure;

import astro.sewingmachine.linelist.LineDefinition;
import astro.sewingmachine.spectrum.Spectrum;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures one line in one spectrum: continuum fit, integration and error propagation.
 * Continuum failures come back as a NaN result with the reason flagged; they are never thrown.
 */
public class LineMeasurer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineMeasurer.class);

    private final MeasurementSettings settings;
    private final ContinuumFitter continuumFitter;
    private final LineIntegrator lineIntegrator;
    private final ErrorPropagator errorPropagator;

    public LineMeasurer(MeasurementSettings settings) {
        this(settings, new ContinuumFitter(settings), new LineIntegrator(settings.badPixelThreshold()), new ErrorPropagator());
    }

    public LineMeasurer(MeasurementSettings settings, ContinuumFitter continuumFitter,
                        LineIntegrator lineIntegrator, ErrorPropagator errorPropagator) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.continuumFitter = Objects.requireNonNull(continuumFitter, "continuumFitter");
        this.lineIntegrator = Objects.requireNonNull(lineIntegrator, "lineIntegrator");
        this.errorPropagator = Objects.requireNonNull(errorPropagator, "errorPropagator");
    }

    public MeasurementSettings settings() {
        return settings;
    }

    public MeasurementResult measure(Spectrum spectrum, LineDefinition line) {
        return trace(spectrum, line).result();
    }

    public LineTrace trace(Spectrum spectrum, LineDefinition line) {
        Objects.requireNonNull(spectrum, "spectrum");
        Objects.requireNonNull(line, "line");
        ContinuumFitResult continuum = continuumFitter.fit(spectrum, line.continuumWindows());
        if (!continuum.succeeded()) {
            LOGGER.debug("No continuum for line {}: {}", line.label(), continuum.flags());
            return new LineTrace(line.label(), continuum, null, MeasurementResult.failed(continuum.flags()));
        }

        IntegrationResult integration = lineIntegrator.integrate(spectrum, line.integration(), continuum.fit().get());
        Set<FlagKind> flags = EnumSet.noneOf(FlagKind.class);
        flags.addAll(continuum.flags());
        flags.addAll(integration.flags());
        if (flags.contains(FlagKind.INTEGRATION_OUT_OF_RANGE)) {
            LOGGER.debug("Integration window {} of line {} is outside the spectrum", line.integration(), line.label());
            return new LineTrace(line.label(), continuum, integration, MeasurementResult.failed(flags));
        }

        double error = settings.propagateErrors()
                ? errorPropagator.propagate(spectrum, line.integration())
                : Double.NaN;
        return new LineTrace(line.label(), continuum, integration, new MeasurementResult(integration.ew(), error, flags));
    }
}
