package astro.sewingmachine.spectrum;

import astro.sewingmachine.catalog.CatalogEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads per-star spectra laid out like ASPCAP {@code aspcapStar} files: flux in HDU 1, flux
 * error in HDU 2, and a wavelength grid described by the flux HDU's {@code CRVAL1},
 * {@code CDELT1} and {@code CRPIX1} keywords. The grid is log-linear unless {@code DC-FLAG} is 0.
 */
public class FitsSpectrumProvider implements SpectrumProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(FitsSpectrumProvider.class);

    public static final String DEFAULT_PATH_TEMPLATE = "{location}/aspcapStar-{id}.fits";
    static final double APSTAR_CRVAL1 = 4.179;
    static final double APSTAR_CDELT1 = 6e-6;

    private static final int FLUX_HDU = 1;
    private static final int ERROR_HDU = 2;

    private final Path root;
    private final String pathTemplate;

    public FitsSpectrumProvider(Path root) {
        this(root, DEFAULT_PATH_TEMPLATE);
    }

    public FitsSpectrumProvider(Path root, String pathTemplate) {
        this.root = Objects.requireNonNull(root, "root");
        this.pathTemplate = Objects.requireNonNull(pathTemplate, "pathTemplate");
        if (!pathTemplate.contains("{id}")) {
            throw new IllegalArgumentException("spectrum path template must contain {id}: " + pathTemplate);
        }
    }

    @Override
    public Spectrum fetch(CatalogEntry entry) {
        Path file = resolve(entry);
        if (!Files.isRegularFile(file)) {
            throw new SpectrumUnavailableException("Spectrum file not found: " + file);
        }
        LOGGER.debug("Reading spectrum {}", file);
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> fluxHdu = fits.getHDU(FLUX_HDU);
            BasicHDU<?> errorHdu = fits.getHDU(ERROR_HDU);
            if (fluxHdu == null || errorHdu == null) {
                throw new SpectrumUnavailableException("Spectrum file " + file + " lacks flux or error extension");
            }
            double[] flux = toDoubles(fluxHdu.getKernel(), file);
            double[] error = toDoubles(errorHdu.getKernel(), file);
            if (flux.length != error.length) {
                throw new SpectrumUnavailableException(String.format("Spectrum file %s has %d flux but %d error samples",
                        file, flux.length, error.length));
            }
            double[] wavelength = wavelengthGrid(fluxHdu.getHeader(), flux.length);
            return Spectrum.of(wavelength, flux, error);
        } catch (FitsException | IOException ex) {
            throw new SpectrumUnavailableException("Failed to read spectrum file " + file, ex);
        }
    }

    Path resolve(CatalogEntry entry) {
        String relative = pathTemplate
                .replace("{location}", entry.locationKey())
                .replace("{id}", entry.objectId());
        return root.resolve(relative);
    }

    static double[] wavelengthGrid(Header header, int size) {
        double start = header.getDoubleValue("CRVAL1", APSTAR_CRVAL1);
        double step = header.getDoubleValue("CDELT1", APSTAR_CDELT1);
        double referencePixel = header.getDoubleValue("CRPIX1", 1.0);
        boolean logarithmic = header.getIntValue("DC-FLAG", 1) != 0;
        double[] wavelength = new double[size];
        for (int i = 0; i < size; i++) {
            double coordinate = start + step * (i + 1 - referencePixel);
            wavelength[i] = logarithmic ? Math.pow(10.0, coordinate) : coordinate;
        }
        return wavelength;
    }

    private static double[] toDoubles(Object kernel, Path file) {
        if (kernel instanceof float[] values) {
            double[] converted = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                converted[i] = values[i];
            }
            return converted;
        }
        if (kernel instanceof double[] values) {
            return values.clone();
        }
        if (kernel instanceof Object[] rows && rows.length == 1) {
            return toDoubles(rows[0], file);
        }
        throw new SpectrumUnavailableException("Unsupported spectrum data layout in " + file + ": "
                + (kernel == null ? "empty" : kernel.getClass().getSimpleName()));
    }
}
