package astro.sewingmachine.spectrum;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import astro.sewingmachine.catalog.CatalogEntry;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FitsSpectrumProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void resolvesPathFromTemplate() {
        FitsSpectrumProvider provider = new FitsSpectrumProvider(tempDir, "{location}/apStar-{id}.fits");

        assertThat(provider.resolve(CatalogEntry.of(0, "M67", "2M0001")))
                .isEqualTo(tempDir.resolve("M67").resolve("apStar-2M0001.fits"));
    }

    @Test
    void rejectsTemplateWithoutIdentifier() {
        assertThatThrownBy(() -> new FitsSpectrumProvider(tempDir, "{location}/spectrum.fits"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingFileIsUnavailable() {
        FitsSpectrumProvider provider = new FitsSpectrumProvider(tempDir);

        assertThatThrownBy(() -> provider.fetch(CatalogEntry.of(0, "M67", "2M0001")))
                .isInstanceOf(SpectrumUnavailableException.class)
                .hasMessageContaining("aspcapStar-2M0001.fits");
    }

    @Test
    void buildsLogarithmicGridByDefault() throws Exception {
        Header header = new Header();
        header.addValue("CRVAL1", 4.0, "log10 start");
        header.addValue("CDELT1", 0.001, "log10 step");

        double[] grid = FitsSpectrumProvider.wavelengthGrid(header, 3);

        assertThat(grid[0]).isCloseTo(10000.0, within(1e-6));
        assertThat(grid[2]).isCloseTo(Math.pow(10.0, 4.002), within(1e-6));
    }

    @Test
    void buildsLinearGridWhenFlagged() throws Exception {
        Header header = new Header();
        header.addValue("CRVAL1", 5000.0, "start");
        header.addValue("CDELT1", 0.5, "step");
        header.addValue("CRPIX1", 2.0, "reference pixel");
        header.addValue("DC-FLAG", 0, "linear");

        assertThat(FitsSpectrumProvider.wavelengthGrid(header, 3)).containsExactly(4999.5, 5000.0, 5000.5);
    }

    @Test
    void readsFluxAndErrorExtensions() throws Exception {
        Path file = tempDir.resolve("M67").resolve("aspcapStar-2M0001.fits");
        Files.createDirectories(file.getParent());
        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(new float[] {0f}));
            BasicHDU<?> fluxHdu = Fits.makeHDU(new float[] {1.0f, 0.5f, 1.0f, 1.0f});
            fluxHdu.addValue("CRVAL1", 4.179, "log10 start wavelength");
            fluxHdu.addValue("CDELT1", 6e-6, "log10 step");
            fits.addHDU(fluxHdu);
            fits.addHDU(Fits.makeHDU(new float[] {0.01f, 0.02f, 0.01f, 0.01f}));
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(file)))) {
                fits.write(out);
            }
        }

        Spectrum spectrum = new FitsSpectrumProvider(tempDir).fetch(CatalogEntry.of(0, "M67", "2M0001"));

        assertThat(spectrum.size()).isEqualTo(4);
        assertThat(spectrum.minWavelength()).isCloseTo(Math.pow(10.0, 4.179), within(1e-6));
        assertThat(spectrum.flux(1)).isCloseTo(0.5, within(1e-6));
        assertThat(spectrum.error(1)).isCloseTo(0.02, within(1e-6));
    }
}
