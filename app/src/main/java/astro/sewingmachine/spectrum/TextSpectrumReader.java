package astro.sewingmachine.spectrum;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reads two- or three-column text spectra (wavelength, flux, optional error) separated by
 * whitespace or commas. Lines starting with {@code #} and a non-numeric header line are skipped.
 */
public class TextSpectrumReader {

    public Spectrum read(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new SpectrumUnavailableException("Spectrum file not found: " + file);
        }
        double[] wavelength = new double[256];
        double[] flux = new double[256];
        double[] error = new double[256];
        int size = 0;
        Boolean withErrors = null;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] cells = trimmed.split("[\\s,]+");
                if (size == 0 && withErrors == null && !isNumeric(cells[0])) {
                    continue;
                }
                if (cells.length < 2) {
                    throw new SpectrumUnavailableException(String.format("%s:%d: expected at least two columns", file, lineNumber));
                }
                boolean rowHasError = cells.length >= 3;
                if (withErrors == null) {
                    withErrors = rowHasError;
                } else if (withErrors != rowHasError) {
                    throw new SpectrumUnavailableException(String.format("%s:%d: inconsistent column count", file, lineNumber));
                }
                if (size == wavelength.length) {
                    wavelength = Arrays.copyOf(wavelength, size * 2);
                    flux = Arrays.copyOf(flux, size * 2);
                    error = Arrays.copyOf(error, size * 2);
                }
                wavelength[size] = parse(cells[0], file, lineNumber);
                flux[size] = parse(cells[1], file, lineNumber);
                if (rowHasError) {
                    error[size] = parse(cells[2], file, lineNumber);
                }
                size++;
            }
        } catch (IOException ex) {
            throw new SpectrumUnavailableException("Failed to read spectrum file " + file, ex);
        }
        try {
            return Spectrum.of(Arrays.copyOf(wavelength, size), Arrays.copyOf(flux, size),
                    Boolean.TRUE.equals(withErrors) ? Arrays.copyOf(error, size) : null);
        } catch (IllegalArgumentException ex) {
            throw new SpectrumUnavailableException("Spectrum file " + file + " is not usable: " + ex.getMessage(), ex);
        }
    }

    private static boolean isNumeric(String value) {
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static double parse(String value, Path file, int lineNumber) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new SpectrumUnavailableException(String.format("%s:%d: not a number: '%s'", file, lineNumber, value), ex);
        }
    }
}
