package astro.sewingmachine.catalog;

import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads identifier columns from the first binary table extension of an allStar-style FITS
 * catalog. Cells are kept in the form the table stores them; see {@link CatalogEntry}.
 */
public class FitsCatalogReader implements CatalogReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(FitsCatalogReader.class);

    @Override
    public List<CatalogEntry> read(Path catalog, DataRelease release) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(release, "release");
        if (!Files.isRegularFile(catalog)) {
            throw new CatalogFormatException("Catalog does not exist: " + catalog);
        }
        try (Fits fits = new Fits(catalog.toFile())) {
            BinaryTableHDU table = firstBinaryTable(fits.read(), catalog);
            Object locations = column(table, release.locationColumn(), catalog);
            Object objectIds = column(table, release.objectIdColumn(), catalog);
            int rows = table.getNRows();
            List<CatalogEntry> entries = new ArrayList<>(rows);
            for (int row = 0; row < rows; row++) {
                entries.add(new CatalogEntry(row, cell(locations, row), cell(objectIds, row)));
            }
            LOGGER.info("Read {} catalog rows from {} ({} keyed by {})", rows, catalog, release, release.locationColumn());
            return List.copyOf(entries);
        } catch (FitsException | IOException ex) {
            throw new CatalogFormatException("Failed to read FITS catalog " + catalog, ex);
        }
    }

    private BinaryTableHDU firstBinaryTable(BasicHDU<?>[] hdus, Path catalog) {
        if (hdus != null) {
            for (BasicHDU<?> hdu : hdus) {
                if (hdu instanceof BinaryTableHDU table) {
                    return table;
                }
            }
        }
        throw new CatalogFormatException("Catalog " + catalog + " has no binary table extension");
    }

    private Object column(BinaryTableHDU table, String name, Path catalog) throws FitsException {
        int index = table.findColumn(name);
        if (index < 0) {
            throw new CatalogFormatException("Catalog " + catalog + " has no column " + name);
        }
        return table.getColumn(index);
    }

    static Object cell(Object column, int row) {
        if (column instanceof char[][] chars) {
            return new String(chars[row]);
        }
        return Array.get(column, row);
    }
}
