package astro.sewingmachine.catalog;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reads the rows of a star catalog, in catalog order.
 */
public interface CatalogReader {

    /**
     * @throws CatalogFormatException when the catalog cannot be read or lacks the identifier columns
     */
    List<CatalogEntry> read(Path catalog, DataRelease release);

    static CatalogReader forPath(Path catalog) {
        String name = catalog.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fits.gz")) {
            return new FitsCatalogReader();
        }
        return new CsvCatalogReader();
    }
}
