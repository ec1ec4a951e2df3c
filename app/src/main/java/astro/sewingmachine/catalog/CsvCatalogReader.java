package astro.sewingmachine.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Comma-separated catalog with a header row naming at least the object id column and the
 * location column of the requested data release. Cells may be double-quoted, with embedded
 * commas and doubled quotes.
 */
public class CsvCatalogReader implements CatalogReader {

    @Override
    public List<CatalogEntry> read(Path catalog, DataRelease release) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(release, "release");
        try (BufferedReader reader = Files.newBufferedReader(catalog, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null) {
                throw new CatalogFormatException("Catalog " + catalog + " is empty");
            }
            List<String> columns = Arrays.asList(split(header));
            int locationIndex = requireColumn(columns, release.locationColumn(), catalog);
            int objectIndex = requireColumn(columns, release.objectIdColumn(), catalog);

            List<CatalogEntry> entries = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = split(line);
                int row = entries.size();
                entries.add(new CatalogEntry(row, cellAt(cells, locationIndex), cellAt(cells, objectIndex)));
            }
            return List.copyOf(entries);
        } catch (IOException ex) {
            throw new CatalogFormatException("Failed to read catalog " + catalog, ex);
        }
    }

    private int requireColumn(List<String> columns, String column, Path catalog) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new CatalogFormatException("Catalog " + catalog + " has no column " + column);
        }
        return index;
    }

    private static String cellAt(String[] cells, int index) {
        return index < cells.length ? cells[index] : null;
    }

    /**
     * Splits one record on commas outside double quotes; a doubled quote inside a quoted cell
     * stands for one quote character.
     */
    static String[] split(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (ch == ',' && !quoted) {
                cells.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        cells.add(current.toString().strip());
        return cells.toArray(new String[0]);
    }
}
