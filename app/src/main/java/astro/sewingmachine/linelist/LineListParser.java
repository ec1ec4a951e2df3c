package astro.sewingmachine.linelist;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads whitespace-delimited line-list tables with the columns {@code Label}, {@code i_b},
 * {@code i_r} and {@code cont}. The first non-comment line names the columns.
 */
public class LineListParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineListParser.class);

    static final String COLUMN_LABEL = "Label";
    static final String COLUMN_BLUE_EDGE = "i_b";
    static final String COLUMN_RED_EDGE = "i_r";
    static final String COLUMN_CONTINUUM = "cont";
    private static final List<String> REQUIRED_COLUMNS = List.of(COLUMN_LABEL, COLUMN_BLUE_EDGE, COLUMN_RED_EDGE, COLUMN_CONTINUUM);

    public LineList parse(Path source) {
        Objects.requireNonNull(source, "source");
        if (!Files.isRegularFile(source)) {
            throw new LineListParseException("Line list file does not exist: " + source);
        }
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            return parse(reader, source.toString());
        } catch (IOException ex) {
            throw new LineListParseException("Failed to read line list " + source, ex);
        }
    }

    public LineList parse(Reader source, String sourceName) {
        Objects.requireNonNull(source, "source");
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        Map<String, Integer> columns = null;
        List<LineDefinition> lines = new ArrayList<>();
        int lineNumber = 0;
        try {
            String raw;
            while ((raw = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = raw.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                List<String> cells = splitCells(trimmed, sourceName, lineNumber);
                if (columns == null) {
                    columns = indexHeader(cells, sourceName, lineNumber);
                    continue;
                }
                lines.add(parseRow(cells, columns, sourceName, lineNumber));
            }
        } catch (IOException ex) {
            throw new LineListParseException("Failed to read line list " + sourceName, ex);
        }
        if (columns == null) {
            throw new LineListParseException("Line list " + sourceName + " has no header row");
        }
        for (LineDefinition line : lines) {
            if (line.continuumOverlapsIntegration()) {
                LOGGER.warn("Continuum windows of line {} overlap its integration window {}", line.label(), line.integration());
            }
        }
        LOGGER.debug("Parsed {} lines from {}", lines.size(), sourceName);
        return new LineList(lines);
    }

    private Map<String, Integer> indexHeader(List<String> cells, String sourceName, int lineNumber) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            columns.putIfAbsent(cells.get(i), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new LineListParseException(String.format("%s:%d: header is missing column '%s'", sourceName, lineNumber, required));
            }
        }
        return columns;
    }

    private LineDefinition parseRow(List<String> cells, Map<String, Integer> columns, String sourceName, int lineNumber) {
        String label = cell(cells, columns, COLUMN_LABEL, sourceName, lineNumber);
        double blue = parseEdge(cell(cells, columns, COLUMN_BLUE_EDGE, sourceName, lineNumber), COLUMN_BLUE_EDGE, sourceName, lineNumber);
        double red = parseEdge(cell(cells, columns, COLUMN_RED_EDGE, sourceName, lineNumber), COLUMN_RED_EDGE, sourceName, lineNumber);
        if (blue >= red) {
            throw new LineListParseException(String.format("%s:%d: integration window of %s has i_b %s >= i_r %s",
                    sourceName, lineNumber, label, blue, red));
        }
        List<Window> continuum;
        try {
            continuum = ContinuumWindowsParser.parse(cell(cells, columns, COLUMN_CONTINUUM, sourceName, lineNumber));
        } catch (IllegalArgumentException ex) {
            throw new LineListParseException(String.format("%s:%d: invalid continuum windows for %s: %s",
                    sourceName, lineNumber, label, ex.getMessage()), ex);
        }
        return new LineDefinition(label, new Window(blue, red), continuum);
    }

    private String cell(List<String> cells, Map<String, Integer> columns, String column, String sourceName, int lineNumber) {
        int index = columns.get(column);
        if (index >= cells.size()) {
            throw new LineListParseException(String.format("%s:%d: row has %d columns, missing '%s'",
                    sourceName, lineNumber, cells.size(), column));
        }
        return cells.get(index);
    }

    private double parseEdge(String raw, String column, String sourceName, int lineNumber) {
        try {
            double value = Double.parseDouble(raw);
            if (!Double.isFinite(value)) {
                throw new NumberFormatException("not finite");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new LineListParseException(String.format("%s:%d: column %s is not a number: '%s'",
                    sourceName, lineNumber, column, raw), ex);
        }
    }

    /**
     * Splits on whitespace, except inside brackets or parentheses so that {@code cont} cells
     * written with spaces stay in one piece.
     */
    static List<String> splitCells(String line, String sourceName, int lineNumber) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '(' || ch == '[') {
                depth++;
            } else if (ch == ')' || ch == ']') {
                depth--;
                if (depth < 0) {
                    throw new LineListParseException(String.format("%s:%d: unbalanced '%c'", sourceName, lineNumber, ch));
                }
            }
            if (depth == 0 && Character.isWhitespace(ch)) {
                if (current.length() > 0) {
                    cells.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(ch);
            }
        }
        if (depth != 0) {
            throw new LineListParseException(String.format("%s:%d: unclosed bracket", sourceName, lineNumber));
        }
        if (current.length() > 0) {
            cells.add(current.toString());
        }
        return cells;
    }
}
