package astro.sewingmachine.linelist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LineListParserTest {

    private final LineListParser parser = new LineListParser();

    @Test
    void parsesLinesInFileOrder() {
        String table = String.join("\n",
                "# APOGEE lines",
                "Label i_b i_r cont",
                "",
                "Fe1_15207 15205.0 15210.0 [(15190,15200),(15215,15225)]",
                "Mg1_15770 15765.0 15775.0 [(15750,15760)]");

        LineList lineList = parser.parse(new StringReader(table), "lines.txt");

        assertThat(lineList.labels()).containsExactly("Fe1_15207", "Mg1_15770");
        assertThat(lineList.integrationWindows()).containsExactly(new Window(15205, 15210), new Window(15765, 15775));
        assertThat(lineList.get(0).continuumWindows()).containsExactly(new Window(15190, 15200), new Window(15215, 15225));
        assertThat(lineList.continuumWindowGroups()).hasSize(2);
    }

    @Test
    void keepsContinuumCellWithSpacesTogether() {
        String table = "cont Label i_r i_b extra\n[(1, 2), (8, 9)] X 6 4 ignored\n";

        LineList lineList = parser.parse(new StringReader(table), "lines.txt");

        assertThat(lineList.get(0).label()).isEqualTo("X");
        assertThat(lineList.get(0).integration()).isEqualTo(new Window(4, 6));
        assertThat(lineList.get(0).continuumWindows()).hasSize(2);
    }

    @Test
    void acceptsOverlapBetweenContinuumAndIntegration() {
        LineList lineList = parser.parse(new StringReader("Label i_b i_r cont\nA 10 20 [(15,25)]\n"), "lines.txt");

        assertThat(lineList.get(0).continuumOverlapsIntegration()).isTrue();
    }

    @Test
    void headerOnlyGivesEmptyList() {
        assertThat(parser.parse(new StringReader("Label i_b i_r cont\n"), "lines.txt").isEmpty()).isTrue();
    }

    @Test
    void rejectsReversedIntegrationWindowWithLineNumber() {
        String table = "Label i_b i_r cont\nA 20 10 [(1,2)]\n";

        assertThatThrownBy(() -> parser.parse(new StringReader(table), "lines.txt"))
                .isInstanceOf(LineListParseException.class)
                .hasMessageStartingWith("lines.txt:2:");
    }

    @Test
    void rejectsMissingColumn() {
        assertThatThrownBy(() -> parser.parse(new StringReader("Label i_b cont\n"), "lines.txt"))
                .isInstanceOf(LineListParseException.class)
                .hasMessageContaining("'i_r'");
    }

    @Test
    void rejectsMalformedContinuumCell() {
        String table = "Label i_b i_r cont\nA 10 20 [(1,2,3)]\n";

        assertThatThrownBy(() -> parser.parse(new StringReader(table), "lines.txt"))
                .isInstanceOf(LineListParseException.class)
                .hasMessageContaining("invalid continuum windows for A")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonNumericEdge() {
        assertThatThrownBy(() -> parser.parse(new StringReader("Label i_b i_r cont\nA blue 20 [(1,2)]\n"), "lines.txt"))
                .isInstanceOf(LineListParseException.class)
                .hasMessageContaining("i_b");
    }

    @Test
    void readsFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("lines.txt");
        Files.write(file, List.of("Label i_b i_r cont", "A 10 20 [(1,2)]"));

        assertThat(parser.parse(file).labels()).containsExactly("A");
    }

    @Test
    void missingFileIsAParseError(@TempDir Path tempDir) {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.txt")))
                .isInstanceOf(LineListParseException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void splitsCellsOutsideBrackets() {
        assertThat(LineListParser.splitCells("a  [(1, 2)]\tb", "x", 1)).containsExactly("a", "[(1, 2)]", "b");
        assertThatThrownBy(() -> LineListParser.splitCells("a [(1,2)", "x", 3))
                .isInstanceOf(LineListParseException.class)
                .hasMessageStartingWith("x:3:");
    }
}
