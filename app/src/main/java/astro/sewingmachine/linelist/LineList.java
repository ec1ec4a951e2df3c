package astro.sewingmachine.linelist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable set of lines to measure. The label, integration and continuum sequences
 * share one index space and the order of the source definition.
 */
public final class LineList implements Iterable<LineDefinition> {

    private final List<LineDefinition> lines;
    private final List<String> labels;
    private final List<Window> integrationWindows;
    private final List<List<Window>> continuumWindowGroups;

    public LineList(List<LineDefinition> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.labels = this.lines.stream()
                .map(LineDefinition::label)
                .collect(Collectors.toUnmodifiableList());
        this.integrationWindows = this.lines.stream()
                .map(LineDefinition::integration)
                .collect(Collectors.toUnmodifiableList());
        this.continuumWindowGroups = this.lines.stream()
                .map(LineDefinition::continuumWindows)
                .collect(Collectors.toUnmodifiableList());
    }

    public static LineList of(LineDefinition... lines) {
        return new LineList(List.of(lines));
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public LineDefinition get(int index) {
        return lines.get(index);
    }

    public List<LineDefinition> lines() {
        return lines;
    }

    public List<String> labels() {
        return labels;
    }

    public List<Window> integrationWindows() {
        return integrationWindows;
    }

    public List<List<Window>> continuumWindowGroups() {
        return continuumWindowGroups;
    }

    @Override
    public Iterator<LineDefinition> iterator() {
        return lines.iterator();
    }
}
