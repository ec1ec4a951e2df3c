package astro.sewingmachine.linelist;

import java.util.List;
import java.util.Objects;

/**
 * A single absorption line: its label, the window the equivalent width is integrated over and
 * the windows used to place the local continuum.
 */
public record LineDefinition(String label, Window integration, List<Window> continuumWindows) {

    public LineDefinition {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(integration, "integration");
        continuumWindows = List.copyOf(Objects.requireNonNull(continuumWindows, "continuumWindows"));
        if (continuumWindows.isEmpty()) {
            throw new IllegalArgumentException("line " + label + " needs at least one continuum window");
        }
    }

    /**
     * Whether any continuum window reaches into the integration window. Such lines are measured
     * as defined; callers only get to know about it.
     */
    public boolean continuumOverlapsIntegration() {
        return continuumWindows.stream().anyMatch(integration::overlaps);
    }
}
