package nl.bytesoflife.circuitjson.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of converting one document: the emitted components, the statements that could not be
 * converted and the named coordinates declared in the drawing.
 */
public class ConversionReport {

    private final boolean drawingFound;
    private final List<Component> components = new ArrayList<>();
    private final List<SkippedStatement> skippedStatements = new ArrayList<>();
    private final Map<String, String> namedCoordinates;

    private ConversionReport(boolean drawingFound, Map<String, String> namedCoordinates) {
        this.drawingFound = drawingFound;
        this.namedCoordinates = Collections.unmodifiableMap(new LinkedHashMap<>(namedCoordinates));
    }

    public static ConversionReport forDrawing(Map<String, String> namedCoordinates) {
        return new ConversionReport(true, namedCoordinates);
    }

    public static ConversionReport noDrawing() {
        return new ConversionReport(false, Map.of());
    }

    public void addComponent(Component component) {
        components.add(component);
    }

    public void addSkippedStatement(String statement, String reason) {
        skippedStatements.add(new SkippedStatement(statement, reason));
    }

    public boolean isDrawingFound() {
        return drawingFound;
    }

    public List<Component> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<SkippedStatement> getSkippedStatements() {
        return Collections.unmodifiableList(skippedStatements);
    }

    public Map<String, String> getNamedCoordinates() {
        return namedCoordinates;
    }

    /**
     * The document to write for this conversion.
     */
    public ConversionResult toDocument(String version) {
        if (!drawingFound) {
            return ErrorDocument.NO_DRAWING_BLOCK;
        }
        return new ComponentDocument(version, components);
    }

    @Override
    public String toString() {
        if (!drawingFound) {
            return "Conversion Report: no drawing block\n";
        }
        StringBuilder sb = new StringBuilder("Conversion Report:\n");
        sb.append("  Components: ").append(components.size()).append("\n");
        sb.append("  Named coordinates: ").append(namedCoordinates.size()).append("\n");
        sb.append("  Skipped statements: ").append(skippedStatements.size()).append("\n");
        for (SkippedStatement s : skippedStatements) {
            sb.append("  - ").append(s).append("\n");
        }
        return sb.toString();
    }

    public record SkippedStatement(String statement, String reason) {
        @Override
        public String toString() {
            return statement + " (" + reason + ")";
        }
    }
}
