package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;
import nl.bytesoflife.circuitjson.model.ShapeComponent;
import nl.bytesoflife.circuitjson.model.Size;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the shape type and minimum size of a shape node.
 */
public class ShapeParser {

    private static final Pattern SHAPE = Pattern.compile("shape\\s*=\\s*([^,\\]]+)");
    private static final Pattern MIN_WIDTH = Pattern.compile("minimum width=([-+]?\\d*\\.?\\d+)");
    private static final Pattern MIN_HEIGHT = Pattern.compile("minimum height=([-+]?\\d*\\.?\\d+)");

    private final CoordinateTransformer transformer;

    public ShapeParser(CoordinateTransformer transformer) {
        this.transformer = transformer;
    }

    /**
     * @param type {@code rect} or {@code ellipse}
     * @param size null when no minimum width is given
     */
    public record ShapeSpec(String type, Size size) {
    }

    /**
     * Rectangles map to {@code rect}; every other shape (circle, ellipse, ...) maps to
     * {@code ellipse}. A negative width is clamped to 0, a missing height copies the width.
     *
     * @return empty when the options declare no shape
     */
    public Optional<ShapeSpec> parse(String options) {
        Matcher shape = SHAPE.matcher(options);
        if (!shape.find()) {
            return Optional.empty();
        }
        String type = "rectangle".equals(shape.group(1).strip())
                ? ShapeComponent.RECT
                : ShapeComponent.ELLIPSE;

        Size size = null;
        Matcher width = MIN_WIDTH.matcher(options);
        if (width.find()) {
            double x = Math.max(0.0, transformer.transformSize(CoordinateTransformer.parseNumber(width.group(1))));
            Matcher height = MIN_HEIGHT.matcher(options);
            double y = height.find()
                    ? transformer.transformSize(CoordinateTransformer.parseNumber(height.group(1)))
                    : x;
            size = new Size(x, y);
        }
        return Optional.of(new ShapeSpec(type, size));
    }
}
