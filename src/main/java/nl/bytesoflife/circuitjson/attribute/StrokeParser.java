package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;
import nl.bytesoflife.circuitjson.model.Stroke;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads draw options: line width, draw opacity, dash style and draw color. Nothing is read unless
 * the options contain a draw marker.
 */
public class StrokeParser {

    private static final Pattern DRAW_MARKER = Pattern.compile("draw");
    private static final Pattern LINE_WIDTH = Pattern.compile("line width=([\\d.]+pt)");
    private static final Pattern DRAW_OPACITY = Pattern.compile("draw opacity=([-+]?\\d*\\.?\\d+)");
    private static final Pattern DASH_PATTERN = Pattern.compile("dash pattern=\\{([^}]*)\\}");
    private static final Pattern DRAW_COLOR = Pattern.compile("draw=\\{([^}]*)\\}");

    private final DashPatternCanonicalizer dashPatterns;

    public StrokeParser(DashPatternCanonicalizer dashPatterns) {
        this.dashPatterns = dashPatterns;
    }

    public Optional<Stroke> parse(String options) {
        if (!DRAW_MARKER.matcher(options).find()) {
            return Optional.empty();
        }

        String width = lineWidth(options).orElse(null);
        double widthForStyle = width != null
                ? CoordinateTransformer.parseNumber(width.substring(0, width.length() - 2))
                : 1.0;

        Double opacity = null;
        Matcher m = DRAW_OPACITY.matcher(options);
        if (m.find()) {
            opacity = CoordinateTransformer.parseNumber(m.group(1));
        }

        String style = null;
        m = DASH_PATTERN.matcher(options);
        if (m.find()) {
            style = dashPatterns.canonicalize(m.group(1), widthForStyle).orElse(null);
        }

        String color = null;
        m = DRAW_COLOR.matcher(options);
        if (m.find()) {
            color = ColorParser.parseRgb(m.group(1)).orElse(null);
        }

        return Optional.of(new Stroke(width, opacity, style, color));
    }

    /**
     * Like {@link #parse(String)}, but options without a draw marker yield {@link Stroke#HIDDEN}.
     */
    public Stroke parseOrHidden(String options) {
        return parse(options).orElse(Stroke.HIDDEN);
    }

    /**
     * @return the line width with its unit, e.g. {@code 1.3pt}
     */
    public Optional<String> lineWidth(String options) {
        Matcher m = LINE_WIDTH.matcher(options);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
