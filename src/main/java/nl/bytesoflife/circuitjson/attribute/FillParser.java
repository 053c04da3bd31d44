package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;
import nl.bytesoflife.circuitjson.model.Fill;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads fill opacity and an RGB fill color, gated on a fill marker.
 */
public class FillParser {

    private static final Pattern FILL_MARKER = Pattern.compile("fill");
    private static final Pattern FILL_OPACITY = Pattern.compile("fill opacity=([-+]?\\d*\\.?\\d+)");
    private static final Pattern FILL_COLOR = Pattern.compile("fill=\\{([^}]*)\\}");

    public Optional<Fill> parse(String options) {
        if (!FILL_MARKER.matcher(options).find()) {
            return Optional.empty();
        }

        Double opacity = null;
        Matcher m = FILL_OPACITY.matcher(options);
        if (m.find()) {
            opacity = CoordinateTransformer.parseNumber(m.group(1));
        }

        String color = null;
        m = FILL_COLOR.matcher(options);
        if (m.find()) {
            color = ColorParser.parseRgb(m.group(1)).orElse(null);
        }
        return Optional.of(new Fill(opacity, color));
    }
}
