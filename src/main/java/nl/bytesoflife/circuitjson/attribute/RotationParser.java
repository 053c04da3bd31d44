package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;
import nl.bytesoflife.circuitjson.model.Scale;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers rotation and scale from {@code xscale}, {@code yscale} and {@code rotate} options.
 * <pre>
 *   xscale, yscale, rotate -> all three unchanged
 *   xscale only            -> rotation -180, scale (-x, -x)
 *   yscale only            -> scale (-y, y), no rotation
 *   rotate (without both)  -> rotation only
 *   xscale and yscale      -> scale (x, y), no rotation
 * </pre>
 */
public class RotationParser {

    private static final Pattern XSCALE = Pattern.compile("xscale=(-?\\d*\\.?\\d+)");
    private static final Pattern YSCALE = Pattern.compile("yscale=(-?\\d*\\.?\\d+)");
    private static final Pattern ROTATE = Pattern.compile("rotate=(-?\\d*\\.?\\d+)");

    private static final double HALF_TURN = -180.0;

    public record Orientation(Double rotation, Scale scale) {

        public static final Orientation NONE = new Orientation(null, null);

        public Optional<Double> optionalRotation() {
            return Optional.ofNullable(rotation);
        }
    }

    public Orientation parse(String options) {
        Double x = find(XSCALE, options);
        Double y = find(YSCALE, options);
        Double rotate = find(ROTATE, options);

        if (x != null && y != null && rotate != null) {
            return new Orientation(rotate, new Scale(x, y));
        }
        if (x != null && y == null && rotate == null) {
            return new Orientation(HALF_TURN, new Scale(negate(x), negate(x)));
        }
        if (x == null && y != null && rotate == null) {
            return new Orientation(null, new Scale(negate(y), y));
        }
        if (rotate != null) {
            return new Orientation(rotate, null);
        }
        if (x != null && y != null) {
            return new Orientation(null, new Scale(x, y));
        }
        return Orientation.NONE;
    }

    private static double negate(double value) {
        return value == 0 ? 0.0 : -value;
    }

    private static Double find(Pattern pattern, String options) {
        Matcher m = pattern.matcher(options);
        return m.find() ? CoordinateTransformer.parseNumber(m.group(1)) : null;
    }
}
