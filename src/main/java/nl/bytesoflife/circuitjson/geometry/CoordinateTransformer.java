package nl.bytesoflife.circuitjson.geometry;

import nl.bytesoflife.circuitjson.config.ConverterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps TikZ coordinates to output units: x is scaled, y is scaled and inverted, and the
 * result is rounded to three decimals once all arithmetic is done.
 */
public class CoordinateTransformer {

    private static final Logger log = LoggerFactory.getLogger(CoordinateTransformer.class);

    // Only absolute numeric pairs; anchor-relative coordinates such as (N1.text) do not match
    private static final Pattern ABSOLUTE_COORDINATE = Pattern.compile(
        "^\\(\\s*(-?\\d*\\.?\\d+)\\s*,\\s*(-?\\d*\\.?\\d+)\\s*\\)");

    private final double scaleX;
    private final double scaleY;
    private final double sizeScale;

    public CoordinateTransformer(ConverterSettings settings) {
        this(settings.getScaleX(), settings.getScaleY(), settings.getSizeScale());
    }

    public CoordinateTransformer(double scaleX, double scaleY, double sizeScale) {
        this.scaleX = scaleX;
        this.scaleY = scaleY;
        this.sizeScale = sizeScale;
    }

    public Point transform(double rawX, double rawY) {
        return new Point(round(rawX * scaleX), round(-rawY * scaleY));
    }

    /**
     * Converts a width or height. Sizes use their own scale factor, not the position factors.
     */
    public double transformSize(double rawSize) {
        return round(rawSize * sizeScale);
    }

    /**
     * Parses and transforms a textual {@code (x, y)} pair.
     *
     * @return empty when the text is not an absolute numeric pair
     */
    public Optional<Point> parse(String coordinate) {
        if (coordinate == null) {
            return Optional.empty();
        }
        Matcher m = ABSOLUTE_COORDINATE.matcher(coordinate.trim());
        if (!m.find()) {
            log.debug("Skipping non-absolute coordinate {}", coordinate);
            return Optional.empty();
        }
        return Optional.of(transform(parseNumber(m.group(1)), parseNumber(m.group(2))));
    }

    /**
     * Transforms every absolute coordinate in order; relative ones are left out, so the result
     * may be shorter than the input.
     */
    public List<Point> parseAll(List<String> coordinates) {
        List<Point> points = new ArrayList<>();
        for (String coordinate : coordinates) {
            parse(coordinate).ifPresent(points::add);
        }
        return points;
    }

    /**
     * Parses a decimal number. Unparseable text yields 0 with a warning; the value is then
     * wrong, not missing.
     */
    public static double parseNumber(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Cannot convert '{}' to a number, using 0", text);
            return 0;
        }
    }

    /**
     * Rounds half-even to three decimals on the exact binary value and normalizes -0 to 0.
     */
    public static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            log.warn("Non-finite value {} replaced by 0", value);
            return 0;
        }
        double rounded = new BigDecimal(value).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
        return rounded == 0 ? 0.0 : rounded;
    }
}
