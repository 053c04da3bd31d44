package nl.bytesoflife.circuitjson.attribute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a TikZ dash pattern to a named line style.
 * <p>
 * TikZ writes dash lengths multiplied by the line width
 * ({@code on 2.8pt off 0.7pt} for {@code on 4pt off 1pt} at 0.7pt), so every length is divided by
 * the width and rounded to whole points before the style table is consulted.
 */
public class DashPatternCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(DashPatternCanonicalizer.class);

    private static final Pattern LENGTH = Pattern.compile("(\\d+\\.?\\d*)(pt)");

    private final Map<String, String> lineStyles;

    public DashPatternCanonicalizer(Map<String, String> lineStyles) {
        this.lineStyles = Map.copyOf(lineStyles);
    }

    /**
     * @return the pattern with every length divided by {@code lineWidth}, e.g. {@code on 4pt off 1pt}
     */
    public static String normalize(String pattern, double lineWidth) {
        double divisor = lineWidth > 0 ? lineWidth : 1.0;
        Matcher m = LENGTH.matcher(pattern.strip());
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            long scaled = Math.round(Double.parseDouble(m.group(1)) / divisor);
            m.appendReplacement(sb, scaled + m.group(2));
        }
        m.appendTail(sb);
        return sb.toString().replaceAll("\\s+", " ");
    }

    /**
     * @return the style name, or empty (solid) when the pattern is not in the table
     */
    public Optional<String> canonicalize(String pattern, double lineWidth) {
        String key = normalize(pattern, lineWidth);
        String style = lineStyles.get(key);
        if (style == null) {
            log.warn("Dash pattern '{}' (normalized '{}') not recognized, using a solid line", pattern, key);
            return Optional.empty();
        }
        return Optional.of(style);
    }
}
