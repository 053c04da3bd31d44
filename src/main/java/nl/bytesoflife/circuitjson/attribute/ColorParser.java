package nl.bytesoflife.circuitjson.attribute;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads xcolor RGB triples in 0-255 notation. Named colors are not supported.
 */
public final class ColorParser {

    private static final Pattern RGB_255 = Pattern.compile("rgb,255:red,(\\d+);green,(\\d+);blue,(\\d+)");

    private ColorParser() {
    }

    /**
     * @param text e.g. {@code rgb,255:red,255;green,0;blue,128}
     * @return {@code rgb(255,0,128)}
     */
    public static Optional<String> parseRgb(String text) {
        Matcher m = RGB_255.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of("rgb(" + m.group(1) + "," + m.group(2) + "," + m.group(3) + ")");
    }
}
