package nl.bytesoflife.circuitjson.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code node[options](name) at (coordinate){label}} fragment.
 *
 * @param options    option text without the enclosing brackets
 * @param name       the optional {@code (name)}, null when absent or blank
 * @param coordinate the coordinate including parentheses, absolute or anchor-relative
 * @param label      the label text without the enclosing braces, possibly empty
 */
public record NodeClause(String options, String name, String coordinate, String label) {

    private static final Pattern SHAPE_DECLARATION = Pattern.compile("^\\s*shape\\s*=");
    private static final Pattern ANCHOR = Pattern.compile("anchor=([^\\s,\\]]+)");

    public NodeClause {
        if (name != null && name.isBlank()) {
            name = null;
        }
    }

    /**
     * True when the options start with {@code shape=}. Shapes convert to rect/ellipse records,
     * everything else is a device.
     */
    public boolean declaresShape() {
        return SHAPE_DECLARATION.matcher(options).find();
    }

    public Optional<String> optionalName() {
        return Optional.ofNullable(name);
    }

    public Optional<String> anchor() {
        Matcher m = ANCHOR.matcher(options);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
