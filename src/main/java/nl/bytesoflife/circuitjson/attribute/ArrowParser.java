package nl.bytesoflife.circuitjson.attribute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code start-end} arrow tip options such as {@code stealth-latex reversed} and maps the
 * tip names through the arrow alias table.
 */
public class ArrowParser {

    private static final Logger log = LoggerFactory.getLogger(ArrowParser.class);

    private static final Pattern ARROW_SPEC = Pattern.compile("^([A-Za-z |]*)-([A-Za-z |]*)$");

    private final Map<String, String> aliases;

    public ArrowParser(Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * Either side may be null.
     */
    public record ArrowHeads(String start, String end) {
        public static final ArrowHeads NONE = new ArrowHeads(null, null);
    }

    public ArrowHeads parse(String options) {
        for (String option : OptionSplitter.split(options)) {
            Matcher m = ARROW_SPEC.matcher(option);
            if (m.matches() && !(m.group(1).isBlank() && m.group(2).isBlank())) {
                return new ArrowHeads(lookup(m.group(1), "Start"), lookup(m.group(2), "End"));
            }
        }
        return ArrowHeads.NONE;
    }

    private String lookup(String tip, String side) {
        String name = tip.strip();
        if (name.isEmpty()) {
            return null;
        }
        String alias = aliases.get(name);
        if (alias == null) {
            log.warn("{} arrow '{}' has no alias, omitting it", side, name);
        }
        return alias;
    }
}
