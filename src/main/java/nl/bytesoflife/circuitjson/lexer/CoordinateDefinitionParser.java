package nl.bytesoflife.circuitjson.lexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects {@code \coordinate (name) at (value);} declarations into a name to
 * {@code (value)} table. Later declarations of the same name win.
 */
public class CoordinateDefinitionParser {

    private static final Pattern COORDINATE_DEFINITION = Pattern.compile(
        "\\\\coordinate\\s*\\((.*?)\\)\\s*at\\s*\\((.*?)\\);", Pattern.DOTALL);

    public Map<String, String> parse(String body) {
        Map<String, String> table = new LinkedHashMap<>();
        Matcher m = COORDINATE_DEFINITION.matcher(Preprocessor.stripComments(body));
        while (m.find()) {
            table.put(m.group(1).strip(), "(" + m.group(2).strip() + ")");
        }
        return Collections.unmodifiableMap(table);
    }
}
