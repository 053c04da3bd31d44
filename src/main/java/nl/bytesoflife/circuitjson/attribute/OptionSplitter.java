package nl.bytesoflife.circuitjson.attribute;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an option list on top-level commas. Commas inside braces or inside {@code $...$} do not
 * split, and backslash escapes are copied without interpretation.
 * <pre>
 *   [american voltage source, l_={$e(t), a(t)$}] -> [american voltage source, l_={$e(t), a(t)$}]
 * </pre>
 */
public final class OptionSplitter {

    private OptionSplitter() {
    }

    public static List<String> split(String options) {
        String s = options.strip();
        if (s.startsWith("[") && s.endsWith("]")) {
            s = s.substring(1, s.length() - 1);
        }

        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int braceDepth = 0;
        boolean inMath = false;

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                current.append(c).append(s.charAt(++i));
                continue;
            }
            if (c == '$') {
                inMath = !inMath;
            } else if (!inMath && c == '{') {
                braceDepth++;
            } else if (!inMath && c == '}') {
                braceDepth--;
            }

            if (c == ',' && braceDepth == 0 && !inMath) {
                parts.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString().strip());
        }
        return parts;
    }
}
