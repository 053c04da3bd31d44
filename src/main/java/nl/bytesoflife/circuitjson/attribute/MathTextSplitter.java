package nl.bytesoflife.circuitjson.attribute;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits label text into alternating plain and {@code $...$} math spans.
 * <p>
 * A math span is never split, and a backslash-escaped character never toggles math mode. An
 * unterminated {@code $} is plain text. Concatenating the spans gives back the input.
 */
public final class MathTextSplitter {

    private MathTextSplitter() {
    }

    public static List<String> split(String text) {
        List<String> spans = new ArrayList<>();
        StringBuilder plain = new StringBuilder();
        StringBuilder math = new StringBuilder();
        boolean inMath = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            StringBuilder target = inMath ? math : plain;
            if (c == '\\' && i + 1 < text.length()) {
                target.append(c).append(text.charAt(++i));
                continue;
            }
            if (c != '$') {
                target.append(c);
            } else if (!inMath) {
                math.append(c);
                inMath = true;
            } else {
                math.append(c);
                flush(plain, spans);
                flush(math, spans);
                inMath = false;
            }
        }

        if (inMath) {
            plain.append(math);
        }
        flush(plain, spans);
        return spans;
    }

    public static boolean isMath(String span) {
        return span.length() >= 2 && span.startsWith("$") && span.endsWith("$");
    }

    private static void flush(StringBuilder sb, List<String> spans) {
        if (sb.length() > 0) {
            spans.add(sb.toString());
            sb.setLength(0);
        }
    }
}
