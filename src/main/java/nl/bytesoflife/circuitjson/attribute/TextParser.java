package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.model.TextBox;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns mixed TeX/math label text into output text: {@code \\} becomes a line feed and a leading
 * font size command such as {@code \Large} is split off.
 */
public class TextParser {

    private static final String LINE_BREAK = "\\\\";
    private static final Pattern FONT_SIZE = Pattern.compile("^\\\\([a-zA-Z]+)\\s*(.*)", Pattern.DOTALL);
    private static final Pattern TEXT_COLOR = Pattern.compile("\\\\textcolor\\{([^}]+)\\}(.*)", Pattern.DOTALL);
    private static final Pattern BRACED = Pattern.compile("^\\{(.*)\\}$", Pattern.DOTALL);

    /**
     * @param fontSize the font size command name without backslash, null when absent
     */
    public record FormattedText(String fontSize, String text) {
    }

    public FormattedText format(String text) {
        List<String> spans = new ArrayList<>();
        for (String span : MathTextSplitter.split(text)) {
            spans.add(LINE_BREAK.equals(span.strip()) ? "\n" : span);
        }

        String fontSize = null;
        if (!spans.isEmpty() && spans.get(0).startsWith("\\")) {
            Matcher m = FONT_SIZE.matcher(spans.get(0));
            if (m.matches()) {
                fontSize = m.group(1);
                if (m.group(2).isEmpty()) {
                    spans.remove(0);
                } else {
                    spans.set(0, m.group(2));
                }
            }
        }
        return new FormattedText(fontSize, String.join(" ", spans));
    }

    /**
     * Text box content of a shape, with an optional {@code \textcolor{rgb,255:...}{...}} wrapper.
     */
    public TextBox parseTextBox(String text) {
        String color = null;
        String content = text;
        Matcher m = TEXT_COLOR.matcher(text);
        if (m.find()) {
            color = ColorParser.parseRgb(m.group(1)).orElse(null);
            Matcher braced = BRACED.matcher(m.group(2));
            content = braced.matches() ? braced.group(1) : m.group(2);
        }
        FormattedText formatted = format(content);
        return TextBox.centered(color, formatted.fontSize(), formatted.text());
    }

    /**
     * Strips every leading and trailing {@code $}.
     */
    public static String stripDollars(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '$') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '$') {
            end--;
        }
        return text.substring(start, end);
    }
}
