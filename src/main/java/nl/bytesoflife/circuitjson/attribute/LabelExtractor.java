package nl.bytesoflife.circuitjson.attribute;

import java.util.Optional;

/**
 * Reads the label of a {@code to[...]} element from an {@code l={...}} or {@code l_={...}} option.
 * Other placements ({@code l^}, {@code l2_}, ...) are not recognized.
 */
public final class LabelExtractor {

    private LabelExtractor() {
    }

    /**
     * @param otherSide true for {@code l_=}, which places the label on the other side of the element
     * @param text      label text with one outer {@code $...$} pair removed; null when the value
     *                  is not enclosed in braces
     */
    public record ChainLabel(boolean otherSide, String text) {
    }

    public static Optional<ChainLabel> extract(String option) {
        boolean otherSide;
        String value;
        if (option.startsWith("l_=")) {
            otherSide = true;
            value = option.substring(3).strip();
        } else if (option.startsWith("l=")) {
            otherSide = false;
            value = option.substring(2).strip();
        } else {
            return Optional.empty();
        }

        if (!value.startsWith("{") || !value.endsWith("}") || value.length() < 2) {
            return Optional.of(new ChainLabel(otherSide, null));
        }
        return Optional.of(new ChainLabel(otherSide, stripOuterMath(value.substring(1, value.length() - 1).strip())));
    }

    /**
     * Removes one leading and one trailing {@code $} when the text between them still holds
     * balanced pairs, so {@code $a$ + $b$} becomes {@code a$ + $b}.
     */
    static String stripOuterMath(String text) {
        if (text.length() >= 2 && text.startsWith("$") && text.endsWith("$")) {
            String inner = text.substring(1, text.length() - 1);
            if (inner.chars().filter(ch -> ch == '$').count() % 2 == 0) {
                return inner;
            }
        }
        return text;
    }
}
