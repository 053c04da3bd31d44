package nl.bytesoflife.circuitjson.lexer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips TeX comments and isolates the body of the drawing environment.
 */
public class Preprocessor {

    // An unescaped % starts a comment that runs to the end of the line
    private static final Pattern COMMENT = Pattern.compile("(?<!\\\\)%.*");

    private static final Pattern DRAWING_BLOCK = Pattern.compile(
        "\\\\begin\\{(circuitikz|tikzpicture)\\}(.*?)\\\\end\\{\\1\\}", Pattern.DOTALL);

    /**
     * @return the text between the first matching begin/end pair, or empty when the document
     *         has no drawing environment
     */
    public Optional<String> extractDrawingBody(String document) {
        if (document == null) {
            return Optional.empty();
        }
        Matcher m = DRAWING_BLOCK.matcher(stripComments(document));
        return m.find() ? Optional.of(m.group(2)) : Optional.empty();
    }

    public static String stripComments(String text) {
        return COMMENT.matcher(text).replaceAll("");
    }
}
