package nl.bytesoflife.circuitjson.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits draw and path statement text into coordinates, option groups and turn operators,
 * in the order they appear. Text matching none of them is ignored.
 */
public class PathTokenizer {

    // Priority order: coordinate, option group (two levels of nested brackets), --, -|, |-
    private static final Pattern PATH_TOKEN = Pattern.compile(
        "\\([^()]*\\)"
        + "|(to|node)?(\\[(?:[^\\[\\]]|\\[(?:[^\\[\\]]|\\[[^\\[\\]]*\\])*\\])*\\])"
        + "|--|-\\||\\|-");

    public List<PathToken> tokenize(String text) {
        List<PathToken> tokens = new ArrayList<>();
        Matcher m = PATH_TOKEN.matcher(text);
        while (m.find()) {
            String token = m.group();
            if (token.startsWith("(")) {
                tokens.add(new PathToken.CoordinateToken(token));
            } else if (m.group(2) != null) {
                String keyword = m.group(1) != null ? m.group(1) : "";
                tokens.add(new PathToken.OptionGroup(keyword, m.group(2)));
            } else {
                tokens.add(new PathToken.Turn(TurnOperator.fromSymbol(token)));
            }
        }
        return tokens;
    }
}
