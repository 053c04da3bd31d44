package nl.bytesoflife.circuitjson.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for chained node clauses:
 * <pre>
 *   \node[options](name) at (coordinate){label} node[options] at (coordinate){label} ... ;
 * </pre>
 * The leading clause is mandatory. A chained clause that does not parse ends the chain; the
 * clauses read so far are returned.
 */
public class NodeClauseParser {

    private static final Logger log = LoggerFactory.getLogger(NodeClauseParser.class);

    private static final String NODE_COMMAND = "\\node";

    private String input;
    private int pos;

    public List<NodeClause> parse(String line, int maxClauses) {
        this.input = line;
        int start = line.indexOf(NODE_COMMAND);
        if (start < 0) {
            throw new StatementParseException("Expected '\\node'", line, 0);
        }
        this.pos = start + NODE_COMMAND.length();

        List<NodeClause> clauses = new ArrayList<>();
        clauses.add(parseClause());

        while (clauses.size() < maxClauses) {
            try {
                skipWhitespace();
                expectKeyword("node");
                clauses.add(parseClause());
            } catch (StatementParseException e) {
                log.warn("Chained node clause {} dropped: {}", clauses.size() + 1, e.getMessage());
                break;
            }
        }
        return clauses;
    }

    private NodeClause parseClause() {
        skipWhitespace();
        String options = readDelimited('[', ']');

        skipWhitespace();
        String name = null;
        if (pos < input.length() && input.charAt(pos) == '(') {
            name = readDelimited('(', ')').strip();
        }

        skipWhitespace();
        expectKeyword("at");
        skipWhitespace();
        String coordinate = "(" + readDelimited('(', ')').strip() + ")";

        skipWhitespace();
        String label = readDelimited('{', '}');

        return new NodeClause(options.strip(), name, coordinate, label.strip());
    }

    /**
     * Reads a balanced group and returns its content without the outer delimiters.
     * Backslash escapes are copied verbatim and never open or close a group.
     */
    private String readDelimited(char open, char close) {
        expect(open);
        int depth = 1;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\' && pos + 1 < input.length()) {
                sb.append(c).append(input.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    pos++;
                    return sb.toString();
                }
            }
            sb.append(c);
            pos++;
        }
        throw new StatementParseException("Unterminated '" + open + "'", input, pos);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw new StatementParseException("Expected '" + expected + "'", input, pos);
        }
        pos++;
    }

    private void expectKeyword(String keyword) {
        if (!input.startsWith(keyword, pos)) {
            throw new StatementParseException("Expected '" + keyword + "'", input, pos);
        }
        pos += keyword.length();
    }
}
