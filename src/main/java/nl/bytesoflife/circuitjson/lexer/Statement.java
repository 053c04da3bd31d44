package nl.bytesoflife.circuitjson.lexer;

/**
 * One raw statement of the drawing body.
 *
 * @param type      the introducing command
 * @param text      for {@link StatementType#NODE} the whole line, otherwise the text between the
 *                  option group and the terminating semicolon
 * @param options   the bracketed option group of a draw or path command including the brackets,
 *                  empty when absent; always empty for node lines
 * @param offset    start of the statement in the drawing body
 * @param nodeCount number of chained node clauses on a node line, 0 otherwise
 */
public record Statement(StatementType type, String text, String options, int offset, int nodeCount) {

    public static Statement nodeLine(String line, int offset, int nodeCount) {
        return new Statement(StatementType.NODE, line, "", offset, nodeCount);
    }

    public static Statement command(StatementType type, String text, String options, int offset) {
        return new Statement(type, text, options == null ? "" : options, offset, 0);
    }

    @Override
    public String toString() {
        return type + "@" + offset + "{" + (options.isEmpty() ? "" : options + " ") + text.strip() + "}";
    }
}
