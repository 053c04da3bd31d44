package nl.bytesoflife.circuitjson.parser;

/**
 * Thrown when a statement does not match the micro-grammar of its kind.
 */
public class StatementParseException extends RuntimeException {

    private final String statement;
    private final int position;

    public StatementParseException(String message, String statement, int position) {
        super(message + " at position " + position + " in '" + statement.strip() + "'");
        this.statement = statement;
        this.position = position;
    }

    public String getStatement() {
        return statement;
    }

    public int getPosition() {
        return position;
    }
}
