package nl.bytesoflife.circuitjson.parser;

/**
 * A token of a draw or path statement.
 */
public sealed interface PathToken permits PathToken.CoordinateToken, PathToken.OptionGroup, PathToken.Turn {

    /** A parenthesized coordinate, absolute or anchor-relative. */
    record CoordinateToken(String text) implements PathToken {
        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * A bracketed option group.
     *
     * @param keyword {@code to}, {@code node} or empty when the group is not introduced by a keyword
     * @param body    the group including its brackets
     */
    record OptionGroup(String keyword, String body) implements PathToken {
        public boolean isChain() {
            return "to".equals(keyword);
        }

        @Override
        public String toString() {
            return keyword + body;
        }
    }

    record Turn(TurnOperator operator) implements PathToken {
        @Override
        public String toString() {
            return operator.getSymbol();
        }
    }
}
