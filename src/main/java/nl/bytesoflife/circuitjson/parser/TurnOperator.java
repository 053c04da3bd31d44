package nl.bytesoflife.circuitjson.parser;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Segment operators between two wire coordinates.
 */
public enum TurnOperator {
    STRAIGHT("--"),
    HORIZONTAL_THEN_VERTICAL("-|"),
    VERTICAL_THEN_HORIZONTAL("|-");

    private final String symbol;

    TurnOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public static TurnOperator fromSymbol(String symbol) {
        for (TurnOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown turn operator: " + symbol);
    }
}
