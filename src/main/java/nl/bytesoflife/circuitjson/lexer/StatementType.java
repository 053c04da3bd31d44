package nl.bytesoflife.circuitjson.lexer;

public enum StatementType {
    NODE,
    DRAW,
    PATH
}
