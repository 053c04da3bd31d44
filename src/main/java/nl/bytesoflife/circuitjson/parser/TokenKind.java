package nl.bytesoflife.circuitjson.parser;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum TokenKind {
    TO("to"),
    NODE("node"),
    TWO_NODE("two-node"),
    THREE_NODE("three-node"),
    DEVICE("device"),
    WIRE("wire");

    private static final Map<String, TokenKind> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(TokenKind::getName, Function.identity()));

    private final String name;

    TokenKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static TokenKind fromName(String name) {
        TokenKind kind = BY_NAME.get(name.toLowerCase());
        if (kind == null) {
            throw new IllegalArgumentException("Unknown token kind: " + name);
        }
        return kind;
    }
}
