package nl.bytesoflife.circuitjson.config;

/**
 * Order in which converted components are emitted.
 */
public enum StatementOrder {
    /** Document order of the statements' first characters. */
    SOURCE,
    /** Node lines first, then draw statements, then path statements. */
    GROUPED
}
