package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

/**
 * Builds the output record for one token kind.
 */
public interface ComponentBuilder<T extends TokenSequence> {

    Component build(T sequence);

    TokenKind getSupportedKind();

    Class<T> getSequenceType();
}
