package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.ArrowParser.ArrowHeads;
import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.Stroke;
import nl.bytesoflife.circuitjson.model.WireComponent;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

/**
 * Plain wires. Stroke and arrow tips come from the trailing option group. The stroke starts from
 * {@code line width}; a draw marker adds opacity, dash style and color to it. A wire without a
 * line width gets no stroke at all.
 */
public class WireBuilder implements ComponentBuilder<TokenSequence.Wire> {

    private final AttributeParsers parsers;

    public WireBuilder(AttributeParsers parsers) {
        this.parsers = parsers;
    }

    @Override
    public TokenKind getSupportedKind() {
        return TokenKind.WIRE;
    }

    @Override
    public Class<TokenSequence.Wire> getSequenceType() {
        return TokenSequence.Wire.class;
    }

    @Override
    public Component build(TokenSequence.Wire sequence) {
        String options = sequence.trailingOptions();

        Stroke stroke = parsers.strokes().lineWidth(options)
                .map(width -> parsers.strokes().parse(options).orElse(Stroke.ofWidth(width)))
                .orElse(null);
        ArrowHeads arrows = parsers.arrows().parse(options);

        return new WireComponent(parsers.transformer().parseAll(sequence.coordinates()),
                sequence.directions(), stroke, arrows.start(), arrows.end());
    }
}
