package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.attribute.RotationParser.Orientation;
import nl.bytesoflife.circuitjson.attribute.ShapeParser.ShapeSpec;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.Fill;
import nl.bytesoflife.circuitjson.model.ShapeComponent;
import nl.bytesoflife.circuitjson.model.Stroke;
import nl.bytesoflife.circuitjson.model.TextBox;
import nl.bytesoflife.circuitjson.parser.NodeClause;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

/**
 * A shape with a text clause. The text clause's own position is not used; the text is
 * centered in the shape.
 */
public class TwoNodeBuilder implements ComponentBuilder<TokenSequence.TwoNode> {

    private final AttributeParsers parsers;

    public TwoNodeBuilder(AttributeParsers parsers) {
        this.parsers = parsers;
    }

    @Override
    public TokenKind getSupportedKind() {
        return TokenKind.TWO_NODE;
    }

    @Override
    public Class<TokenSequence.TwoNode> getSequenceType() {
        return TokenSequence.TwoNode.class;
    }

    @Override
    public Component build(TokenSequence.TwoNode sequence) {
        NodeClause shape = sequence.shape();
        Point position = Positions.firstPoint(sequence, parsers.transformer());
        ShapeSpec spec = SingleNodeBuilder.requireShape(parsers, shape);
        Stroke stroke = parsers.strokes().parseOrHidden(shape.options());
        Fill fill = parsers.fills().parse(shape.options()).orElse(Fill.NONE);
        TextBox text = sequence.text()
                .map(clause -> parsers.texts().parseTextBox(clause.label()))
                .orElse(null);
        Orientation orientation = parsers.rotations().parse(shape.options());

        return new ShapeComponent(spec.type(), position, spec.size(), shape.name(), stroke, fill,
                text, null, orientation.rotation(), orientation.scale());
    }
}
