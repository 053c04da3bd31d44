package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.attribute.RotationParser.Orientation;
import nl.bytesoflife.circuitjson.attribute.ShapeParser.ShapeSpec;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.ShapeComponent;
import nl.bytesoflife.circuitjson.model.Stroke;
import nl.bytesoflife.circuitjson.parser.NodeClause;
import nl.bytesoflife.circuitjson.parser.StatementParseException;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

public class SingleNodeBuilder implements ComponentBuilder<TokenSequence.SingleNode> {

    private final AttributeParsers parsers;

    public SingleNodeBuilder(AttributeParsers parsers) {
        this.parsers = parsers;
    }

    @Override
    public TokenKind getSupportedKind() {
        return TokenKind.NODE;
    }

    @Override
    public Class<TokenSequence.SingleNode> getSequenceType() {
        return TokenSequence.SingleNode.class;
    }

    @Override
    public Component build(TokenSequence.SingleNode sequence) {
        NodeClause shape = sequence.shape();
        Point position = Positions.firstPoint(sequence, parsers.transformer());
        ShapeSpec spec = requireShape(parsers, shape);
        Stroke stroke = parsers.strokes().parseOrHidden(shape.options());
        Orientation orientation = parsers.rotations().parse(shape.options());

        return new ShapeComponent(spec.type(), position, spec.size(), shape.name(), stroke, null,
                null, null, orientation.rotation(), orientation.scale());
    }

    static ShapeSpec requireShape(AttributeParsers parsers, NodeClause clause) {
        return parsers.shapes().parse(clause.options())
                .orElseThrow(() -> new StatementParseException("No shape declaration", clause.options(), 0));
    }
}
