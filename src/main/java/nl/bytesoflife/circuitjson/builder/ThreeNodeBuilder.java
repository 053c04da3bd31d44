package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.attribute.RotationParser.Orientation;
import nl.bytesoflife.circuitjson.attribute.ShapeParser.ShapeSpec;
import nl.bytesoflife.circuitjson.attribute.TextParser;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.Fill;
import nl.bytesoflife.circuitjson.model.Label;
import nl.bytesoflife.circuitjson.model.ShapeComponent;
import nl.bytesoflife.circuitjson.model.Stroke;
import nl.bytesoflife.circuitjson.model.TextBox;
import nl.bytesoflife.circuitjson.parser.NodeClause;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

/**
 * A shape with an identifier label clause and a text clause. The label is placed at a fixed
 * position relative to the shape since anchor-relative coordinates are not resolved.
 */
public class ThreeNodeBuilder implements ComponentBuilder<TokenSequence.ThreeNode> {

    static final String LABEL_POSITION = "northeast";

    private final AttributeParsers parsers;
    private final String labelDistance;

    public ThreeNodeBuilder(AttributeParsers parsers, String labelDistance) {
        this.parsers = parsers;
        this.labelDistance = labelDistance;
    }

    @Override
    public TokenKind getSupportedKind() {
        return TokenKind.THREE_NODE;
    }

    @Override
    public Class<TokenSequence.ThreeNode> getSequenceType() {
        return TokenSequence.ThreeNode.class;
    }

    @Override
    public Component build(TokenSequence.ThreeNode sequence) {
        NodeClause shape = sequence.shape();
        Point position = Positions.firstPoint(sequence, parsers.transformer());
        ShapeSpec spec = SingleNodeBuilder.requireShape(parsers, shape);
        Stroke stroke = parsers.strokes().parseOrHidden(shape.options());
        Fill fill = parsers.fills().parse(shape.options()).orElse(Fill.NONE);
        TextBox text = sequence.text()
                .map(clause -> parsers.texts().parseTextBox(clause.label()))
                .orElse(null);
        Label label = sequence.label()
                .map(clause -> buildLabel(clause, sequence.text().isPresent()))
                .orElse(null);
        Orientation orientation = parsers.rotations().parse(shape.options());

        return new ShapeComponent(spec.type(), position, spec.size(), shape.name(), stroke, fill,
                text, label, orientation.rotation(), orientation.scale());
    }

    private Label buildLabel(NodeClause clause, boolean hasTextClause) {
        TextParser.FormattedText formatted = parsers.texts().format(clause.label());
        Label.Builder label = Label.builder()
                .value(TextParser.stripDollars(formatted.text()))
                .fontSize(formatted.fontSize())
                .anchor(clause.anchor().orElse(null));
        if (hasTextClause) {
            label.position(LABEL_POSITION)
                    .relativeToComponent(true)
                    .distance(labelDistance);
        }
        return label.build();
    }
}
