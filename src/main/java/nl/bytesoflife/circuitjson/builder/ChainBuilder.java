package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.attribute.LabelExtractor;
import nl.bytesoflife.circuitjson.attribute.LabelExtractor.ChainLabel;
import nl.bytesoflife.circuitjson.attribute.OptionSplitter;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.Label;
import nl.bytesoflife.circuitjson.model.PathComponent;
import nl.bytesoflife.circuitjson.model.Scale;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

import java.util.List;
import java.util.Optional;

/**
 * Two-terminal elements drawn with {@code (a) to[element, options] (b)}. Only math labels are
 * written, e.g. {@code l={$R_1$}}; a label without {@code $} or without braces is left out.
 */
public class ChainBuilder implements ComponentBuilder<TokenSequence.Chain> {

    private static final String NAME_OPTION = "name=";
    private static final String MATH_DELIMITER = "$";

    private final AttributeParsers parsers;
    private final String labelDistance;

    public ChainBuilder(AttributeParsers parsers, String labelDistance) {
        this.parsers = parsers;
        this.labelDistance = labelDistance;
    }

    @Override
    public TokenKind getSupportedKind() {
        return TokenKind.TO;
    }

    @Override
    public Class<TokenSequence.Chain> getSequenceType() {
        return TokenSequence.Chain.class;
    }

    @Override
    public Component build(TokenSequence.Chain sequence) {
        List<Point> points = parsers.transformer().parseAll(sequence.coordinates());
        List<String> parts = OptionSplitter.split(sequence.elementOptions());

        String id = parts.isEmpty() ? "" : parts.get(0);
        boolean labelled = sequence.elementOptions().contains(MATH_DELIMITER);
        String name = null;
        Label label = null;
        for (String part : parts.subList(Math.min(1, parts.size()), parts.size())) {
            if (part.startsWith(NAME_OPTION)) {
                name = part.substring(NAME_OPTION.length()).strip();
            } else if (labelled && label == null) {
                label = LabelExtractor.extract(part)
                        .filter(chainLabel -> chainLabel.text() != null)
                        .map(this::buildLabel)
                        .orElse(null);
            }
        }

        return new PathComponent(points, id, name, label, mirrorInvert(parts).orElse(null));
    }

    private Label buildLabel(ChainLabel chainLabel) {
        return Label.builder()
                .value(chainLabel.text())
                .otherSide(chainLabel.otherSide())
                .distance(labelDistance)
                .build();
    }

    static Optional<Scale> mirrorInvert(List<String> parts) {
        boolean mirror = parts.contains("mirror");
        boolean invert = parts.contains("invert");
        if (mirror && invert) {
            return Optional.of(Scale.MIRROR_INVERT);
        } else if (mirror) {
            return Optional.of(Scale.MIRROR);
        } else if (invert) {
            return Optional.of(Scale.INVERT);
        }
        return Optional.empty();
    }
}
