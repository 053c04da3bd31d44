package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.attribute.OptionSplitter;
import nl.bytesoflife.circuitjson.attribute.RotationParser.Orientation;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.DeviceComponent;
import nl.bytesoflife.circuitjson.model.Label;
import nl.bytesoflife.circuitjson.parser.NodeClause;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Device nodes: the first option is the device identifier, the rest are its modifiers.
 * A chained clause becomes a default-placed label carrying the clause's math text.
 */
public class DeviceBuilder implements ComponentBuilder<TokenSequence.Device> {

    static final String DEFAULT_PLACEMENT = "default";

    private static final Pattern MATH_CONTENT = Pattern.compile("\\$(.*)\\$", Pattern.DOTALL);

    private final AttributeParsers parsers;
    private final String labelDistance;

    public DeviceBuilder(AttributeParsers parsers, String labelDistance) {
        this.parsers = parsers;
        this.labelDistance = labelDistance;
    }

    @Override
    public TokenKind getSupportedKind() {
        return TokenKind.DEVICE;
    }

    @Override
    public Class<TokenSequence.Device> getSequenceType() {
        return TokenSequence.Device.class;
    }

    @Override
    public Component build(TokenSequence.Device sequence) {
        NodeClause device = sequence.device();
        Point position = Positions.firstPoint(sequence, parsers.transformer());

        List<String> parts = OptionSplitter.split(device.options());
        String id = parts.isEmpty() ? "" : parts.get(0);
        List<String> modifiers = parts.size() > 1 ? parts.subList(1, parts.size()) : List.of();

        Label label = sequence.label().map(this::buildLabel).orElse(null);

        Orientation orientation = modifiers.isEmpty()
                ? Orientation.NONE
                : parsers.rotations().parse(device.options());

        return new DeviceComponent(position, id, modifiers, label, orientation.rotation(), orientation.scale());
    }

    private Label buildLabel(NodeClause clause) {
        Matcher m = MATH_CONTENT.matcher(clause.label());
        return Label.builder()
                .anchor(DEFAULT_PLACEMENT)
                .position(DEFAULT_PLACEMENT)
                .distance(labelDistance)
                .value(m.find() ? m.group(1) : null)
                .build();
    }
}
