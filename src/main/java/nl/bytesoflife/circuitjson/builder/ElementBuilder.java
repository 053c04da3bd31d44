package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.config.ConverterSettings;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.parser.TokenKind;
import nl.bytesoflife.circuitjson.parser.TokenSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches token sequences to the builder registered for their kind.
 */
public class ElementBuilder {

    private static final Logger log = LoggerFactory.getLogger(ElementBuilder.class);

    private final Map<TokenKind, ComponentBuilder<?>> builders = new EnumMap<>(TokenKind.class);

    public ElementBuilder registerBuilder(ComponentBuilder<?> builder) {
        builders.put(builder.getSupportedKind(), builder);
        return this;
    }

    /**
     * An element builder with a builder for every token kind.
     */
    public static ElementBuilder withDefaultBuilders(ConverterSettings settings) {
        AttributeParsers parsers = new AttributeParsers(settings);
        return new ElementBuilder()
                .registerBuilder(new ChainBuilder(parsers, settings.getChainLabelDistance()))
                .registerBuilder(new SingleNodeBuilder(parsers))
                .registerBuilder(new TwoNodeBuilder(parsers))
                .registerBuilder(new ThreeNodeBuilder(parsers, settings.getShapeLabelDistance()))
                .registerBuilder(new DeviceBuilder(parsers, settings.getDeviceLabelDistance()))
                .registerBuilder(new WireBuilder(parsers));
    }

    /**
     * @return empty when no builder handles the sequence's kind
     */
    public Optional<Component> build(TokenSequence sequence) {
        ComponentBuilder<?> builder = builders.get(sequence.kind());
        if (builder == null) {
            log.warn("No builder for element kind '{}', statement skipped", sequence.kind().getName());
            return Optional.empty();
        }
        return Optional.of(buildWith(builder, sequence));
    }

    private static <T extends TokenSequence> Component buildWith(ComponentBuilder<T> builder, TokenSequence sequence) {
        return builder.build(builder.getSequenceType().cast(sequence));
    }
}
