package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.attribute.AttributeParsers;
import nl.bytesoflife.circuitjson.config.ConverterSettings;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.model.Label;
import nl.bytesoflife.circuitjson.model.PathComponent;
import nl.bytesoflife.circuitjson.model.Scale;
import nl.bytesoflife.circuitjson.parser.PathTokenizer;
import nl.bytesoflife.circuitjson.parser.TokenSequence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChainBuilderTest {

    private final ChainBuilder builder = new ChainBuilder(new AttributeParsers(ConverterSettings.defaults()), "0.12cm");
    private final PathTokenizer tokenizer = new PathTokenizer();

    private PathComponent build(String text) {
        return (PathComponent) builder.build(new TokenSequence.Chain(tokenizer.tokenize(text)));
    }

    @Test
    void inductorWithOtherSideLabel() {
        PathComponent path = build("(9.54, 10.75) to[cute inductor, l_={$L_1$}] (9.54, 9.75)");

        assertEquals("path", path.type());
        assertEquals(List.of(new Point(360.567, -406.299), new Point(360.567, -368.504)), path.points());
        assertEquals("cute inductor", path.id());
        assertEquals(Label.builder().value("L_1").otherSide(true).distance("0.12cm").build(), path.label());
        assertNull(path.name());
        assertNull(path.scale());
    }

    @Test
    void mirrorInvertAndName() {
        PathComponent path = build("(0,0) to[R, l={$R_1$}, mirror, invert, name=R1] (2,0)");

        assertEquals(List.of(new Point(0, 0), new Point(75.591, 0)), path.points());
        assertEquals("R", path.id());
        assertEquals("R1", path.name());
        assertEquals("R_1", path.label().value());
        assertNull(path.label().otherSide());
        assertEquals(Scale.MIRROR_INVERT, path.scale());
    }

    @Test
    void mirrorOrInvertAlone() {
        assertEquals(Scale.MIRROR, build("(0,0) to[C, mirror] (1,0)").scale());
        assertEquals(Scale.INVERT, build("(0,0) to[C, invert] (1,0)").scale());
    }

    @Test
    void bareElement() {
        PathComponent path = build("(0,0) to[short] (1,0)");
        assertEquals("short", path.id());
        assertNull(path.label());
        assertNull(path.scale());
    }

    @Test
    void labelWithoutMathIsLeftOut() {
        PathComponent braced = build("(0,0) to[R, l={R_1}] (2,0)");
        assertEquals("R", braced.id());
        assertNull(braced.label());

        PathComponent unbraced = build("(0,0) to[R, l=R1, mirror] (2,0)");
        assertNull(unbraced.label());
        assertEquals(Scale.MIRROR, unbraced.scale());
    }

    @Test
    void unbracedMathLabelHasNoValueAndIsLeftOut() {
        PathComponent path = build("(0,0) to[R, l=$R_1$, name=R1] (2,0)");
        assertNull(path.label());
        assertEquals("R1", path.name());
    }

    @Test
    void mirrorInvertLookup() {
        assertEquals(Optional.empty(), ChainBuilder.mirrorInvert(List.of("R", "l={x}")));
        assertEquals(Optional.of(Scale.MIRROR_INVERT), ChainBuilder.mirrorInvert(List.of("invert", "mirror")));
    }
}
