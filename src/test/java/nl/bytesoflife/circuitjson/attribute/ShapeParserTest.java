package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.attribute.ShapeParser.ShapeSpec;
import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;
import nl.bytesoflife.circuitjson.model.ShapeComponent;
import nl.bytesoflife.circuitjson.model.Size;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ShapeParserTest {

    private final ShapeParser parser = new ShapeParser(new CoordinateTransformer(37.795286, 37.795286, 38.88379));

    @Test
    void rectangleWithWidthAndHeight() {
        ShapeSpec spec = parser.parse("shape=rectangle, draw, minimum width=2cm, minimum height=1cm").orElseThrow();
        assertEquals(ShapeComponent.RECT, spec.type());
        assertEquals(new Size(77.768, 38.884), spec.size());
    }

    @ParameterizedTest
    @ValueSource(strings = {"circle", "ellipse", "diamond"})
    void nonRectangularShapesCollapseToEllipse(String shape) {
        ShapeSpec spec = parser.parse("shape=" + shape + ", draw").orElseThrow();
        assertEquals(ShapeComponent.ELLIPSE, spec.type());
        assertNull(spec.size());
    }

    @ParameterizedTest
    @ValueSource(strings = {"shape = circle, draw", "shape =circle, draw", "shape= circle, draw"})
    void spacesAroundShapeEquals(String options) {
        ShapeSpec spec = parser.parse(options).orElseThrow();
        assertEquals(ShapeComponent.ELLIPSE, spec.type());
    }

    @Test
    void spacedRectangleStaysRect() {
        assertEquals(ShapeComponent.RECT, parser.parse("shape = rectangle, draw").orElseThrow().type());
    }

    @Test
    void missingHeightMirrorsWidth() {
        ShapeSpec spec = parser.parse("shape=circle, minimum width=1cm").orElseThrow();
        assertEquals(new Size(38.884, 38.884), spec.size());
    }

    @Test
    void negativeWidthClampsToZero() {
        ShapeSpec spec = parser.parse("shape=circle, draw, line width=1pt, minimum width=-0.035cm").orElseThrow();
        assertEquals(0.0, spec.size().x());
        assertEquals(0.0, spec.size().y());
    }

    @Test
    void noShapeDeclaration() {
        assertEquals(Optional.empty(), parser.parse("npn, photo"));
    }
}
