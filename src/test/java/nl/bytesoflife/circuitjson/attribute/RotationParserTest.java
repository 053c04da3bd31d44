package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.attribute.RotationParser.Orientation;
import nl.bytesoflife.circuitjson.model.Scale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RotationParserTest {

    private final RotationParser parser = new RotationParser();

    static Stream<Arguments> inferenceCases() {
        return Stream.of(
                Arguments.of("xscale=1, yscale=-1, rotate=45", new Orientation(45.0, new Scale(1, -1))),
                Arguments.of("xscale=2", new Orientation(-180.0, new Scale(-2, -2))),
                Arguments.of("xscale=-1", new Orientation(-180.0, new Scale(1, 1))),
                Arguments.of("yscale=-1", new Orientation(null, new Scale(1, -1))),
                Arguments.of("rotate=90", new Orientation(90.0, null)),
                Arguments.of("xscale=0.5, rotate=-45", new Orientation(-45.0, null)),
                Arguments.of("xscale=0.5, yscale=-0.5", new Orientation(null, new Scale(0.5, -0.5))),
                Arguments.of("npn, photo", Orientation.NONE)
        );
    }

    @ParameterizedTest
    @MethodSource("inferenceCases")
    void inference(String options, Orientation expected) {
        assertEquals(expected, parser.parse(options));
    }

    @ParameterizedTest
    @MethodSource("twoAxisScales")
    void twoAxisScaleIsPassedThroughWithoutRotation(double x, double y) {
        Orientation orientation = parser.parse("xscale=" + x + ", yscale=" + y);
        assertTrue(orientation.optionalRotation().isEmpty());
        assertEquals(new Scale(x, y), orientation.scale());
    }

    static Stream<Arguments> twoAxisScales() {
        return Stream.of(
                Arguments.of(1.0, 1.0),
                Arguments.of(-1.0, 1.0),
                Arguments.of(0.75, -2.5),
                Arguments.of(-3.0, -0.25)
        );
    }

    @Test
    void negatedZeroScaleIsPositive() {
        Orientation orientation = parser.parse("yscale=0");
        assertEquals(0.0, orientation.scale().x());
    }
}
