package nl.bytesoflife.circuitjson.builder;

import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.parser.TokenSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

final class Positions {

    private static final Logger log = LoggerFactory.getLogger(Positions.class);

    private Positions() {
    }

    /**
     * The first absolute coordinate of the statement, or null when every coordinate is
     * anchor-relative.
     */
    static Point firstPoint(TokenSequence sequence, CoordinateTransformer transformer) {
        List<Point> points = transformer.parseAll(sequence.coordinates());
        if (points.isEmpty()) {
            log.warn("No absolute coordinate in {} statement {}, position omitted",
                    sequence.kind().getName(), sequence.coordinates());
            return null;
        }
        return points.get(0);
    }
}
