package nl.bytesoflife.circuitjson.geometry;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A position in output units.
 */
@JsonPropertyOrder({"x", "y"})
public record Point(double x, double y) {
}
