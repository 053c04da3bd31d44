package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Width ({@code x}) and height ({@code y}) in output units.
 */
@JsonPropertyOrder({"x", "y"})
public record Size(double x, double y) {
}
