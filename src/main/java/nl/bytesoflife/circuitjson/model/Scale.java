package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Two-axis scale factors; negative values flip the axis.
 */
@JsonPropertyOrder({"x", "y"})
public record Scale(@JsonSerialize(using = CompactNumberSerializer.class) double x,
                    @JsonSerialize(using = CompactNumberSerializer.class) double y) {

    public static final Scale MIRROR = new Scale(-1, 1);
    public static final Scale INVERT = new Scale(1, -1);
    public static final Scale MIRROR_INVERT = new Scale(-1, -1);
}
