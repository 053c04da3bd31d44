package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import nl.bytesoflife.circuitjson.geometry.Point;

/**
 * A rectangle or ellipse, optionally carrying a text box and a label.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "position", "size", "name", "stroke", "fill", "text", "label", "rotation", "scale"})
public record ShapeComponent(String type, Point position, Size size, String name, Stroke stroke, Fill fill,
                             TextBox text, Label label,
                             @JsonSerialize(using = CompactNumberSerializer.class) Double rotation, Scale scale) implements Component {

    public static final String RECT = "rect";
    public static final String ELLIPSE = "ellipse";
}
