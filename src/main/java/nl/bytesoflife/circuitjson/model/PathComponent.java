package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import nl.bytesoflife.circuitjson.geometry.Point;

import java.util.List;

/**
 * A two-terminal element drawn with {@code to[...]} between two points, e.g. a resistor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "points", "label", "scale", "id", "name"})
public record PathComponent(List<Point> points, String id, String name, Label label, Scale scale)
        implements Component {

    public PathComponent {
        points = List.copyOf(points);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return "path";
    }
}
