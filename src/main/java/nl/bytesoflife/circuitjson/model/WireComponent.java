package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import nl.bytesoflife.circuitjson.geometry.Point;
import nl.bytesoflife.circuitjson.parser.TurnOperator;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "points", "directions", "stroke", "startArrow", "endArrow"})
public record WireComponent(List<Point> points, List<TurnOperator> directions, Stroke stroke,
                            String startArrow, String endArrow) implements Component {

    public WireComponent {
        points = List.copyOf(points);
        directions = List.copyOf(directions);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return "wire";
    }
}
