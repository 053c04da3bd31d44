package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import nl.bytesoflife.circuitjson.geometry.Point;

import java.util.List;

/**
 * A CircuiTikZ device node such as a transistor or logic gate.
 *
 * @param id      device identifier, e.g. {@code npn}
 * @param options device modifiers in source order, e.g. {@code photo}, {@code xscale=0.5}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "position", "id", "options", "label", "rotation", "scale"})
public record DeviceComponent(Point position, String id, List<String> options, Label label,
                              @JsonSerialize(using = CompactNumberSerializer.class) Double rotation,
                              Scale scale) implements Component {

    public DeviceComponent {
        options = List.copyOf(options);
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return "node";
    }
}
