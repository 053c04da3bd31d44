package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Border or line attributes.
 *
 * @param width   line width with unit, e.g. {@code 1pt}
 * @param opacity draw opacity
 * @param style   canonical dash style name; absent means solid
 * @param color   {@code rgb(r,g,b)}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"width", "opacity", "style", "color"})
public record Stroke(String width, @JsonSerialize(using = CompactNumberSerializer.class) Double opacity,
                     String style, String color) {

    /**
     * Written for shapes without a draw option: tells the renderer not to draw a border.
     */
    public static final Stroke HIDDEN = new Stroke(null, 0.0, null, null);

    public static Stroke ofWidth(String width) {
        return new Stroke(width, null, null, null);
    }

    @JsonIgnore
    public boolean isHidden() {
        return equals(HIDDEN);
    }
}
