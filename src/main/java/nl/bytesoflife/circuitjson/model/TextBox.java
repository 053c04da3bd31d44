package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Text placed inside a shape. Alignment, justification and padding are fixed to centered
 * with no inner separation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"align", "justify", "innerSep", "showPlaceholderText", "color", "fontSize", "text"})
public record TextBox(String align, String justify, String innerSep, String showPlaceholderText,
                      String color, String fontSize, String text) {

    public static TextBox centered(String color, String fontSize, String text) {
        return new TextBox("1", "0", "0", "true", color, fontSize, text);
    }
}
