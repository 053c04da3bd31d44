package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"opacity", "color"})
public record Fill(@JsonSerialize(using = CompactNumberSerializer.class) Double opacity, String color) {

    /** Written for shapes without a fill option. */
    public static final Fill NONE = new Fill(null, null);
}
