package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"version", "components"})
public record ComponentDocument(String version, List<Component> components) implements ConversionResult {

    public ComponentDocument {
        components = List.copyOf(components);
    }
}
