package nl.bytesoflife.circuitjson.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Label attached to a component. Which fields are set depends on the component kind.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"value", "otherSide", "anchor", "position", "relativeToComponent", "distance", "fontSize"})
public record Label(String value, String otherSide, String anchor, String position,
                    String relativeToComponent, String distance, String fontSize) {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String value;
        private String otherSide;
        private String anchor;
        private String position;
        private String relativeToComponent;
        private String distance;
        private String fontSize;

        public Builder value(String value) { this.value = value; return this; }
        public Builder otherSide(boolean otherSide) { this.otherSide = otherSide ? "true" : null; return this; }
        public Builder anchor(String anchor) { this.anchor = anchor; return this; }
        public Builder position(String position) { this.position = position; return this; }
        public Builder relativeToComponent(boolean relative) { this.relativeToComponent = relative ? "true" : null; return this; }
        public Builder distance(String distance) { this.distance = distance; return this; }
        public Builder fontSize(String fontSize) { this.fontSize = fontSize; return this; }

        public Label build() {
            return new Label(value, otherSide, anchor, position, relativeToComponent, distance, fontSize);
        }
    }
}
