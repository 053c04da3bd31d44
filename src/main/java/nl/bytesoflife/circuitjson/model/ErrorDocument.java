package nl.bytesoflife.circuitjson.model;

public record ErrorDocument(String error) implements ConversionResult {

    public static final ErrorDocument NO_DRAWING_BLOCK =
            new ErrorDocument("No valid \\begin{circuitikz} block found.");
}
