package nl.bytesoflife.circuitjson.model;

/**
 * The document written for one input: either the component list or an error.
 */
public sealed interface ConversionResult permits ComponentDocument, ErrorDocument {
}
