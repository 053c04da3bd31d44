package nl.bytesoflife.circuitjson.model;

/**
 * One converted drawing element. {@link #type()} is the discriminant written to the output.
 */
public interface Component {

    String type();
}
