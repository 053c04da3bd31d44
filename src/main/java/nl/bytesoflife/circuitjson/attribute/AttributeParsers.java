package nl.bytesoflife.circuitjson.attribute;

import nl.bytesoflife.circuitjson.config.ConverterSettings;
import nl.bytesoflife.circuitjson.geometry.CoordinateTransformer;

/**
 * The attribute parsers of one converter, sharing its settings.
 */
public class AttributeParsers {

    private final CoordinateTransformer transformer;
    private final ShapeParser shapes;
    private final StrokeParser strokes;
    private final FillParser fills;
    private final RotationParser rotations;
    private final TextParser texts;
    private final ArrowParser arrows;

    public AttributeParsers(ConverterSettings settings) {
        this.transformer = new CoordinateTransformer(settings);
        this.shapes = new ShapeParser(transformer);
        this.strokes = new StrokeParser(new DashPatternCanonicalizer(settings.getLineStyles()));
        this.fills = new FillParser();
        this.rotations = new RotationParser();
        this.texts = new TextParser();
        this.arrows = new ArrowParser(settings.getArrowAliases());
    }

    public CoordinateTransformer transformer() { return transformer; }
    public ShapeParser shapes() { return shapes; }
    public StrokeParser strokes() { return strokes; }
    public FillParser fills() { return fills; }
    public RotationParser rotations() { return rotations; }
    public TextParser texts() { return texts; }
    public ArrowParser arrows() { return arrows; }
}
