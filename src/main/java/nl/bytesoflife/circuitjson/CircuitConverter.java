package nl.bytesoflife.circuitjson;

import nl.bytesoflife.circuitjson.builder.ElementBuilder;
import nl.bytesoflife.circuitjson.config.ConverterSettings;
import nl.bytesoflife.circuitjson.lexer.CoordinateDefinitionParser;
import nl.bytesoflife.circuitjson.lexer.Preprocessor;
import nl.bytesoflife.circuitjson.lexer.Statement;
import nl.bytesoflife.circuitjson.lexer.StatementExtractor;
import nl.bytesoflife.circuitjson.model.Component;
import nl.bytesoflife.circuitjson.model.ConversionReport;
import nl.bytesoflife.circuitjson.model.ConversionResult;
import nl.bytesoflife.circuitjson.parser.StatementParseException;
import nl.bytesoflife.circuitjson.parser.StatementTokenizer;
import nl.bytesoflife.circuitjson.parser.TokenSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts a CircuiTikZ document into component records.
 * <p>
 * Each statement is converted independently; a statement that fails to parse is logged and
 * recorded on the report, and conversion continues with the next one. A converter holds no
 * per-document state and may be shared between threads.
 */
public class CircuitConverter {

    private static final Logger log = LoggerFactory.getLogger(CircuitConverter.class);

    private final ConverterSettings settings;
    private final Preprocessor preprocessor = new Preprocessor();
    private final CoordinateDefinitionParser coordinateParser = new CoordinateDefinitionParser();
    private final StatementExtractor extractor;
    private final StatementTokenizer tokenizer = new StatementTokenizer();
    private final ElementBuilder elementBuilder;

    public CircuitConverter() {
        this(ConverterSettings.defaults());
    }

    public CircuitConverter(ConverterSettings settings) {
        this.settings = settings;
        this.extractor = new StatementExtractor(settings.getStatementOrder());
        this.elementBuilder = ElementBuilder.withDefaultBuilders(settings);
    }

    public ConversionReport convert(String document) {
        Optional<String> body = preprocessor.extractDrawingBody(document);
        if (body.isEmpty()) {
            log.warn("No circuitikz or tikzpicture block found");
            return ConversionReport.noDrawing();
        }

        ConversionReport report = ConversionReport.forDrawing(coordinateParser.parse(body.get()));
        for (Statement statement : extractor.extract(body.get())) {
            try {
                TokenSequence sequence = tokenizer.tokenize(statement);
                Optional<Component> component = elementBuilder.build(sequence);
                if (component.isPresent()) {
                    report.addComponent(component.get());
                } else {
                    report.addSkippedStatement(statement.text().strip(),
                            "no builder for " + sequence.kind().getName());
                }
            } catch (StatementParseException e) {
                log.warn("Skipping statement '{}': {}", statement.text().strip(), e.getMessage());
                report.addSkippedStatement(statement.text().strip(), e.getMessage());
            }
        }
        log.debug("{}", report);
        return report;
    }

    /**
     * Converts a document straight to the document shape that gets written.
     */
    public ConversionResult toDocument(String document) {
        return convert(document).toDocument(settings.getFormatVersion());
    }

    public ConverterSettings getSettings() {
        return settings;
    }
}
