package nl.bytesoflife.circuitjson.batch;

import nl.bytesoflife.circuitjson.CircuitConverter;
import nl.bytesoflife.circuitjson.model.ConversionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts every matching document in a directory, writing one JSON file next to each input.
 * {@code input-foo.tex} is written to {@code output-foo.json}.
 */
public class BatchConverter {

    private static final Logger log = LoggerFactory.getLogger(BatchConverter.class);

    public static final String DEFAULT_PATTERN = "*.tex";

    private final CircuitConverter converter;
    private final DocumentWriter writer;

    public BatchConverter(CircuitConverter converter, DocumentWriter writer) {
        this.converter = converter;
        this.writer = writer;
    }

    /**
     * @return the written output files in input name order, empty when nothing matched
     * @throws IOException when an input cannot be read, or an output cannot be deleted or written
     */
    public List<Path> convertDirectory(Path directory, String pattern) throws IOException {
        List<Path> inputs = findInputs(directory, pattern);
        log.info("Found {} files matching '{}' in {}", inputs.size(), pattern, directory);

        List<Path> outputs = new ArrayList<>();
        for (Path input : inputs) {
            outputs.add(convertFile(input));
        }
        return outputs;
    }

    public Path convertFile(Path input) throws IOException {
        Path output = input.resolveSibling(outputName(input.getFileName().toString()));
        if (Files.deleteIfExists(output)) {
            log.info("Deleted stale output {}", output);
        }

        String document = Files.readString(input, StandardCharsets.UTF_8);
        ConversionReport report = converter.convert(document);
        writer.write(report.toDocument(converter.getSettings().getFormatVersion()), output);

        if (report.isDrawingFound()) {
            log.info("Converted {} -> {} ({} components, {} skipped)", input.getFileName(), output.getFileName(),
                    report.getComponents().size(), report.getSkippedStatements().size());
        } else {
            log.warn("No drawing block in {}, wrote error document {}", input.getFileName(), output.getFileName());
        }
        return output;
    }

    static List<Path> findInputs(Path directory, String pattern) throws IOException {
        List<Path> inputs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, pattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    inputs.add(path);
                }
            }
        }
        Collections.sort(inputs);
        return inputs;
    }

    static String outputName(String inputName) {
        String name = inputName.replace("input-", "output-");
        if (name.endsWith(".tex")) {
            return name.substring(0, name.length() - ".tex".length()) + ".json";
        }
        return name + ".json";
    }
}
