package nl.bytesoflife.circuitjson.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import nl.bytesoflife.circuitjson.model.ConversionResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes conversion documents as pretty-printed UTF-8 JSON.
 */
public class DocumentWriter {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(ConversionResult document) throws IOException {
        return mapper.writeValueAsString(document);
    }

    public void write(ConversionResult document, Path target) throws IOException {
        Files.writeString(target, toJson(document), StandardCharsets.UTF_8);
    }
}
