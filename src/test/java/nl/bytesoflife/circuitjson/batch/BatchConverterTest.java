package nl.bytesoflife.circuitjson.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.bytesoflife.circuitjson.CircuitConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchConverterTest {

    private static final String CIRCUIT = """
            \\begin{circuitikz}
            \\draw (9.54,10.75) to[cute inductor, l_={$L_1$}] (9.54,9.75);
            \\node[shape=circle, draw, line width=1pt, minimum width=-0.035cm] at (3.5, 8.75){};
            \\end{circuitikz}
            """;

    private final BatchConverter batch = new BatchConverter(new CircuitConverter(), new DocumentWriter());
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void convertsEveryMatchingFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("input-a.tex"), CIRCUIT);
        Files.writeString(dir.resolve("input-b.tex"), "no drawing here");
        Files.writeString(dir.resolve("notes.txt"), CIRCUIT);

        List<Path> outputs = batch.convertDirectory(dir, BatchConverter.DEFAULT_PATTERN);

        assertEquals(List.of(dir.resolve("output-a.json"), dir.resolve("output-b.json")), outputs);

        JsonNode a = mapper.readTree(Files.readString(dir.resolve("output-a.json"), StandardCharsets.UTF_8));
        assertEquals("0.1", a.get("version").asText());
        assertEquals(2, a.get("components").size());
        assertEquals("path", a.get("components").get(0).get("type").asText());

        JsonNode b = mapper.readTree(Files.readString(dir.resolve("output-b.json"), StandardCharsets.UTF_8));
        assertTrue(b.has("error"));
        assertFalse(Files.exists(dir.resolve("notes.json")));
    }

    @Test
    void staleOutputIsReplaced(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("input-a.tex"), CIRCUIT);
        Files.writeString(dir.resolve("output-a.json"), "stale");

        batch.convertDirectory(dir, "input-*.tex");

        String written = Files.readString(dir.resolve("output-a.json"), StandardCharsets.UTF_8);
        assertNotEquals("stale", written);
        assertTrue(mapper.readTree(written).has("components"));
    }

    @Test
    void undeletableOutputAbortsTheBatch(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("input-a.tex"), CIRCUIT);
        Path blocking = Files.createDirectory(dir.resolve("output-a.json"));
        Files.writeString(blocking.resolve("keep.txt"), "x");

        assertThrows(IOException.class, () -> batch.convertDirectory(dir, BatchConverter.DEFAULT_PATTERN));
    }

    @Test
    void nothingMatched(@TempDir Path dir) throws IOException {
        assertEquals(List.of(), batch.convertDirectory(dir, BatchConverter.DEFAULT_PATTERN));
    }

    @Test
    void outputName() {
        assertEquals("output-filter.json", BatchConverter.outputName("input-filter.tex"));
        assertEquals("circuit.json", BatchConverter.outputName("circuit.tex"));
        assertEquals("drawing.txt.json", BatchConverter.outputName("drawing.txt"));
    }
}
