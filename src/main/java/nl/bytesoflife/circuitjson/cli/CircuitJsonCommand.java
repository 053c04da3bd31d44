package nl.bytesoflife.circuitjson.cli;

import nl.bytesoflife.circuitjson.CircuitConverter;
import nl.bytesoflife.circuitjson.batch.BatchConverter;
import nl.bytesoflife.circuitjson.batch.DocumentWriter;
import nl.bytesoflife.circuitjson.config.ConfigLoader;
import nl.bytesoflife.circuitjson.config.ConverterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "circuit-json",
    mixinStandardHelpOptions = true,
    version = "circuit-json 1.0",
    description = "Converts CircuiTikZ drawings in a directory to JSON component documents"
)
public class CircuitJsonCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CircuitJsonCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_FAILURE = 1;
    static final int EXIT_NO_INPUT = 2;

    @Option(names = {"-c", "--config"}, description = "Configuration file overriding the built-in defaults")
    private File configFile;

    @Option(names = {"-p", "--pattern"}, description = "Glob selecting the input files (default: ${DEFAULT-VALUE})")
    private String pattern = BatchConverter.DEFAULT_PATTERN;

    @Parameters(index = "0", arity = "0..1", description = "Directory holding the input files (default: current directory)")
    private Path directory = Path.of(".");

    @Override
    public Integer call() {
        if (!Files.isDirectory(directory)) {
            log.error("Not a directory: {}", directory.toAbsolutePath());
            return EXIT_IO_FAILURE;
        }

        ConverterSettings settings = ConfigLoader.load(configFile);
        BatchConverter batch = new BatchConverter(new CircuitConverter(settings), new DocumentWriter());
        try {
            List<Path> outputs = batch.convertDirectory(directory, pattern);
            if (outputs.isEmpty()) {
                log.warn("No files matching '{}' in {}", pattern, directory.toAbsolutePath());
                return EXIT_NO_INPUT;
            }
            log.info("Wrote {} documents", outputs.size());
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Batch conversion failed: {}", e.getMessage(), e);
            return EXIT_IO_FAILURE;
        }
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CircuitJsonCommand());
        System.exit(commandLine.execute(args));
    }
}
