package nl.bytesoflife.circuitjson.lexer;

import nl.bytesoflife.circuitjson.config.StatementOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a drawing body into node, draw and path statements.
 * <p>
 * Node statements are recognized per line by counting {@code node[} clause introducers (one to
 * three). Draw and path statements are matched across lines up to their semicolon; those whose
 * options declare a directional arrow are dropped.
 */
public class StatementExtractor {

    private static final Logger log = LoggerFactory.getLogger(StatementExtractor.class);

    private static final Pattern NODE_COMMAND = Pattern.compile("\\\\node\\b");
    private static final Pattern NODE_CLAUSE = Pattern.compile("node\\[");
    private static final Pattern DRAW_COMMAND = Pattern.compile("\\\\draw(\\[.*?\\])?(.*?);", Pattern.DOTALL);
    private static final Pattern PATH_COMMAND = Pattern.compile("\\\\path(\\[.*?\\])?(.*?);", Pattern.DOTALL);
    private static final Pattern DIRECTIONAL_ARROW = Pattern.compile("\\[.*?(<-|->|<->).*?\\]", Pattern.DOTALL);

    private final StatementOrder order;

    public StatementExtractor() {
        this(StatementOrder.SOURCE);
    }

    public StatementExtractor(StatementOrder order) {
        this.order = order;
    }

    public List<Statement> extract(String body) {
        String clean = Preprocessor.stripComments(body);
        List<Statement> statements = new ArrayList<>();

        extractNodeLines(clean, statements);
        extractCommands(clean, DRAW_COMMAND, StatementType.DRAW, statements);
        extractCommands(clean, PATH_COMMAND, StatementType.PATH, statements);

        if (order == StatementOrder.SOURCE) {
            statements.sort(Comparator.comparingInt(Statement::offset));
        }
        log.debug("Extracted {} statements", statements.size());
        return statements;
    }

    private void extractNodeLines(String body, List<Statement> statements) {
        int lineStart = 0;
        for (String line : body.split("\n", -1)) {
            if (NODE_COMMAND.matcher(line).find()) {
                int clauses = countClauses(line);
                if (clauses >= 1 && clauses <= 3) {
                    statements.add(Statement.nodeLine(line, lineStart, clauses));
                } else {
                    log.debug("Ignoring node line with {} clauses: {}", clauses, line.strip());
                }
            }
            lineStart += line.length() + 1;
        }
    }

    private void extractCommands(String body, Pattern command, StatementType type, List<Statement> statements) {
        Matcher m = command.matcher(body);
        while (m.find()) {
            String options = m.group(1) != null ? m.group(1) : "";
            if (DIRECTIONAL_ARROW.matcher(options).find()) {
                log.debug("Skipping directional {} statement at {}", type, m.start());
                continue;
            }
            statements.add(Statement.command(type, m.group(2), options, m.start()));
        }
    }

    static int countClauses(String line) {
        Matcher m = NODE_CLAUSE.matcher(line);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
