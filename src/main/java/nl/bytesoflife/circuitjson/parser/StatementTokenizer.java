package nl.bytesoflife.circuitjson.parser;

import nl.bytesoflife.circuitjson.lexer.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a statement into one of the six token kinds and decomposes it with that kind's
 * grammar.
 */
public class StatementTokenizer {

    private static final Logger log = LoggerFactory.getLogger(StatementTokenizer.class);

    private final PathTokenizer pathTokenizer = new PathTokenizer();

    public TokenSequence tokenize(Statement statement) {
        TokenSequence sequence = switch (statement.type()) {
            case NODE -> tokenizeNodeLine(statement);
            case DRAW, PATH -> tokenizeCommand(statement);
        };
        log.debug("{} -> {}", statement, sequence);
        return sequence;
    }

    private TokenSequence tokenizeNodeLine(Statement statement) {
        // NodeClauseParser carries cursor state, one per statement
        List<NodeClause> clauses = new NodeClauseParser().parse(statement.text(), statement.nodeCount());
        NodeClause lead = clauses.get(0);
        Optional<NodeClause> second = clauseAt(clauses, 1);

        return switch (statement.nodeCount()) {
            case 1 -> lead.declaresShape()
                    ? new TokenSequence.SingleNode(lead)
                    : new TokenSequence.Device(lead, Optional.empty());
            case 2 -> lead.declaresShape()
                    ? new TokenSequence.TwoNode(lead, second)
                    : new TokenSequence.Device(lead, second);
            case 3 -> new TokenSequence.ThreeNode(lead, second, clauseAt(clauses, 2));
            default -> throw new StatementParseException(
                    "Unsupported clause count " + statement.nodeCount(), statement.text(), 0);
        };
    }

    private TokenSequence tokenizeCommand(Statement statement) {
        String text = statement.text().strip() + statement.options().strip();
        List<PathToken> tokens = pathTokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            throw new StatementParseException("No coordinates, options or turn operators", text, 0);
        }

        boolean chain = tokens.stream()
                .anyMatch(t -> t instanceof PathToken.OptionGroup group && group.isChain());
        if (chain) {
            return new TokenSequence.Chain(tokens);
        }

        TokenSequence.Wire wire = new TokenSequence.Wire(tokens);
        if (wire.coordinates().isEmpty()) {
            log.warn("{} statement treated as wire without any coordinate: {}", statement.type(), text);
        }
        return wire;
    }

    private static Optional<NodeClause> clauseAt(List<NodeClause> clauses, int index) {
        return index < clauses.size() ? Optional.of(clauses.get(index)) : Optional.empty();
    }
}
