package nl.bytesoflife.circuitjson.lexer;

import nl.bytesoflife.circuitjson.config.StatementOrder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementExtractorTest {

    private static final String BODY = """
            \\draw (1,1) -- (2,1);
            \\node[shape=circle, draw] at (3.5, 8.75){};
            \\path (0,0) to[R, l={$R_1$}] (2,0);
            \\node[npn, photo](N1) at (10.75, 7.98){} node[anchor=north west] at (N1.text){$Q_1$};
            \\draw[line width=1pt] (0,0) -| (1,1);
            """;

    @Test
    void sourceOrder() {
        List<Statement> statements = new StatementExtractor(StatementOrder.SOURCE).extract(BODY);
        assertEquals(List.of(StatementType.DRAW, StatementType.NODE, StatementType.PATH, StatementType.NODE,
                StatementType.DRAW), statements.stream().map(Statement::type).toList());
    }

    @Test
    void groupedOrderPutsNodeLinesFirst() {
        List<Statement> statements = new StatementExtractor(StatementOrder.GROUPED).extract(BODY);
        assertEquals(List.of(StatementType.NODE, StatementType.NODE, StatementType.DRAW, StatementType.DRAW,
                StatementType.PATH), statements.stream().map(Statement::type).toList());
    }

    @Test
    void drawOptionsAndTextAreSeparated() {
        List<Statement> statements = new StatementExtractor().extract("\\draw[line width=1pt] (0,0) -| (1,1);");
        assertEquals(1, statements.size());
        Statement draw = statements.get(0);
        assertEquals("[line width=1pt]", draw.options());
        assertEquals(" (0,0) -| (1,1)", draw.text());
        assertEquals(0, draw.nodeCount());
    }

    @Test
    void nodeLinesCarryClauseCount() {
        List<Statement> statements = new StatementExtractor().extract(BODY);
        assertEquals(List.of(1, 2), statements.stream()
                .filter(s -> s.type() == StatementType.NODE)
                .map(Statement::nodeCount)
                .toList());
    }

    @Test
    void directionalStatementsAreSkipped() {
        String body = """
                \\draw[->] (0,0) -- (1,0);
                \\draw[<-, line width=1pt] (0,0) -- (1,0);
                \\path[<->] (0,0) -- (1,0);
                \\draw[stealth-latex] (0,0) -- (1,0);
                """;
        List<Statement> statements = new StatementExtractor().extract(body);
        assertEquals(1, statements.size());
        assertEquals("[stealth-latex]", statements.get(0).options());
    }

    @Test
    void statementsSpanningLines() {
        List<Statement> statements = new StatementExtractor().extract("\\draw (0,0)\n  -- (1,0)\n  -- (1,1);");
        assertEquals(1, statements.size());
        assertTrue(statements.get(0).text().contains("(1,1)"));
    }

    @Test
    void nodeLinesWithTooManyClausesAreIgnored() {
        String line = "\\node[a] at (0,0){} node[b] at (1,1){} node[c] at (2,2){} node[d] at (3,3){};";
        assertTrue(new StatementExtractor().extract(line).isEmpty());
    }

    @Test
    void commentedStatementsAreIgnored() {
        assertTrue(new StatementExtractor().extract("% \\draw (0,0) -- (1,0);").isEmpty());
    }

    @Test
    void countClauses() {
        assertEquals(3, StatementExtractor.countClauses(
                "\\node[shape=rectangle](X1) at (1,2){} node[anchor=south] at (X1.north){} node[anchor=north] at (1,3){};"));
        assertEquals(0, StatementExtractor.countClauses("\\draw (0,0) -- (1,0);"));
    }
}
