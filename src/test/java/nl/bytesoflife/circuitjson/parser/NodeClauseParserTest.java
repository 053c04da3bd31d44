package nl.bytesoflife.circuitjson.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NodeClauseParserTest {

    private final NodeClauseParser parser = new NodeClauseParser();

    @Test
    void singleClause() {
        List<NodeClause> clauses = parser.parse(
                "\\node[shape=circle, draw, line width=1pt, minimum width=-0.035cm] at (3.5, 8.75){};", 1);
        assertEquals(1, clauses.size());
        NodeClause clause = clauses.get(0);
        assertEquals("shape=circle, draw, line width=1pt, minimum width=-0.035cm", clause.options());
        assertNull(clause.name());
        assertEquals("(3.5, 8.75)", clause.coordinate());
        assertEquals("", clause.label());
        assertTrue(clause.declaresShape());
    }

    @Test
    void threeClauses() {
        String line = "\\node[shape=rectangle, fill={rgb,255:red,255;green,255;blue,128}, draw](X1) at (14.125, 7.875){} "
                + "node[anchor=south] at ([yshift=0.04cm]X1.north east){$U_1$} "
                + "node[anchor=north, align=center, text width=1.242cm, inner sep=7.2pt] at (14.125, 8.5){This is fun, $e_t$};";
        List<NodeClause> clauses = parser.parse(line, 3);

        assertEquals(3, clauses.size());
        assertEquals("X1", clauses.get(0).name());
        assertEquals("shape=rectangle, fill={rgb,255:red,255;green,255;blue,128}, draw", clauses.get(0).options());
        assertEquals("([yshift=0.04cm]X1.north east)", clauses.get(1).coordinate());
        assertEquals("$U_1$", clauses.get(1).label());
        assertEquals(Optional.of("south"), clauses.get(1).anchor());
        assertEquals("(14.125, 8.5)", clauses.get(2).coordinate());
        assertEquals("This is fun, $e_t$", clauses.get(2).label());
    }

    @Test
    void labelWithNestedBracesAndEscapes() {
        List<NodeClause> clauses = parser.parse("\\node[shape=rectangle] at (0,0){\\textcolor{red}{a \\} b}};", 1);
        assertEquals("\\textcolor{red}{a \\} b}", clauses.get(0).label());
    }

    @Test
    void deviceWithNameAndModifiers() {
        List<NodeClause> clauses = parser.parse(
                "\\node[npn, photo, rotate=-45, yscale=-1](N1) at (10.75, 7.98){} node[anchor=north west] at (N1.text){$Q_1$};", 2);
        assertEquals(2, clauses.size());
        assertFalse(clauses.get(0).declaresShape());
        assertEquals(Optional.of("N1"), clauses.get(0).optionalName());
        assertEquals("(N1.text)", clauses.get(1).coordinate());
    }

    @Test
    void blankNameIsAbsent() {
        NodeClause clause = parser.parse("\\node[npn]( ) at (0,0){};", 1).get(0);
        assertEquals(Optional.empty(), clause.optionalName());
    }

    @Test
    void brokenChainedClauseKeepsLeadingClauses() {
        List<NodeClause> clauses = parser.parse("\\node[npn](N1) at (1,2){} node[anchor=west] (N1.text){$Q_1$};", 2);
        assertEquals(1, clauses.size());
        assertEquals("npn", clauses.get(0).options());
    }

    @Test
    void brokenLeadingClauseFails() {
        StatementParseException e = assertThrows(StatementParseException.class,
                () -> parser.parse("\\node[shape=circle] (0,0){};", 1));
        assertTrue(e.getMessage().contains("Expected 'at'"), e.getMessage());
        assertEquals("\\node[shape=circle] (0,0){};", e.getStatement());
    }

    @Test
    void unterminatedOptionsFail() {
        assertThrows(StatementParseException.class, () -> parser.parse("\\node[shape=circle at (0,0){};", 1));
    }

    @Test
    void missingNodeCommandFails() {
        assertThrows(StatementParseException.class, () -> parser.parse("node[a] at (0,0){};", 1));
    }

    @Test
    void shapeDeclarationMustLead() {
        NodeClause clause = new NodeClause("draw, shape=circle", null, "(0,0)", "");
        assertFalse(clause.declaresShape());
        assertTrue(new NodeClause(" shape = circle", null, "(0,0)", "").declaresShape());
    }
}
