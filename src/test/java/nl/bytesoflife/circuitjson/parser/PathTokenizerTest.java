package nl.bytesoflife.circuitjson.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathTokenizerTest {

    private final PathTokenizer tokenizer = new PathTokenizer();

    @Test
    void chainTokens() {
        List<PathToken> tokens = tokenizer.tokenize("(9.54, 10.75) to[cute inductor, l_={$L_1$}] (9.54, 9.75)");
        assertEquals(List.of(
                new PathToken.CoordinateToken("(9.54, 10.75)"),
                new PathToken.OptionGroup("to", "[cute inductor, l_={$L_1$}]"),
                new PathToken.CoordinateToken("(9.54, 9.75)")), tokens);
        assertTrue(((PathToken.OptionGroup) tokens.get(1)).isChain());
    }

    @Test
    void turnOperatorsInOrder() {
        List<PathToken> tokens = tokenizer.tokenize("(0,0) -- (1,0) -| (2,2) |- (3,3)");
        assertEquals(List.of(
                new PathToken.CoordinateToken("(0,0)"),
                new PathToken.Turn(TurnOperator.STRAIGHT),
                new PathToken.CoordinateToken("(1,0)"),
                new PathToken.Turn(TurnOperator.HORIZONTAL_THEN_VERTICAL),
                new PathToken.CoordinateToken("(2,2)"),
                new PathToken.Turn(TurnOperator.VERTICAL_THEN_HORIZONTAL),
                new PathToken.CoordinateToken("(3,3)")), tokens);
    }

    @Test
    void nestedBracketsStayInOneGroup() {
        List<PathToken> tokens = tokenizer.tokenize("(0,0) -- (1,0)[draw, l={[a]}, m={[[b]]}]");
        assertEquals(new PathToken.OptionGroup("", "[draw, l={[a]}, m={[[b]]}]"), tokens.get(3));
    }

    @Test
    void nodeKeywordIsRecorded() {
        List<PathToken> tokens = tokenizer.tokenize("(0,0) node[above] {x}");
        PathToken.OptionGroup group = (PathToken.OptionGroup) tokens.get(1);
        assertEquals("node", group.keyword());
        assertFalse(group.isChain());
    }

    @Test
    void unrecognizedTextIsIgnored() {
        assertEquals(List.of(), tokenizer.tokenize("cycle"));
    }
}
