package nl.bytesoflife.circuitjson.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A tokenized statement. Each kind names its clauses instead of relying on positions.
 */
public sealed interface TokenSequence
        permits TokenSequence.SingleNode, TokenSequence.TwoNode, TokenSequence.ThreeNode,
                TokenSequence.Device, TokenSequence.Chain, TokenSequence.Wire {

    TokenKind kind();

    /**
     * Coordinates of all clauses or tokens in statement order, as written.
     */
    List<String> coordinates();

    /** {@code \node[shape=...] at (c) {label};} */
    record SingleNode(NodeClause shape) implements TokenSequence {
        @Override
        public TokenKind kind() {
            return TokenKind.NODE;
        }

        @Override
        public List<String> coordinates() {
            return List.of(shape.coordinate());
        }
    }

    /** A shape followed by a text clause. */
    record TwoNode(NodeClause shape, Optional<NodeClause> text) implements TokenSequence {
        @Override
        public TokenKind kind() {
            return TokenKind.TWO_NODE;
        }

        @Override
        public List<String> coordinates() {
            List<String> result = new ArrayList<>();
            result.add(shape.coordinate());
            text.ifPresent(c -> result.add(c.coordinate()));
            return result;
        }
    }

    /** A shape, its identifier label clause and its text clause. */
    record ThreeNode(NodeClause shape, Optional<NodeClause> label, Optional<NodeClause> text) implements TokenSequence {
        @Override
        public TokenKind kind() {
            return TokenKind.THREE_NODE;
        }

        @Override
        public List<String> coordinates() {
            List<String> result = new ArrayList<>();
            result.add(shape.coordinate());
            label.ifPresent(c -> result.add(c.coordinate()));
            text.ifPresent(c -> result.add(c.coordinate()));
            return result;
        }
    }

    /**
     * A device node such as {@code \node[npn, photo, rotate=-45](N1) at (..){}} with an optional
     * chained label clause.
     */
    record Device(NodeClause device, Optional<NodeClause> label) implements TokenSequence {
        @Override
        public TokenKind kind() {
            return TokenKind.DEVICE;
        }

        @Override
        public List<String> coordinates() {
            List<String> result = new ArrayList<>();
            result.add(device.coordinate());
            label.ifPresent(c -> result.add(c.coordinate()));
            return result;
        }
    }

    /** A draw or path statement containing a {@code to[...]} element. */
    record Chain(List<PathToken> tokens) implements TokenSequence {
        public Chain {
            tokens = List.copyOf(tokens);
        }

        @Override
        public TokenKind kind() {
            return TokenKind.TO;
        }

        @Override
        public List<String> coordinates() {
            return coordinatesOf(tokens);
        }

        /**
         * Option group of the first {@code to} element, brackets kept and keyword removed.
         */
        public String elementOptions() {
            for (PathToken token : tokens) {
                if (token instanceof PathToken.OptionGroup group && group.isChain()) {
                    return group.body();
                }
            }
            return "[]";
        }
    }

    /** A plain wire: coordinates joined by turn operators, optionally followed by draw options. */
    record Wire(List<PathToken> tokens) implements TokenSequence {
        public Wire {
            tokens = List.copyOf(tokens);
        }

        @Override
        public TokenKind kind() {
            return TokenKind.WIRE;
        }

        @Override
        public List<String> coordinates() {
            return coordinatesOf(tokens);
        }

        public List<TurnOperator> directions() {
            List<TurnOperator> directions = new ArrayList<>();
            for (PathToken token : tokens) {
                if (token instanceof PathToken.Turn turn) {
                    directions.add(turn.operator());
                }
            }
            return directions;
        }

        /**
         * The trailing option group, empty when the statement ends with something else.
         */
        public String trailingOptions() {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1) instanceof PathToken.OptionGroup group) {
                return group.body();
            }
            return "";
        }
    }

    private static List<String> coordinatesOf(List<PathToken> tokens) {
        List<String> result = new ArrayList<>();
        for (PathToken token : tokens) {
            if (token instanceof PathToken.CoordinateToken coordinate) {
                result.add(coordinate.text());
            }
        }
        return result;
    }
}
