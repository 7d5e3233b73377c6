package work.lcod.infra.syntax;

import java.util.List;

public interface SyntaxNode {
    SourceRange range();

    String describe();

    record NullNode(SourceRange range) implements SyntaxNode {
        @Override
        public String describe() {
            return "null";
        }
    }

    record BooleanNode(SourceRange range, boolean value) implements SyntaxNode {
        @Override
        public String describe() {
            return "a boolean value";
        }
    }

    record NumberNode(SourceRange range, double value) implements SyntaxNode {
        @Override
        public String describe() {
            return "a number";
        }
    }

    record StringNode(SourceRange range, String value) implements SyntaxNode {
        @Override
        public String describe() {
            return "a string";
        }
    }

    record ListNode(SourceRange range, List<SyntaxNode> elements) implements SyntaxNode {
        public ListNode {
            elements = List.copyOf(elements);
        }

        @Override
        public String describe() {
            return "a list";
        }
    }

    record ObjectNode(SourceRange range, List<Entry> entries) implements SyntaxNode {
        public ObjectNode {
            entries = List.copyOf(entries);
        }

        @Override
        public String describe() {
            return "an object";
        }
    }

    record Entry(StringNode key, SyntaxNode value) {}
}
