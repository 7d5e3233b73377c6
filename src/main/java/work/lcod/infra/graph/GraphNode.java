package work.lcod.infra.graph;

import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.PropertyEntry;
import work.lcod.infra.ast.ResourceDecl;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.syntax.SourceRange;

public interface GraphNode {
    String key();

    String kind();

    SourceRange range();

    record ConfigNode(TemplateDecl.ConfigEntry entry) implements GraphNode {
        @Override
        public String key() {
            return entry.name();
        }

        @Override
        public String kind() {
            return "config";
        }

        @Override
        public SourceRange range() {
            return entry.key().range();
        }
    }

    record ExternalConfigNode(String key, Object value) implements GraphNode {
        @Override
        public String kind() {
            return "config";
        }

        @Override
        public SourceRange range() {
            return null;
        }
    }

    record VariableNode(PropertyEntry entry) implements GraphNode {
        @Override
        public String key() {
            return entry.name();
        }

        @Override
        public String kind() {
            return "variable";
        }

        @Override
        public SourceRange range() {
            return entry.key().range();
        }

        public Expr value() {
            return entry.value();
        }
    }

    record ResourceNode(TemplateDecl.ResourceEntry entry) implements GraphNode {
        @Override
        public String key() {
            return entry.name();
        }

        @Override
        public String kind() {
            return "resource";
        }

        @Override
        public SourceRange range() {
            return entry.key().range();
        }

        public ResourceDecl resource() {
            return entry.resource();
        }
    }

    record MissingNode(String key, SourceRange range) implements GraphNode {
        @Override
        public String kind() {
            return "missing node";
        }
    }
}
