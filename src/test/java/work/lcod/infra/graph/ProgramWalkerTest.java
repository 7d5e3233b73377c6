package work.lcod.infra.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.PropertyEntry;
import work.lcod.infra.ast.StringExpr;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.support.InfraTestSupport;
import work.lcod.infra.syntax.Diagnostics;

class ProgramWalkerTest {
    @Test
    void visitsDeclarationsInOrderThenOutputs() {
        var template = parse("""
            config:
              region:
                default: eu
            variables:
              name: ${bucket.name}
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
            outputs:
              out: ${name}
            """);
        var visitor = new RecordingVisitor(false, null);

        assertTrue(ProgramWalker.walk(TopologicalSorter.sort(template).order(), template.outputs(), visitor));
        assertEquals(List.of("config:region", "resource:bucket", "variable:name", "output:out"), visitor.events);
    }

    @Test
    void stopsAtTheFirstRejectedVisit() {
        var template = parse("""
            variables:
              a: 1
              b: 2
            outputs:
              out: ${a}
            """);
        var visitor = new RecordingVisitor(false, "variable:a");

        assertFalse(ProgramWalker.walk(TopologicalSorter.sort(template).order(), template.outputs(), visitor));
        assertEquals(List.of("variable:a"), visitor.events);
    }

    @Test
    void walksExpressionsChildrenFirst() {
        var template = parse("""
            variables:
              joined:
                fn::join: ["-", [a, b]]
            """);
        var visitor = new RecordingVisitor(true, null);

        ProgramWalker.walk(TopologicalSorter.sort(template).order(), template.outputs(), visitor);
        assertEquals(List.of(
            "expr:STRING:joined",
            "expr:STRING:fn::join",
            "expr:STRING:-",
            "expr:STRING:a",
            "expr:STRING:b",
            "expr:LIST",
            "expr:LIST",
            "expr:JOIN",
            "variable:joined"
        ), visitor.events);
    }

    @Test
    void rejectedExpressionSkipsItsDeclaration() {
        var template = parse("""
            variables:
              a: [x]
            """);
        var visitor = new RecordingVisitor(true, "expr:LIST");

        assertFalse(ProgramWalker.walk(TopologicalSorter.sort(template).order(), template.outputs(), visitor));
        assertEquals(List.of("expr:STRING:a", "expr:STRING:x", "expr:LIST"), visitor.events);
    }

    private static TemplateDecl parse(String yaml) {
        var diags = new Diagnostics();
        var template = InfraTestSupport.parse(yaml, diags);
        assertFalse(diags.hasErrors(), diags::toString);
        return template;
    }

    private static final class RecordingVisitor implements ProgramVisitor {
        private final boolean expressions;
        private final String rejectAt;
        private final List<String> events = new ArrayList<>();

        private RecordingVisitor(boolean expressions, String rejectAt) {
            this.expressions = expressions;
            this.rejectAt = rejectAt;
        }

        private boolean record(String event) {
            events.add(event);
            return !event.equals(rejectAt);
        }

        @Override
        public boolean visitConfig(GraphNode.ConfigNode node) {
            return record("config:" + node.key());
        }

        @Override
        public boolean visitExternalConfig(GraphNode.ExternalConfigNode node) {
            return record("external:" + node.key());
        }

        @Override
        public boolean visitVariable(GraphNode.VariableNode node) {
            return record("variable:" + node.key());
        }

        @Override
        public boolean visitResource(GraphNode.ResourceNode node) {
            return record("resource:" + node.key());
        }

        @Override
        public boolean visitMissing(GraphNode.MissingNode node) {
            return record("missing:" + node.key());
        }

        @Override
        public boolean visitOutput(PropertyEntry output) {
            return record("output:" + output.name());
        }

        @Override
        public boolean walksExpressions() {
            return expressions;
        }

        @Override
        public boolean visitExpr(Expr expr) {
            var label = expr instanceof StringExpr s
                ? "expr:STRING:" + s.value()
                : "expr:" + expr.kind();
            return record(label);
        }
    }
}
