package work.lcod.infra.graph;

import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.PropertyEntry;

/**
 * Callbacks invoked by {@link ProgramWalker} for each scheduled declaration. Returning false stops the walk.
 */
public interface ProgramVisitor {
    boolean visitConfig(GraphNode.ConfigNode node);

    boolean visitExternalConfig(GraphNode.ExternalConfigNode node);

    boolean visitVariable(GraphNode.VariableNode node);

    boolean visitResource(GraphNode.ResourceNode node);

    boolean visitMissing(GraphNode.MissingNode node);

    boolean visitOutput(PropertyEntry output);

    /**
     * Whether the walker should call {@link #visitExpr} on every contained expression, children first,
     * before visiting the declaration itself.
     */
    default boolean walksExpressions() {
        return false;
    }

    default boolean visitExpr(Expr expr) {
        return true;
    }
}
