package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

/**
 * Base of the expression tree. Instances are immutable and compared by identity, so they can key
 * identity maps in the type cache.
 */
public abstract class Expr {
    private final SourceRange range;

    protected Expr(SourceRange range) {
        this.range = range;
    }

    public SourceRange range() {
        return range;
    }

    public abstract ExprKind kind();
}
