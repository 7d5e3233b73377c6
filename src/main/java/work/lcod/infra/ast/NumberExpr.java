package work.lcod.infra.ast;

import work.lcod.infra.shared.Numbers;
import work.lcod.infra.syntax.SourceRange;

public final class NumberExpr extends Expr {
    private final double value;

    public NumberExpr(SourceRange range, double value) {
        super(range);
        this.value = value;
    }

    public double value() {
        return value;
    }

    public boolean isIntegral() {
        return Numbers.isIntegral(value);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.NUMBER;
    }

    @Override
    public String toString() {
        return Numbers.format(value);
    }
}
