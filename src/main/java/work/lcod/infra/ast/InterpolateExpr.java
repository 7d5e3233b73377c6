package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public final class InterpolateExpr extends Expr {
    private final List<Interpolation> parts;

    public InterpolateExpr(SourceRange range, List<Interpolation> parts) {
        super(range);
        this.parts = List.copyOf(parts);
    }

    public List<Interpolation> parts() {
        return parts;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.INTERPOLATE;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var part : parts) {
            sb.append(part.text().replace("$", "$$"));
            if (part.value() != null) {
                sb.append("${").append(part.value()).append('}');
            }
        }
        return sb.toString();
    }
}
