package work.lcod.infra.ast;

import java.util.List;
import java.util.Optional;
import work.lcod.infra.syntax.SourceRange;

public final class ObjectExpr extends Expr {
    private final List<Property> entries;

    public ObjectExpr(SourceRange range, List<Property> entries) {
        super(range);
        this.entries = List.copyOf(entries);
    }

    public List<Property> entries() {
        return entries;
    }

    public Optional<Property> find(String name) {
        return entries.stream()
            .filter(e -> e.key() instanceof StringExpr s && s.value().equals(name))
            .findFirst();
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OBJECT;
    }

    public record Property(Expr key, Expr value) {}
}
