package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record GetResourceDecl(SourceRange range, Expr id, List<PropertyEntry> state) {
    static final List<String> FIELDS = List.of("id", "state");

    public GetResourceDecl {
        state = state == null ? List.of() : List.copyOf(state);
    }
}
