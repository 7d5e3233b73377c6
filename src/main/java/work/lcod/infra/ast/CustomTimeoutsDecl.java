package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record CustomTimeoutsDecl(SourceRange range, StringExpr create, StringExpr update, StringExpr delete) {
    static final List<String> FIELDS = List.of("create", "update", "delete");
}
