package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record ResourceDecl(
    SourceRange range,
    StringExpr type,
    BooleanExpr defaultProvider,
    List<PropertyEntry> properties,
    ResourceOptionsDecl options,
    GetResourceDecl get
) {
    static final List<String> FIELDS = List.of("type", "defaultProvider", "properties", "options", "get");

    public ResourceDecl {
        properties = properties == null ? List.of() : List.copyOf(properties);
        options = options == null ? ResourceOptionsDecl.EMPTY : options;
    }

    public String typeToken() {
        return type == null ? "" : type.value();
    }

    public boolean isDefaultProvider() {
        return defaultProvider != null && defaultProvider.value();
    }
}
