package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record TemplateDecl(
    SourceRange range,
    StringExpr name,
    StringExpr runtime,
    StringExpr description,
    List<ConfigEntry> configuration,
    List<PropertyEntry> variables,
    List<ResourceEntry> resources,
    List<PropertyEntry> outputs
) {
    static final List<String> FIELDS = List.of(
        "name", "runtime", "description", "configuration", "config", "variables", "resources", "outputs");

    public TemplateDecl {
        configuration = List.copyOf(configuration);
        variables = List.copyOf(variables);
        resources = List.copyOf(resources);
        outputs = List.copyOf(outputs);
    }

    public String projectName() {
        return name == null ? "" : name.value();
    }

    public record ConfigEntry(StringExpr key, ConfigParamDecl param) {
        public String name() {
            return key.value();
        }
    }

    public record ResourceEntry(StringExpr key, ResourceDecl resource) {
        public String name() {
            return key.value();
        }
    }
}
