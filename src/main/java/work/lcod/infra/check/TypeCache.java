package work.lcod.infra.check;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.ObjectExpr;
import work.lcod.infra.ast.StringExpr;
import work.lcod.infra.graph.TopologicalSorter;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Property;
import work.lcod.infra.types.Type;

final class TypeCache implements Typing {
    static final List<String> PULUMI_FIELDS = List.of("cwd", "project", "stack", "organization", "rootDirectory");

    private final Map<Expr, Type> exprs = new IdentityHashMap<>();
    private final Map<String, Type> resources = new HashMap<>();
    private final Map<String, Type> configuration = new HashMap<>();
    private final Map<String, Expr> variables = new HashMap<>();
    private final Map<String, Type> outputs = new HashMap<>();

    TypeCache() {
        var entries = PULUMI_FIELDS.stream()
            .map(name -> new ObjectExpr.Property(new StringExpr(null, name), new StringExpr(null, "")))
            .toList();
        var pulumi = new ObjectExpr(null, entries);
        var properties = PULUMI_FIELDS.stream().map(name -> Property.required(name, PrimitiveType.STRING)).toList();
        exprs.put(pulumi, new ObjectType("pulumi:builtin:pulumi", properties));
        variables.put(TopologicalSorter.RESERVED_NAME, pulumi);
    }

    void putExpr(Expr expr, Type type) {
        exprs.put(expr, type);
    }

    void putResource(String name, Type type) {
        resources.put(name, type);
    }

    void putConfig(String name, Type type) {
        configuration.put(name, type);
    }

    void putVariable(String name, Expr value) {
        variables.put(name, value);
    }

    void putOutput(String name, Type type) {
        outputs.put(name, type);
    }

    boolean hasResource(String name) {
        return resources.containsKey(name);
    }

    boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    boolean hasConfig(String name) {
        return configuration.containsKey(name);
    }

    @Override
    public Type resourceType(String name) {
        return resources.get(name);
    }

    @Override
    public Type variableType(String name) {
        var value = variables.get(name);
        return value == null ? null : exprs.get(value);
    }

    @Override
    public Type configType(String name) {
        return configuration.get(name);
    }

    @Override
    public Type outputType(String name) {
        return outputs.get(name);
    }

    @Override
    public Type exprType(Expr expr) {
        return exprs.get(expr);
    }
}
