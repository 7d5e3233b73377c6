package work.lcod.infra.eval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.ast.AssetArchiveExpr;
import work.lcod.infra.ast.AssetExpr;
import work.lcod.infra.ast.BooleanExpr;
import work.lcod.infra.ast.ConfigParamDecl;
import work.lcod.infra.ast.CustomTimeoutsDecl;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.FromBase64Expr;
import work.lcod.infra.ast.InterpolateExpr;
import work.lcod.infra.ast.InvokeExpr;
import work.lcod.infra.ast.InvokeOptionsDecl;
import work.lcod.infra.ast.JoinExpr;
import work.lcod.infra.ast.ListExpr;
import work.lcod.infra.ast.NumberExpr;
import work.lcod.infra.ast.ObjectExpr;
import work.lcod.infra.ast.PropertyAccess;
import work.lcod.infra.ast.PropertyAccessor;
import work.lcod.infra.ast.PropertyEntry;
import work.lcod.infra.ast.ReadFileExpr;
import work.lcod.infra.ast.ResourceDecl;
import work.lcod.infra.ast.SecretExpr;
import work.lcod.infra.ast.SelectExpr;
import work.lcod.infra.ast.SplitExpr;
import work.lcod.infra.ast.StackReferenceExpr;
import work.lcod.infra.ast.StringExpr;
import work.lcod.infra.ast.SymbolExpr;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.ast.ToBase64Expr;
import work.lcod.infra.ast.ToJsonExpr;
import work.lcod.infra.config.ConfigTypes;
import work.lcod.infra.engine.Engine;
import work.lcod.infra.engine.InvokeOptions;
import work.lcod.infra.engine.RemoteResource;
import work.lcod.infra.engine.ResourceKind;
import work.lcod.infra.engine.ResourceOptions;
import work.lcod.infra.engine.ResourceRegistration;
import work.lcod.infra.engine.StackReference;
import work.lcod.infra.graph.GraphNode;
import work.lcod.infra.graph.ProgramVisitor;
import work.lcod.infra.graph.ProgramWalker;
import work.lcod.infra.graph.SortResult;
import work.lcod.infra.runtime.ExecutionContext;
import work.lcod.infra.schema.FunctionSchema;
import work.lcod.infra.schema.ResourceSchema;
import work.lcod.infra.schema.SchemaResolutionException;
import work.lcod.infra.schema.TypeTokens;
import work.lcod.infra.shared.DurationParser;
import work.lcod.infra.shared.FieldSuggestions;
import work.lcod.infra.syntax.Severity;
import work.lcod.infra.syntax.SourceRange;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Property;
import work.lcod.infra.types.Type;

/**
 * Walks the scheduled declarations and turns each into runtime values: config values, variables,
 * registered resources and finally stack outputs.
 *
 * <p>Every operation follows one rule: when none of its operands is deferred it runs immediately,
 * otherwise it runs once all operands are known. Errors found on the synchronous path are thrown as
 * {@link EvaluationException} and reported by the declaration that owns the expression; errors found
 * inside a continuation are reported where they are caught and fail the resulting output.
 */
public final class Evaluator implements ProgramVisitor {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Object NOT_FOUND = new Object();

    private final ExecutionContext ctx;
    private final Engine engine;
    private final Map<String, RemoteResource> resources = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Object> config = Collections.synchronizedMap(new HashMap<>());
    private final Map<String, Object> variables = Collections.synchronizedMap(new HashMap<>());
    private final Map<String, StackReference> stackReferences = new ConcurrentHashMap<>();
    private final Map<String, String> defaultProviders = new HashMap<>();
    private final Map<String, Object> outputs = new LinkedHashMap<>();

    private Evaluator(TemplateDecl template, ExecutionContext ctx) {
        this.ctx = ctx;
        this.engine = ctx.engine();
        for (var entry : template.resources()) {
            var token = entry.resource().typeToken();
            if (entry.resource().isDefaultProvider() && TypeTokens.isProviderToken(token)) {
                defaultProviders.putIfAbsent(TypeTokens.packageName(token), entry.name());
            }
        }
        var pulumi = new LinkedHashMap<String, Object>();
        pulumi.put("cwd", ctx.workingDirectory().toString());
        pulumi.put("project", ctx.project());
        pulumi.put("stack", ctx.stack());
        pulumi.put("organization", ctx.organization());
        pulumi.put("rootDirectory", ctx.rootDirectory().toString());
        variables.put("pulumi", Collections.unmodifiableMap(pulumi));
    }

    /**
     * Evaluates the program in the given order. Stops at the first declaration that fails; the
     * failure is in the context's diagnostics.
     */
    public static EvaluationResult evaluate(TemplateDecl template, SortResult sorted, ExecutionContext ctx) {
        var evaluator = new Evaluator(template, ctx);
        boolean completed = ProgramWalker.walk(sorted.order(), template.outputs(), evaluator);
        log.debug("Evaluation of {} {} with {} resources", ctx.project(), completed ? "completed" : "stopped", evaluator.resources.size());
        return new EvaluationResult(evaluator.outputs, evaluator.resources, completed);
    }

    @Override
    public boolean visitConfig(GraphNode.ConfigNode node) {
        var entry = node.entry();
        var name = entry.name();
        var param = entry.param();
        var raw = ctx.settings().lookup(ctx.project(), name);
        Object value;
        try {
            if (raw.isPresent()) {
                var type = expectedType(param);
                value = type.isPresent() ? ConfigTypes.coerce(raw.get(), type.get()) : raw.get();
            } else if (param.defaultValue() != null) {
                value = eval(param.defaultValue());
            } else {
                ctx.diagnostics().error(entry.key().range(),
                    String.format("missing required configuration variable '%s'", name),
                    String.format("set a value for '%s' in the stack settings", name));
                return false;
            }
        } catch (IllegalArgumentException ex) {
            ctx.diagnostics().error(entry.key().range(), String.format("config %s: %s", name, ex.getMessage()));
            return false;
        } catch (EvaluationException ex) {
            report(ex);
            return false;
        }
        if (param.isSecret()) {
            value = Output.secret(value);
        }
        config.put(name, value);
        return true;
    }

    private static Optional<Type> expectedType(ConfigParamDecl param) {
        if (param.type() != null) {
            return ConfigTypes.parse(param.type().value());
        }
        var defaultValue = param.defaultValue();
        if (defaultValue instanceof StringExpr) {
            return Optional.of(PrimitiveType.STRING);
        }
        if (defaultValue instanceof BooleanExpr) {
            return Optional.of(PrimitiveType.BOOL);
        }
        if (defaultValue instanceof NumberExpr number) {
            return Optional.of(number.isIntegral() ? PrimitiveType.INT : PrimitiveType.NUMBER);
        }
        return Optional.empty();
    }

    @Override
    public boolean visitExternalConfig(GraphNode.ExternalConfigNode node) {
        config.put(node.key(), node.value());
        return true;
    }

    @Override
    public boolean visitVariable(GraphNode.VariableNode node) {
        try {
            variables.put(node.key(), eval(node.value()));
            return true;
        } catch (EvaluationException ex) {
            report(ex);
            return false;
        }
    }

    @Override
    public boolean visitMissing(GraphNode.MissingNode node) {
        ctx.diagnostics().error(node.range(), String.format("resource, variable, or config value \"%s\" not found", node.key()));
        return false;
    }

    @Override
    public boolean visitOutput(PropertyEntry output) {
        try {
            outputs.put(output.name(), eval(output.value()));
        } catch (EvaluationException ex) {
            report(ex);
        }
        return true;
    }

    @Override
    public boolean visitResource(GraphNode.ResourceNode node) {
        var name = node.key();
        var decl = node.resource();
        var token = decl.typeToken();
        ResourceSchema schema;
        try {
            schema = ctx.schemas().resolveResource(token);
        } catch (SchemaResolutionException ex) {
            var range = decl.type() == null ? node.range() : decl.type().range();
            ctx.diagnostics().error(range, String.format("error resolving type of resource %s: %s", name, ex.getMessage()));
            return false;
        }

        // keep going after a failing property so that every bad property is reported
        boolean overallOk = true;
        var properties = new LinkedHashMap<String, Object>();
        var entries = decl.get() == null ? decl.properties() : decl.get().state();
        for (var entry : entries) {
            try {
                properties.put(entry.name(), eval(entry.value()));
            } catch (EvaluationException ex) {
                report(ex);
                overallOk = false;
            }
        }
        for (var input : schema.inputs().properties()) {
            if (input.constValue() != null) {
                properties.putIfAbsent(input.name(), input.constValue());
            }
        }

        ResourceOptions options = null;
        Object id = null;
        try {
            options = evaluateOptions(decl);
            if (decl.get() != null) {
                id = eval(decl.get().id());
            }
        } catch (EvaluationException ex) {
            report(ex);
            overallOk = false;
        }
        if (!overallOk) {
            return false;
        }

        var registration = new ResourceRegistration(token, name, kindOf(schema, token), properties, options);
        var remote = decl.get() == null
            ? engine.registerResource(registration)
            : engine.readResource(registration, id);
        resources.put(name, remote);
        return true;
    }

    private static ResourceKind kindOf(ResourceSchema schema, String token) {
        if (schema.provider() || TypeTokens.isProviderToken(token)) {
            return ResourceKind.PROVIDER;
        }
        return schema.component() ? ResourceKind.COMPONENT : ResourceKind.CUSTOM;
    }

    private ResourceOptions evaluateOptions(ResourceDecl decl) {
        var opts = decl.options();
        var builder = ResourceOptions.builder()
            .parent(resourceOption(opts.parent(), "parent"))
            .provider(resourceOption(opts.provider(), "provider"))
            .deletedWith(resourceOption(opts.deletedWith(), "deletedWith"))
            .providers(providersOption(opts.providers()))
            .dependsOn(resourceListOption(opts.dependsOn(), "dependsOn"))
            .protect(boolOption(opts.protect(), "protect"))
            .deleteBeforeReplace(boolOption(opts.deleteBeforeReplace(), "deleteBeforeReplace"))
            .retainOnDelete(boolOption(opts.retainOnDelete(), "retainOnDelete"))
            .ignoreChanges(stringListOption(opts.ignoreChanges(), "ignoreChanges"))
            .replaceOnChanges(stringListOption(opts.replaceOnChanges(), "replaceOnChanges"))
            .additionalSecretOutputs(stringListOption(opts.additionalSecretOutputs(), "additionalSecretOutputs"))
            .aliases(aliasesOption(opts.aliases()))
            .customTimeouts(customTimeouts(opts.customTimeouts()))
            .importId(stringOption(opts.importId(), "import"))
            .version(opts.version() == null ? null : opts.version().value())
            .pluginDownloadUrl(opts.pluginDownloadUrl() == null ? null : opts.pluginDownloadUrl().value());
        if (opts.provider() == null && !decl.isDefaultProvider()) {
            var token = decl.typeToken();
            int colon = token.indexOf(':');
            var providerName = colon < 0 ? null : defaultProviders.get(token.substring(0, colon));
            if (providerName != null && resources.containsKey(providerName)) {
                builder.provider(resources.get(providerName));
            }
        }
        return builder.build();
    }

    private Object concreteOption(Expr expr, String option) {
        var value = eval(expr);
        if (value instanceof Output) {
            throw new EvaluationException(expr.range(),
                String.format("the %s option must be known when the resource is registered", option));
        }
        return value;
    }

    private RemoteResource resourceOption(Expr expr, String option) {
        if (expr == null) {
            return null;
        }
        return asResource(concreteOption(expr, option), expr.range(), option);
    }

    private static RemoteResource asResource(Object value, SourceRange range, String option) {
        if (value instanceof RemoteResource resource) {
            return resource;
        }
        throw new EvaluationException(range,
            String.format("the %s option must be a resource, not %s", option, Values.typeString(value)));
    }

    private List<RemoteResource> resourceListOption(Expr expr, String option) {
        if (expr == null) {
            return List.of();
        }
        var value = concreteOption(expr, option);
        if (value instanceof RemoteResource resource) {
            return List.of(resource);
        }
        if (!(value instanceof List<?> list)) {
            throw new EvaluationException(expr.range(),
                String.format("the %s option must be a list of resources, not %s", option, Values.typeString(value)));
        }
        var result = new ArrayList<RemoteResource>();
        for (var item : list) {
            result.add(asResource(item, expr.range(), option));
        }
        return result;
    }

    private Map<String, RemoteResource> providersOption(Expr expr) {
        if (expr == null) {
            return Map.of();
        }
        var value = concreteOption(expr, "providers");
        var result = new LinkedHashMap<String, RemoteResource>();
        if (value instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                result.put(String.valueOf(entry.getKey()), asResource(entry.getValue(), expr.range(), "providers"));
            }
            return result;
        }
        for (var provider : resourceListOption(expr, "providers")) {
            result.put(TypeTokens.packageName(provider.token()), provider);
        }
        return result;
    }

    private boolean boolOption(Expr expr, String option) {
        if (expr == null) {
            return false;
        }
        var value = concreteOption(expr, option);
        if (!(value instanceof Boolean b)) {
            throw new EvaluationException(expr.range(),
                String.format("the %s option must be a boolean, not %s", option, Values.typeString(value)));
        }
        return b;
    }

    private String stringOption(Expr expr, String option) {
        if (expr == null) {
            return null;
        }
        var value = concreteOption(expr, option);
        if (!(value instanceof String s)) {
            throw new EvaluationException(expr.range(),
                String.format("the %s option must be a string, not %s", option, Values.typeString(value)));
        }
        return s;
    }

    private List<String> stringListOption(Expr expr, String option) {
        if (expr == null) {
            return List.of();
        }
        var value = concreteOption(expr, option);
        if (value instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
            return list.stream().map(String.class::cast).toList();
        }
        throw new EvaluationException(expr.range(),
            String.format("the %s option must be a list of strings, not %s", option, Values.typeString(value)));
    }

    private List<Object> aliasesOption(Expr expr) {
        if (expr == null) {
            return List.of();
        }
        var value = concreteOption(expr, "aliases");
        if (!(value instanceof List<?> list)) {
            throw new EvaluationException(expr.range(),
                String.format("the aliases option must be a list, not %s", Values.typeString(value)));
        }
        return new ArrayList<>(list);
    }

    private static Map<String, Duration> customTimeouts(CustomTimeoutsDecl decl) {
        if (decl == null) {
            return Map.of();
        }
        var result = new LinkedHashMap<String, Duration>();
        putTimeout(result, "create", decl.create());
        putTimeout(result, "update", decl.update());
        putTimeout(result, "delete", decl.delete());
        return result;
    }

    private static void putTimeout(Map<String, Duration> timeouts, String name, StringExpr raw) {
        if (raw == null) {
            return;
        }
        var duration = DurationParser.parse(raw.value()).orElseThrow(() -> new EvaluationException(raw.range(),
            String.format("invalid duration \"%s\" for customTimeouts.%s", raw.value(), name)));
        timeouts.put(name, duration);
    }

    Object eval(Expr expr) {
        return switch (expr.kind()) {
            case NULL -> null;
            case BOOLEAN -> ((BooleanExpr) expr).value();
            case NUMBER -> ((NumberExpr) expr).value();
            case STRING -> ((StringExpr) expr).value();
            case INTERPOLATE -> evalInterpolate((InterpolateExpr) expr);
            case SYMBOL -> evalAccess(((SymbolExpr) expr).access(), expr.range());
            case LIST -> evalList((ListExpr) expr);
            case OBJECT -> evalEntries(((ObjectExpr) expr).entries(), 0, new LinkedHashMap<>());
            case INVOKE -> evalInvoke((InvokeExpr) expr);
            case JOIN -> evalJoin((JoinExpr) expr);
            case SPLIT -> evalSplit((SplitExpr) expr);
            case SELECT -> evalSelect((SelectExpr) expr);
            case TO_JSON -> evalToJson((ToJsonExpr) expr);
            case TO_BASE64 -> evalToBase64((ToBase64Expr) expr);
            case FROM_BASE64 -> evalFromBase64((FromBase64Expr) expr);
            case SECRET -> Output.secret(eval(((SecretExpr) expr).value()));
            case READ_FILE -> evalReadFile((ReadFileExpr) expr);
            case STACK_REFERENCE -> evalStackReference((StackReferenceExpr) expr);
            case ASSET_ARCHIVE -> evalAssetArchive((AssetArchiveExpr) expr);
            case STRING_ASSET, FILE_ASSET, REMOTE_ASSET, FILE_ARCHIVE, REMOTE_ARCHIVE -> evalAsset((AssetExpr) expr);
        };
    }

    /**
     * Runs {@code body} now when no operand is deferred, else once all of them are known.
     */
    private Object lift(List<Object> operands, Function<List<Object>, Object> body) {
        for (var operand : operands) {
            if (operand instanceof Output) {
                return Output.all(operands).apply(continuation(values -> body.apply(asList(values))));
            }
        }
        return body.apply(operands);
    }

    private Object liftValue(Object operand, Function<Object, Object> body) {
        if (operand instanceof Output deferred) {
            return deferred.apply(continuation(body));
        }
        return body.apply(operand);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object values) {
        return (List<Object>) values;
    }

    private Function<Object, Object> continuation(Function<Object, Object> body) {
        return value -> {
            try {
                return body.apply(value);
            } catch (EvaluationException ex) {
                reportDeferred(ex);
                throw ex;
            }
        };
    }

    private void report(EvaluationException ex) {
        ctx.diagnostics().add(ex.toDiagnostic());
    }

    private void reportDeferred(EvaluationException ex) {
        report(ex);
        var where = ex.range() == null ? "" : ex.range() + ": ";
        engine.log(Severity.ERROR, where + ex.getMessage());
    }

    private Object evalInterpolate(InterpolateExpr expr) {
        var values = new ArrayList<Object>();
        for (var part : expr.parts()) {
            values.add(part.value() == null ? null : evalAccess(part.value(), expr.range()));
        }
        return lift(values, resolved -> {
            var sb = new StringBuilder();
            for (int i = 0; i < expr.parts().size(); i++) {
                var part = expr.parts().get(i);
                sb.append(part.text());
                if (part.value() == null) {
                    continue;
                }
                var text = Values.render(resolved.get(i));
                if (text == null) {
                    throw new EvaluationException(expr.range(), String.format(
                        "cannot interpolate %s into a string: ${%s}", Values.typeString(resolved.get(i)), part.value()));
                }
                sb.append(text);
            }
            return sb.toString();
        });
    }

    private Object evalList(ListExpr expr) {
        var values = new ArrayList<Object>();
        for (var element : expr.elements()) {
            values.add(eval(element));
        }
        return lift(values, resolved -> new ArrayList<>(resolved));
    }

    /**
     * Evaluates object entries in order. A deferred key postpones every later entry until it is known.
     */
    private Object evalEntries(List<ObjectExpr.Property> entries, int from, Map<String, Object> acc) {
        for (int i = from; i < entries.size(); i++) {
            var entry = entries.get(i);
            var key = eval(entry.key());
            if (key instanceof Output deferred) {
                int next = i + 1;
                return deferred.apply(continuation(k -> {
                    putEntry(entry, k, acc);
                    return evalEntries(entries, next, acc);
                }));
            }
            putEntry(entry, key, acc);
        }
        return liftMap(acc);
    }

    private void putEntry(ObjectExpr.Property entry, Object key, Map<String, Object> acc) {
        if (!(key instanceof String name)) {
            throw new EvaluationException(entry.key().range(),
                String.format("object key must evaluate to a string, not %s", Values.typeString(key)));
        }
        acc.put(name, eval(entry.value()));
    }

    private Object liftMap(Map<String, Object> map) {
        var keys = new ArrayList<>(map.keySet());
        return lift(new ArrayList<>(map.values()), resolved -> {
            var result = new LinkedHashMap<String, Object>();
            for (int i = 0; i < keys.size(); i++) {
                result.put(keys.get(i), resolved.get(i));
            }
            return result;
        });
    }

    private Object evalAccess(PropertyAccess access, SourceRange range) {
        var root = access.rootName();
        var receiver = lookupRoot(root);
        var project = ctx.project();
        if (receiver == NOT_FOUND && !project.isEmpty() && root.startsWith(project + ":")) {
            receiver = lookupRoot(root.substring(project.length() + 1));
        }
        if (receiver == NOT_FOUND) {
            throw new EvaluationException(range, String.format("resource, variable, or config value \"%s\" not found", root));
        }
        return access(receiver, access.tail(), range);
    }

    private Object lookupRoot(String name) {
        if (resources.containsKey(name)) {
            return resources.get(name);
        }
        if (config.containsKey(name)) {
            return config.get(name);
        }
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        return NOT_FOUND;
    }

    private Object access(Object receiver, List<PropertyAccessor> accessors, SourceRange range) {
        var current = receiver;
        for (int i = 0; i < accessors.size(); i++) {
            if (current instanceof Output deferred) {
                var rest = accessors.subList(i, accessors.size());
                return deferred.apply(continuation(value -> access(value, rest, range)));
            }
            current = step(current, accessors.get(i), range);
        }
        return current;
    }

    private Object step(Object receiver, PropertyAccessor accessor, SourceRange range) {
        Object index = accessor instanceof PropertyAccessor.Subscript subscript
            ? subscript.index()
            : ((PropertyAccessor.Name) accessor).name();
        if (receiver instanceof RemoteResource resource) {
            if (!(index instanceof String key)) {
                throw new EvaluationException(range, "cannot access a resource property using an integer index");
            }
            return switch (key) {
                case "id" -> resource.id();
                case "urn" -> resource.urn();
                default -> resource.output(key);
            };
        }
        if (receiver instanceof List<?> list) {
            if (!(index instanceof Integer position)) {
                throw new EvaluationException(range, "cannot access a list element using a property name");
            }
            if (position < 0 || position >= list.size()) {
                throw new EvaluationException(range,
                    String.format("list index %d out-of-bounds for list of length %d", position, list.size()));
            }
            return list.get(position);
        }
        if (receiver instanceof Map<?, ?> map) {
            if (!(index instanceof String key)) {
                throw new EvaluationException(range, "cannot access an object property using an integer index");
            }
            return map.get(key);
        }
        throw new EvaluationException(range,
            String.format("receiver must be a list or object, not %s", Values.typeString(receiver)));
    }

    private Object evalInvoke(InvokeExpr invoke) {
        var token = invoke.token().value();
        FunctionSchema function;
        try {
            function = ctx.schemas().resolveFunction(token);
        } catch (SchemaResolutionException ex) {
            throw new EvaluationException(invoke.token().range(), ex.getMessage());
        }
        var field = returnField(invoke, function);
        var options = invokeOptions(invoke.callOpts());
        Object args = invoke.callArgs() == null ? new LinkedHashMap<String, Object>() : eval(invoke.callArgs());
        return liftValue(args, resolved -> {
            var result = engine.invoke(token, asMap(resolved), options);
            if (field == null) {
                return result;
            }
            return result.apply(continuation(value -> {
                if (!(value instanceof Map<?, ?> map) || !map.containsKey(field)) {
                    throw new EvaluationException(invoke.returnField().range(), String.format(
                        "fn::invoke of %s did not contain a property '%s' in the returned value", token, field));
                }
                return map.get(field);
            }));
        });
    }

    private static String returnField(InvokeExpr invoke, FunctionSchema function) {
        var returnField = invoke.returnField();
        if (returnField == null) {
            return null;
        }
        for (var output : function.outputs().properties()) {
            if (output.name().equalsIgnoreCase(returnField.value())) {
                return output.name();
            }
        }
        var names = function.outputs().properties().stream().map(Property::name).toList();
        var suggestions = FieldSuggestions.forProperties(function.token(), names);
        throw new EvaluationException(returnField.range(),
            suggestions.summary(returnField.value()), suggestions.detail(returnField.value()));
    }

    private InvokeOptions invokeOptions(InvokeOptionsDecl opts) {
        return new InvokeOptions(
            resourceOption(opts.parent(), "parent"),
            resourceOption(opts.provider(), "provider"),
            resourceListOption(opts.dependsOn(), "dependsOn"),
            opts.version() == null ? null : opts.version().value(),
            opts.pluginDownloadUrl() == null ? null : opts.pluginDownloadUrl().value());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private Object evalJoin(JoinExpr join) {
        var operands = Arrays.asList(eval(join.delimiter()), eval(join.values()));
        return lift(operands, resolved -> {
            if (!(resolved.get(0) instanceof String delimiter)) {
                throw new EvaluationException(join.delimiter().range(), String.format(
                    "the first argument to fn::join must be a string, not %s", Values.typeString(resolved.get(0))));
            }
            if (!(resolved.get(1) instanceof List<?> values)) {
                throw new EvaluationException(join.values().range(), String.format(
                    "the second argument to fn::join must be a list, not %s", Values.typeString(resolved.get(1))));
            }
            var parts = new ArrayList<String>();
            for (int i = 0; i < values.size(); i++) {
                if (!(values.get(i) instanceof String s)) {
                    throw new EvaluationException(join.values().range(), String.format(
                        "expected expression in fn::join to produce a string, but the element at index %d is %s",
                        i, Values.typeString(values.get(i))));
                }
                parts.add(s);
            }
            return String.join(delimiter, parts);
        });
    }

    private Object evalSplit(SplitExpr split) {
        var operands = Arrays.asList(eval(split.delimiter()), eval(split.source()));
        return lift(operands, resolved -> {
            if (!(resolved.get(0) instanceof String delimiter)) {
                throw new EvaluationException(split.delimiter().range(), String.format(
                    "the first argument to fn::split must be a string, not %s", Values.typeString(resolved.get(0))));
            }
            if (!(resolved.get(1) instanceof String source)) {
                throw new EvaluationException(split.source().range(), String.format(
                    "the second argument to fn::split must be a string, not %s", Values.typeString(resolved.get(1))));
            }
            return split(source, delimiter);
        });
    }

    static List<Object> split(String source, String delimiter) {
        var result = new ArrayList<Object>();
        if (delimiter.isEmpty()) {
            source.codePoints().forEach(cp -> result.add(new String(Character.toChars(cp))));
            return result;
        }
        int start = 0;
        int found;
        while ((found = source.indexOf(delimiter, start)) >= 0) {
            result.add(source.substring(start, found));
            start = found + delimiter.length();
        }
        result.add(source.substring(start));
        return result;
    }

    private Object evalSelect(SelectExpr select) {
        var index = eval(select.index());
        var values = eval(select.values());
        return lift(Arrays.asList(index, values), resolved -> {
            var rawIndex = resolved.get(0);
            if (!(rawIndex instanceof Number number) || !Values.isIntegral(number) || number.doubleValue() < 0) {
                var shown = rawIndex instanceof Number n ? Values.formatNumber(n) : Values.typeString(rawIndex);
                throw new EvaluationException(select.index().range(),
                    String.format("index must be a positive integral, not %s", shown));
            }
            if (!(resolved.get(1) instanceof List<?> list)) {
                throw new EvaluationException(select.values().range(), String.format(
                    "the second argument to fn::select must be a list, not %s", Values.typeString(resolved.get(1))));
            }
            long position = number.longValue();
            if (position >= list.size()) {
                throw new EvaluationException(select.index().range(),
                    String.format("list index %d out-of-bounds for list of length %d", position, list.size()));
            }
            return list.get((int) position);
        });
    }

    private Object evalToJson(ToJsonExpr expr) {
        return liftValue(eval(expr.value()), value -> {
            if (Values.containsOutput(value)) {
                throw new EvaluationException(expr.range(), "fn::toJSON cannot serialize a value that is not yet known");
            }
            try {
                return JSON.writeValueAsString(Values.toPlain(value));
            } catch (JsonProcessingException ex) {
                throw new EvaluationException(expr.range(), "failed to encode JSON: " + ex.getOriginalMessage(), "", ex);
            }
        });
    }

    private Object evalToBase64(ToBase64Expr expr) {
        return liftValue(eval(expr.value()), value -> {
            if (!(value instanceof String s)) {
                throw new EvaluationException(expr.value().range(),
                    String.format("fn::toBase64 requires a string argument, not %s", Values.typeString(value)));
            }
            return Base64.getEncoder().encodeToString(s.getBytes(StandardCharsets.UTF_8));
        });
    }

    private Object evalFromBase64(FromBase64Expr expr) {
        return liftValue(eval(expr.value()), value -> {
            if (!(value instanceof String s)) {
                throw new EvaluationException(expr.value().range(),
                    String.format("fn::fromBase64 requires a string argument, not %s", Values.typeString(value)));
            }
            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(s);
            } catch (IllegalArgumentException ex) {
                throw new EvaluationException(expr.value().range(),
                    String.format("fn::fromBase64 unable to decode %s, error: %s", s, ex.getMessage()));
            }
            var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            try {
                return decoder.decode(ByteBuffer.wrap(bytes)).toString();
            } catch (CharacterCodingException ex) {
                throw new EvaluationException(expr.value().range(), "fn::fromBase64 output is not a valid UTF-8 string");
            }
        });
    }

    private Object evalReadFile(ReadFileExpr expr) {
        return liftValue(eval(expr.path()), value -> {
            if (!(value instanceof String path)) {
                throw new EvaluationException(expr.path().range(),
                    String.format("fn::readFile requires a string path, not %s", Values.typeString(value)));
            }
            var file = ctx.workingDirectory().resolve(path).normalize();
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new EvaluationException(expr.path().range(),
                    String.format("Error reading file at path %s: %s", path, ex.getMessage()), "", ex);
            }
        });
    }

    private Object evalStackReference(StackReferenceExpr expr) {
        var stackName = expr.stackName().value();
        var reference = stackReferences.computeIfAbsent(stackName, engine::stackReference);
        return liftValue(eval(expr.propertyName()), value -> {
            if (!(value instanceof String property)) {
                throw new EvaluationException(expr.propertyName().range(),
                    String.format("the property name of fn::stackReference must be a string, not %s", Values.typeString(value)));
            }
            return reference.output(property);
        });
    }

    private Object evalAsset(AssetExpr expr) {
        return liftValue(eval(expr.source()), value -> {
            if (!(value instanceof String source)) {
                throw new EvaluationException(expr.source().range(), String.format(
                    "the argument to %s must be a string, not %s", expr.kind().label(), Values.typeString(value)));
            }
            return switch (expr.kind()) {
                case STRING_ASSET -> new Asset(Asset.Kind.STRING, source);
                case FILE_ASSET -> new Asset(Asset.Kind.FILE, source);
                case REMOTE_ASSET -> new Asset(Asset.Kind.REMOTE, source);
                case FILE_ARCHIVE -> new Archive(Archive.Kind.FILE, source, null);
                case REMOTE_ARCHIVE -> new Archive(Archive.Kind.REMOTE, source, null);
                default -> throw new IllegalStateException("Not an asset expression: " + expr.kind());
            };
        });
    }

    private Object evalAssetArchive(AssetArchiveExpr expr) {
        var names = new ArrayList<String>();
        var values = new ArrayList<Object>();
        // entries() iterates in key order
        for (var entry : expr.entries().entrySet()) {
            names.add(entry.getKey());
            values.add(eval(entry.getValue()));
        }
        return lift(values, resolved -> {
            var assets = new LinkedHashMap<String, Object>();
            for (int i = 0; i < names.size(); i++) {
                var value = resolved.get(i);
                if (!(value instanceof Asset) && !(value instanceof Archive)) {
                    throw new EvaluationException(expr.entries().get(names.get(i)).range(), String.format(
                        "value of %s in fn::assetArchive must be an asset or archive, not %s", names.get(i), Values.typeString(value)));
                }
                assets.put(names.get(i), value);
            }
            return Archive.ofAssets(assets);
        });
    }
}
