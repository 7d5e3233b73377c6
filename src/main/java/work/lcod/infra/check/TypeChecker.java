package work.lcod.infra.check;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.ast.AssetExpr;
import work.lcod.infra.ast.ConfigParamDecl;
import work.lcod.infra.ast.CustomTimeoutsDecl;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.FromBase64Expr;
import work.lcod.infra.ast.InterpolateExpr;
import work.lcod.infra.ast.InvokeExpr;
import work.lcod.infra.ast.JoinExpr;
import work.lcod.infra.ast.ListExpr;
import work.lcod.infra.ast.ObjectExpr;
import work.lcod.infra.ast.PropertyAccess;
import work.lcod.infra.ast.PropertyEntry;
import work.lcod.infra.ast.ReadFileExpr;
import work.lcod.infra.ast.ResourceDecl;
import work.lcod.infra.ast.ResourceOptionsDecl;
import work.lcod.infra.ast.SecretExpr;
import work.lcod.infra.ast.SelectExpr;
import work.lcod.infra.ast.SplitExpr;
import work.lcod.infra.ast.StackReferenceExpr;
import work.lcod.infra.ast.StringExpr;
import work.lcod.infra.ast.SymbolExpr;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.ast.ToBase64Expr;
import work.lcod.infra.config.ConfigTypes;
import work.lcod.infra.graph.GraphNode;
import work.lcod.infra.graph.ProgramVisitor;
import work.lcod.infra.graph.ProgramWalker;
import work.lcod.infra.graph.SortResult;
import work.lcod.infra.schema.FunctionSchema;
import work.lcod.infra.schema.ResourceSchema;
import work.lcod.infra.schema.SchemaRegistry;
import work.lcod.infra.schema.SchemaResolutionException;
import work.lcod.infra.shared.DurationParser;
import work.lcod.infra.shared.FieldSuggestions;
import work.lcod.infra.syntax.Diagnostics;
import work.lcod.infra.syntax.SourceRange;
import work.lcod.infra.types.ArrayType;
import work.lcod.infra.types.InputType;
import work.lcod.infra.types.InvalidType;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.OptionalType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Property;
import work.lcod.infra.types.Type;
import work.lcod.infra.types.Types;

/**
 * Assigns a type to every expression and declaration, visiting declarations in evaluation order
 * and expressions children first, and reports values that do not fit their destination.
 */
public final class TypeChecker implements ProgramVisitor {
    private static final Logger log = LoggerFactory.getLogger(TypeChecker.class);

    private static final Type STRING_LIST = new ArrayType(PrimitiveType.STRING);

    private final TemplateDecl template;
    private final SchemaRegistry schemas;
    private final Diagnostics diags;
    private final TypeCache cache = new TypeCache();
    private final Assignability assignability = new Assignability(cache);

    private TypeChecker(TemplateDecl template, SchemaRegistry schemas, Diagnostics diags) {
        this.template = template;
        this.schemas = schemas;
        this.diags = diags;
    }

    public static Typing check(TemplateDecl template, SortResult sorted, SchemaRegistry schemas, Diagnostics diags) {
        var checker = new TypeChecker(template, schemas, diags);
        int before = diags.size();
        ProgramWalker.walk(sorted.order(), template.outputs(), checker);
        log.debug("Type check reported {} diagnostics", diags.size() - before);
        return checker.cache;
    }

    @Override
    public boolean walksExpressions() {
        return true;
    }

    @Override
    public boolean visitExpr(Expr expr) {
        cache.putExpr(expr, typeExpr(expr));
        return true;
    }

    @Override
    public boolean visitConfig(GraphNode.ConfigNode node) {
        ConfigParamDecl param = node.entry().param();
        Type declared = null;
        if (param.type() != null) {
            declared = ConfigTypes.parse(param.type().value()).orElse(null);
            if (declared == null) {
                diags.error(param.type().range(), String.format(
                    "unexpected configuration type '%s': valid types are %s", param.type().value(), ConfigTypes.VALID_TYPES));
            }
        }
        Type type = InvalidType.INSTANCE;
        boolean optional = false;
        if (param.defaultValue() != null) {
            optional = true;
            if (declared != null) {
                assertAssignable(param.defaultValue(), declared);
                type = declared;
            } else {
                type = orInvalid(cache.exprType(param.defaultValue()));
            }
        } else if (declared != null) {
            type = declared;
        }
        Type result = new InputType(type);
        if (optional) {
            result = new OptionalType(result);
        }
        cache.putConfig(node.key(), result);
        return true;
    }

    @Override
    public boolean visitExternalConfig(GraphNode.ExternalConfigNode node) {
        Type type;
        try {
            type = ConfigTypes.typeOf(node.value());
        } catch (IllegalArgumentException ex) {
            diags.error(null, String.format("config key \"%s\": %s", node.key(), ex.getMessage()));
            type = InvalidType.INSTANCE;
        }
        cache.putConfig(node.key(), new InputType(type));
        return true;
    }

    @Override
    public boolean visitVariable(GraphNode.VariableNode node) {
        cache.putVariable(node.key(), node.value());
        return true;
    }

    @Override
    public boolean visitMissing(GraphNode.MissingNode node) {
        diags.error(node.range(), String.format("resource, variable, or config value \"%s\" not found", node.key()));
        return false;
    }

    @Override
    public boolean visitOutput(PropertyEntry output) {
        cache.putOutput(output.name(), orInvalid(cache.exprType(output.value())));
        return true;
    }

    @Override
    public boolean visitResource(GraphNode.ResourceNode node) {
        var name = node.key();
        ResourceDecl resource = node.resource();
        var token = resource.typeToken();
        if (resource.type() == null) {
            cache.putResource(name, InvalidType.INSTANCE);
            return true;
        }
        var schema = resolveResource(name, resource.type());
        if (schema == null) {
            cache.putResource(name, InvalidType.INSTANCE);
            return true;
        }

        var get = resource.get();
        boolean isGet = get != null && (get.id() != null || !get.state().isEmpty());
        boolean hasProperties = !resource.properties().isEmpty();
        if (isGet && hasProperties) {
            diags.error(node.range(), "Resource fields properties and get are mutually exclusive",
                "Properties describe a resource managed by this stack; get reads a resource managed elsewhere.");
        }
        if (hasProperties || !isGet) {
            typePropertyEntries(name, node.range(), resource.properties(), schema.inputs());
        }
        cache.putResource(name, schema.toType());

        if (get != null) {
            if (get.id() != null) {
                assertAssignable(get.id(), PrimitiveType.STRING);
            }
            // read state is a partial view of the outputs
            var stateProperties = new ArrayList<Property>();
            for (var p : schema.outputs().properties()) {
                var type = p.required() ? new OptionalType(p.type()) : p.type();
                stateProperties.add(new Property(p.name(), type, false, p.constValue(), p.displayName(), p.range()));
            }
            typePropertyEntries(name, node.range(), get.state(), new ObjectType(token, stateProperties));
        }
        typeOptions(resource.options());
        return true;
    }

    private ResourceSchema resolveResource(String name, StringExpr type) {
        try {
            return schemas.resolveResource(type.value());
        } catch (SchemaResolutionException ex) {
            diags.error(type.range(), String.format("error resolving type of resource %s: %s", name, ex.getMessage()));
            return null;
        }
    }

    private void typePropertyEntries(String resourceName, SourceRange range, List<PropertyEntry> entries, ObjectType to) {
        var fromProperties = new ArrayList<Property>();
        var fromEntries = new ArrayList<ObjectExpr.Property>();
        for (var entry : entries) {
            var type = cache.exprType(entry.value());
            if (type == null) {
                var expected = to.property(entry.name());
                diags.warning(entry.key().range(),
                    String.format("internal error: unable to discover type of %s.%s", resourceName, entry.name()),
                    expected == null ? "" : "expected type " + expected.type().display());
                continue;
            }
            fromProperties.add(Property.required(entry.name(), type));
            fromEntries.add(new ObjectExpr.Property(entry.key(), entry.value()));
        }
        var from = new ObjectExpr(range, fromEntries);
        cache.putExpr(from, ObjectType.adhoc(fromProperties));
        assertAssignable(from, to);
    }

    private void typeOptions(ResourceOptionsDecl options) {
        for (var flag : new Expr[] {options.protect(), options.deleteBeforeReplace(), options.retainOnDelete()}) {
            if (flag != null) {
                assertAssignable(flag, PrimitiveType.BOOL);
            }
        }
        for (var list : new Expr[] {options.ignoreChanges(), options.replaceOnChanges(), options.additionalSecretOutputs()}) {
            if (list != null) {
                assertAssignable(list, STRING_LIST);
            }
        }
        if (options.importId() != null) {
            assertAssignable(options.importId(), PrimitiveType.STRING);
        }
        CustomTimeoutsDecl timeouts = options.customTimeouts();
        if (timeouts != null) {
            checkDuration("create", timeouts.create());
            checkDuration("update", timeouts.update());
            checkDuration("delete", timeouts.delete());
        }
    }

    private void checkDuration(String field, StringExpr value) {
        if (value != null && DurationParser.parse(value.value()).isEmpty()) {
            diags.error(value.range(), String.format("invalid duration \"%s\" for customTimeouts.%s", value.value(), field),
                "Durations look like 30s, 5m or 1h30m.");
        }
    }

    private Type typeExpr(Expr expr) {
        return switch (expr.kind()) {
            case NULL -> InvalidType.INSTANCE;
            case BOOLEAN -> PrimitiveType.BOOL;
            case NUMBER -> PrimitiveType.NUMBER;
            case STRING -> PrimitiveType.STRING;
            case INTERPOLATE -> typeInterpolate((InterpolateExpr) expr);
            case SYMBOL -> typeSymbol((SymbolExpr) expr);
            case LIST -> typeList((ListExpr) expr);
            case OBJECT -> typeObject((ObjectExpr) expr);
            case INVOKE -> typeInvoke((InvokeExpr) expr);
            case JOIN -> {
                var join = (JoinExpr) expr;
                assertAssignable(join.delimiter(), PrimitiveType.STRING);
                assertAssignable(join.values(), STRING_LIST);
                yield PrimitiveType.STRING;
            }
            case SPLIT -> {
                var split = (SplitExpr) expr;
                assertAssignable(split.delimiter(), PrimitiveType.STRING);
                assertAssignable(split.source(), PrimitiveType.STRING);
                yield STRING_LIST;
            }
            case SELECT -> typeSelect((SelectExpr) expr);
            case TO_JSON -> PrimitiveType.STRING;
            case TO_BASE64 -> {
                assertAssignable(((ToBase64Expr) expr).value(), PrimitiveType.STRING);
                yield PrimitiveType.STRING;
            }
            case FROM_BASE64 -> {
                assertAssignable(((FromBase64Expr) expr).value(), PrimitiveType.STRING);
                yield PrimitiveType.STRING;
            }
            case SECRET -> orInvalid(cache.exprType(((SecretExpr) expr).value()));
            case READ_FILE -> {
                assertAssignable(((ReadFileExpr) expr).path(), PrimitiveType.STRING);
                yield PrimitiveType.STRING;
            }
            case STACK_REFERENCE -> {
                assertAssignable(((StackReferenceExpr) expr).propertyName(), PrimitiveType.STRING);
                yield PrimitiveType.ANY;
            }
            case ASSET_ARCHIVE -> PrimitiveType.ARCHIVE;
            case STRING_ASSET, FILE_ASSET, REMOTE_ASSET, FILE_ARCHIVE, REMOTE_ARCHIVE -> {
                var asset = (AssetExpr) expr;
                assertAssignable(asset.source(), PrimitiveType.STRING);
                yield asset.isArchive() ? PrimitiveType.ARCHIVE : PrimitiveType.ASSET;
            }
        };
    }

    private Type typeList(ListExpr list) {
        var elements = new ArrayList<Type>();
        for (var element : list.elements()) {
            elements.add(orInvalid(cache.exprType(element)));
        }
        return new ArrayType(Types.union(elements));
    }

    private Type typeObject(ObjectExpr object) {
        var properties = new ArrayList<Property>();
        for (var entry : object.entries()) {
            if (!(entry.key() instanceof StringExpr key)) {
                // computed keys are only known at run time
                return InvalidType.INSTANCE;
            }
            properties.add(Property.required(key.value(), orInvalid(cache.exprType(entry.value()))));
        }
        return ObjectType.adhoc(properties);
    }

    private Type typeSelect(SelectExpr select) {
        assertAssignable(select.index(), PrimitiveType.INT);
        assertAssignable(select.values(), new ArrayType(PrimitiveType.ANY));
        var values = cache.exprType(select.values());
        if (values != null && Types.unwrap(values) instanceof ArrayType array) {
            return array.element();
        }
        return InvalidType.INSTANCE;
    }

    private Type typeInterpolate(InterpolateExpr interpolate) {
        for (var part : interpolate.parts()) {
            if (part.value() != null) {
                typeAccess(part.value(), interpolate.range());
            }
        }
        return PrimitiveType.STRING;
    }

    private Type typeSymbol(SymbolExpr symbol) {
        return typeAccess(symbol.access(), symbol.range());
    }

    private Type typeAccess(PropertyAccess access, SourceRange range) {
        var root = rootType(access.rootName());
        return PropertyAccessTyper.resolve(root, access.rootName(), access.tail(), (summary, detail) -> {
            diags.error(range, summary, detail);
            return InvalidType.INSTANCE;
        });
    }

    private Type rootType(String name) {
        var key = name;
        var project = template.projectName();
        if (!cache.hasConfig(key) && !cache.hasResource(key) && !cache.hasVariable(key)
            && !project.isEmpty() && key.startsWith(project + ":")) {
            key = key.substring(project.length() + 1);
        }
        if (cache.hasConfig(key)) {
            return cache.configType(key);
        }
        if (cache.hasVariable(key)) {
            return orInvalid(cache.variableType(key));
        }
        if (cache.hasResource(key)) {
            return cache.resourceType(key);
        }
        return InvalidType.INSTANCE;
    }

    private Type typeInvoke(InvokeExpr invoke) {
        var token = invoke.token().value();
        FunctionSchema function;
        try {
            function = schemas.resolveFunction(token);
        } catch (SchemaResolutionException ex) {
            diags.error(invoke.token().range(), ex.getMessage());
            return InvalidType.INSTANCE;
        }
        var inputs = function.inputs();
        var argumentNames = inputs.properties().stream().map(Property::name).toList();
        var suggestions = FieldSuggestions.forFields("Invoke " + token, argumentNames);
        if (invoke.callArgs() != null) {
            for (var entry : invoke.callArgs().entries()) {
                if (!(entry.key() instanceof StringExpr key)) {
                    continue;
                }
                var input = inputs.property(key.value());
                if (input == null) {
                    diags.warning(key.range(), suggestions.summary(key.value()), suggestions.detail(key.value()));
                } else {
                    assertAssignable(entry.value(), input.type());
                }
            }
            for (var input : inputs.properties()) {
                if (input.required() && invoke.callArgs().find(input.name()).isEmpty()) {
                    diags.error(invoke.callArgs().range(), String.format("Missing required argument '%s' of %s", input.name(), token));
                }
            }
        }

        var returnField = invoke.returnField();
        if (returnField == null) {
            return function.outputs();
        }
        for (var output : function.outputs().properties()) {
            if (output.name().equalsIgnoreCase(returnField.value())) {
                return output.type();
            }
        }
        var outputNames = function.outputs().properties().stream().map(Property::name).toList();
        var returnSuggestions = FieldSuggestions.forProperties(token, outputNames);
        diags.error(returnField.range(), returnSuggestions.summary(returnField.value()), returnSuggestions.detail(returnField.value()));
        return InvalidType.INSTANCE;
    }

    private void assertAssignable(Expr from, Type to) {
        if (to == null) {
            return;
        }
        var type = cache.exprType(from);
        if (type == null) {
            diags.warning(from.range(), "internal error: unable to discover type", "expected type '" + to.display() + "'");
            return;
        }
        var result = assignability.check(from, to);
        if (result == null) {
            return;
        }
        var summary = String.format("%s is not assignable from %s", to.display(), type.display());
        emit(result, summary, from.range(), "");
    }

    private void emit(NotAssignable node, String defaultSummary, SourceRange fallback, String path) {
        if (node.isTransitory() && !node.causes().isEmpty()) {
            var prefix = node.property() == null ? path : path + node.property() + ".";
            for (var cause : node.causes()) {
                emit(cause, null, fallback, prefix);
            }
            return;
        }
        var range = node.range() != null ? node.range() : fallback;
        String summary = node.summary();
        if (summary.isEmpty()) {
            summary = defaultSummary != null ? defaultSummary : path + node.headline();
        }
        if (node.isInternal()) {
            diags.warning(range, "internal error: " + summary, node.toString());
        } else {
            diags.error(range, summary, node.toString());
        }
    }

    private static Type orInvalid(Type type) {
        return type == null ? InvalidType.INSTANCE : type;
    }
}
