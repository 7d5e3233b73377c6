package work.lcod.infra.schema;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.types.ArrayType;
import work.lcod.infra.types.MapType;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Property;

public final class SchemaRegistry {
    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    public static final String STACK_REFERENCE_TOKEN = "pulumi:pulumi:StackReference";

    private final PackageResolver resolver;
    private final Map<String, Optional<PackageSchema>> packages = new ConcurrentHashMap<>();

    public SchemaRegistry(PackageResolver resolver) {
        this.resolver = resolver;
        packages.put("pulumi", Optional.of(builtinPackage()));
    }

    public static SchemaRegistry of(PackageSchema... schemas) {
        var byName = new ConcurrentHashMap<String, PackageSchema>();
        for (var schema : schemas) {
            byName.put(schema.name(), schema);
        }
        return new SchemaRegistry(name -> Optional.ofNullable(byName.get(name)));
    }

    public Optional<PackageSchema> packageSchema(String name) {
        return packages.computeIfAbsent(name, key -> {
            var loaded = resolver.load(key);
            if (loaded.isPresent()) {
                log.debug("Loaded package schema {} {}", key, loaded.get().version());
            }
            return loaded;
        });
    }

    public ResourceSchema resolveResource(String token) {
        TypeTokens.validate(token);
        var pkg = requirePackage(token);
        if (TypeTokens.isProviderToken(token) && TypeTokens.packageName(token).equals(pkg.name())) {
            return pkg.provider();
        }
        var exact = pkg.resource(token);
        if (exact != null) {
            return exact;
        }
        for (var alternate : TypeTokens.alternates(token)) {
            var found = pkg.resource(alternate);
            if (found != null) {
                return found;
            }
        }
        throw new SchemaResolutionException(String.format(
            "unable to find resource type \"%s\" in resource provider \"%s\"", token, pkg.name()));
    }

    public FunctionSchema resolveFunction(String token) {
        TypeTokens.validate(token);
        var pkg = requirePackage(token);
        var exact = pkg.function(token);
        if (exact != null) {
            return exact;
        }
        for (var alternate : TypeTokens.alternates(token)) {
            var found = pkg.function(alternate);
            if (found != null) {
                return found;
            }
        }
        throw new SchemaResolutionException(String.format(
            "unable to find function \"%s\" in resource provider \"%s\"", token, pkg.name()));
    }

    private PackageSchema requirePackage(String token) {
        var name = TypeTokens.packageName(token);
        return packageSchema(name).orElseThrow(() ->
            new SchemaResolutionException(String.format("resource provider \"%s\" not found", name)));
    }

    private static PackageSchema builtinPackage() {
        var inputs = new ObjectType(STACK_REFERENCE_TOKEN, List.of(Property.required("name", PrimitiveType.STRING)));
        var outputs = new ObjectType(STACK_REFERENCE_TOKEN, List.of(
            Property.required("name", PrimitiveType.STRING),
            Property.required("outputs", new MapType(PrimitiveType.ANY)),
            Property.optional("secretOutputNames", new ArrayType(PrimitiveType.STRING))));
        var stackReference = new ResourceSchema(STACK_REFERENCE_TOKEN, inputs, outputs, false, false);
        return new PackageSchema("pulumi", "", null, Map.of(STACK_REFERENCE_TOKEN, stackReference), Map.of());
    }
}
