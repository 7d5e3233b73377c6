package work.lcod.infra.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.infra.types.ArrayType;
import work.lcod.infra.types.EnumType;
import work.lcod.infra.types.MapType;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Property;
import work.lcod.infra.types.TokenType;
import work.lcod.infra.types.Type;
import work.lcod.infra.types.Types;

/**
 * Reads a package schema JSON document.
 *
 * <p>Supported shape: {@code name}, {@code version}, {@code provider}, {@code resources},
 * {@code functions} and {@code types}. Property types use {@code type}, {@code items},
 * {@code additionalProperties}, {@code oneOf}, {@code const} and {@code $ref}.
 */
public final class SchemaReader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String LOCAL_TYPE_REF = "#/types/";

    private final JsonNode typeDefinitions;
    private final Map<String, Type> resolvedTypes = new HashMap<>();
    private final Set<String> resolving = new HashSet<>();

    private SchemaReader(JsonNode typeDefinitions) {
        this.typeDefinitions = typeDefinitions;
    }

    public static PackageSchema readFile(Path path) {
        try {
            return read(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read package schema " + path, ex);
        }
    }

    public static PackageSchema read(String json) {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid package schema: " + ex.getMessage(), ex);
        }
        if (root == null || !root.hasNonNull("name")) {
            throw new IllegalArgumentException("Package schema must declare a name");
        }
        var reader = new SchemaReader(root.path("types"));
        var name = root.get("name").asText();
        var version = root.path("version").asText("");

        ResourceSchema provider = null;
        if (root.has("provider")) {
            provider = reader.resource(TypeTokens.PROVIDER_PREFIX + name, root.get("provider"), true);
        }
        var resources = new LinkedHashMap<String, ResourceSchema>();
        root.path("resources").fields().forEachRemaining(e ->
            resources.put(e.getKey(), reader.resource(e.getKey(), e.getValue(), false)));
        var functions = new LinkedHashMap<String, FunctionSchema>();
        root.path("functions").fields().forEachRemaining(e ->
            functions.put(e.getKey(), reader.function(e.getKey(), e.getValue())));
        return new PackageSchema(name, version, provider, resources, functions);
    }

    private ResourceSchema resource(String token, JsonNode node, boolean provider) {
        var inputs = objectType(token, node.path("inputProperties"), node.path("requiredInputs"));
        var outputs = objectType(token, node.path("properties"), node.path("required"));
        return new ResourceSchema(token, inputs, outputs, node.path("isComponent").asBoolean(false), provider);
    }

    private FunctionSchema function(String token, JsonNode node) {
        var inputs = node.has("inputs")
            ? objectType(token + "Args", node.path("inputs").path("properties"), node.path("inputs").path("required"))
            : new ObjectType(token + "Args", List.of());
        var outputs = node.has("outputs")
            ? objectType(token + "Result", node.path("outputs").path("properties"), node.path("outputs").path("required"))
            : new ObjectType(token + "Result", List.of());
        return new FunctionSchema(token, inputs, outputs);
    }

    private ObjectType objectType(String token, JsonNode properties, JsonNode required) {
        var requiredNames = new HashSet<String>();
        required.forEach(n -> requiredNames.add(n.asText()));
        var props = new ArrayList<Property>();
        properties.fields().forEachRemaining(e -> {
            var definition = e.getValue();
            Object constValue = definition.has("const") ? JSON.convertValue(definition.get("const"), Object.class) : null;
            props.add(new Property(e.getKey(), typeOf(definition), requiredNames.contains(e.getKey()), constValue, null, null));
        });
        return new ObjectType(token, props);
    }

    private Type typeOf(JsonNode definition) {
        if (definition.has("$ref")) {
            return reference(definition.get("$ref").asText());
        }
        if (definition.has("oneOf")) {
            var alternatives = new ArrayList<Type>();
            definition.get("oneOf").forEach(n -> alternatives.add(typeOf(n)));
            return Types.union(alternatives);
        }
        var type = definition.path("type").asText("");
        return switch (type) {
            case "string" -> PrimitiveType.STRING;
            case "number" -> PrimitiveType.NUMBER;
            case "integer" -> PrimitiveType.INT;
            case "boolean" -> PrimitiveType.BOOL;
            case "array" -> new ArrayType(definition.has("items") ? typeOf(definition.get("items")) : PrimitiveType.ANY);
            case "object" -> new MapType(definition.has("additionalProperties")
                ? typeOf(definition.get("additionalProperties"))
                : PrimitiveType.ANY);
            default -> PrimitiveType.ANY;
        };
    }

    private Type reference(String ref) {
        if (ref.endsWith("#/Asset")) {
            return PrimitiveType.ASSET;
        }
        if (ref.endsWith("#/Archive")) {
            return PrimitiveType.ARCHIVE;
        }
        if (ref.endsWith("#/Any") || ref.endsWith("#/Json")) {
            return PrimitiveType.ANY;
        }
        int idx = ref.indexOf(LOCAL_TYPE_REF);
        if (idx < 0) {
            return new TokenType(ref, null);
        }
        var token = ref.substring(idx + LOCAL_TYPE_REF.length());
        var cached = resolvedTypes.get(token);
        if (cached != null) {
            return cached;
        }
        var definition = typeDefinitions.get(token);
        if (definition == null || !resolving.add(token)) {
            // unknown or self-referencing definition: keep it opaque
            return new TokenType(token, null);
        }
        try {
            Type resolved;
            if (definition.has("enum")) {
                var values = new ArrayList<EnumType.EnumValue>();
                definition.get("enum").forEach(v -> values.add(new EnumType.EnumValue(
                    v.hasNonNull("name") ? v.get("name").asText() : null,
                    JSON.convertValue(v.get("value"), Object.class))));
                resolved = new EnumType(token, typeOf(definition), values);
            } else {
                resolved = objectType(token, definition.path("properties"), definition.path("required"));
            }
            resolvedTypes.put(token, resolved);
            return resolved;
        } finally {
            resolving.remove(token);
        }
    }
}
