package work.lcod.infra.syntax;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class YamlSyntaxReader {
    private static final YAMLFactory YAML = new YAMLFactory();
    private static final JsonFactory JSON = new JsonFactory();

    private YamlSyntaxReader() {}

    public static SyntaxNode readFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(path.toString(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read template file " + path, ex);
        }
    }

    public static SyntaxNode read(String fileName, String text) {
        var factory = isJson(fileName) ? JSON : YAML;
        try (JsonParser parser = factory.createParser(text)) {
            var token = parser.nextToken();
            if (token == null) {
                var empty = SourceRange.of(fileName, 1, 1, 1, 1);
                return new SyntaxNode.ObjectNode(empty, List.of());
            }
            return readValue(fileName, parser);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid template " + fileName + ": " + ex.getMessage(), ex);
        }
    }

    private static boolean isJson(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static SyntaxNode readValue(String file, JsonParser parser) throws IOException {
        var start = parser.currentTokenLocation();
        var token = parser.currentToken();
        return switch (token) {
            case START_OBJECT -> readObject(file, parser, start);
            case START_ARRAY -> readList(file, parser, start);
            case VALUE_STRING -> new SyntaxNode.StringNode(range(file, start, parser), parser.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new SyntaxNode.NumberNode(range(file, start, parser), parser.getDoubleValue());
            case VALUE_TRUE -> new SyntaxNode.BooleanNode(range(file, start, parser), true);
            case VALUE_FALSE -> new SyntaxNode.BooleanNode(range(file, start, parser), false);
            case VALUE_NULL -> new SyntaxNode.NullNode(range(file, start, parser));
            case VALUE_EMBEDDED_OBJECT -> new SyntaxNode.StringNode(range(file, start, parser), parser.getText());
            default -> throw new IllegalArgumentException("Unexpected token " + token + " at " + position(start));
        };
    }

    private static SyntaxNode readObject(String file, JsonParser parser, JsonLocation start) throws IOException {
        var entries = new ArrayList<SyntaxNode.Entry>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            var keyStart = parser.currentTokenLocation();
            var key = new SyntaxNode.StringNode(range(file, keyStart, parser), parser.currentName());
            parser.nextToken();
            entries.add(new SyntaxNode.Entry(key, readValue(file, parser)));
        }
        return new SyntaxNode.ObjectNode(range(file, start, parser), entries);
    }

    private static SyntaxNode readList(String file, JsonParser parser, JsonLocation start) throws IOException {
        var elements = new ArrayList<SyntaxNode>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            elements.add(readValue(file, parser));
        }
        return new SyntaxNode.ListNode(range(file, start, parser), elements);
    }

    private static SourceRange range(String file, JsonLocation start, JsonParser parser) {
        var end = parser.currentLocation();
        return new SourceRange(file, position(start), position(end));
    }

    private static SourcePosition position(JsonLocation location) {
        return new SourcePosition(Math.max(location.getLineNr(), 0), Math.max(location.getColumnNr(), 0));
    }
}
