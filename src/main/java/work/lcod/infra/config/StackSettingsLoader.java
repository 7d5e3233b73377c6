package work.lcod.infra.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link StackSettings} from a TOML file:
 *
 * <pre>
 * project = "web"
 * stack = "dev"
 * organization = "acme"
 *
 * [config]
 * "web:size" = 3
 * region = "eu-west-1"
 * </pre>
 */
public final class StackSettingsLoader {
    private StackSettingsLoader() {}

    public static StackSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Stack settings file not found: " + path);
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read stack settings " + path, ex);
        }
    }

    public static StackSettings parse(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid stack settings: " + messages);
        }
        var config = new LinkedHashMap<String, Object>();
        var table = result.getTable("config");
        if (table != null) {
            for (var key : table.keySet()) {
                config.put(key, convert(table.get(List.of(key))));
            }
        }
        return new StackSettings(
            result.getString("project"),
            result.getString("stack"),
            result.getString("organization"),
            config
        );
    }

    private static Object convert(Object value) {
        if (value instanceof TomlArray array) {
            var items = new ArrayList<Object>();
            for (int i = 0; i < array.size(); i++) {
                items.add(convert(array.get(i)));
            }
            return items;
        }
        if (value instanceof TomlTable table) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (var key : table.keySet()) {
                map.put(key, convert(table.get(List.of(key))));
            }
            return map;
        }
        return value;
    }
}
