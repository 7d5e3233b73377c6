package work.lcod.infra.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.infra.support.InfraTestSupport;

class StackSettingsTest {
    @Test
    void loadsTomlSettings() {
        var settings = StackSettingsLoader.load(InfraTestSupport.fixture("stacks", "dev.toml"));

        assertEquals("website", settings.project());
        assertEquals("dev", settings.stack());
        assertEquals("acme", settings.organization());
        assertEquals(3L, settings.config().get("website:size"));
        assertEquals(List.of("a", "b"), settings.config().get("zones"));
        assertEquals(0.5, settings.config().get("ratio"));
        assertEquals(true, settings.config().get("verbose"));
    }

    @Test
    void prefersProjectNamespacedKeys() {
        var settings = new StackSettings("web", "dev", "", Map.of("web:region", "eu", "region", "us", "size", 2L));

        assertEquals(Optional.of("eu"), settings.lookup("web", "region"));
        assertEquals(Optional.of("us"), settings.lookup("", "region"));
        assertEquals(Optional.of(2L), settings.lookup("web", "size"));
        assertTrue(settings.lookup("web", "missing").isEmpty());
    }

    @Test
    void localConfigStripsOnlyTheProjectNamespace() {
        var settings = StackSettingsLoader.parse("""
            [config]
            "website:size" = 3
            "aws:region" = "eu-central-1"
            """);

        assertEquals(Map.of("size", 3L, "aws:region", "eu-central-1"), settings.localConfig("website"));
    }

    @Test
    void extraConfigOverridesFileValues() {
        var settings = StackSettingsLoader.parse("""
            stack = "prod"
            [config]
            region = "eu"
            """).withConfig(Map.of("region", "us", "size", "4"));

        assertEquals("prod", settings.stack());
        assertEquals("", settings.project());
        assertEquals(Map.of("region", "us", "size", "4"), settings.config());
    }

    @Test
    void reportsInvalidFiles() {
        var missing = assertThrows(IllegalArgumentException.class,
            () -> StackSettingsLoader.load(Path.of("does-not-exist.toml")));
        assertTrue(missing.getMessage().startsWith("Stack settings file not found"));

        var invalid = assertThrows(IllegalArgumentException.class, () -> StackSettingsLoader.parse("project = "));
        assertTrue(invalid.getMessage().startsWith("Invalid stack settings: "), invalid.getMessage());
    }
}
