package work.lcod.infra.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import work.lcod.infra.engine.InMemoryEngine;
import work.lcod.infra.support.InfraTestSupport;

class InfraRunnerTest {
    private static final Path WEBSITE = InfraTestSupport.fixture("templates", "website");

    @Test
    void runsLocalTemplate() {
        var result = new InfraRunner().run(website().build());

        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
        assertEquals(0, result.status().exitCode());
        assertEquals("website-dev", result.outputs().get("bucketName"));
        assertEquals(3L, result.outputs().get("size"));
        assertEquals("Welcome", result.outputs().get("banner"));
        assertEquals(InfraRunner.SECRET_OUTPUT, result.outputs().get("password"));
        assertEquals("website", result.metadata().get("project"));
        assertEquals("dev", result.metadata().get("stack"));
        assertEquals(2, result.metadata().get("resourceCount"));
        assertEquals("WARN", result.metadata().get("logLevel"));
    }

    @Test
    void explicitValuesOverrideTheSettingsFile() {
        var engine = InMemoryEngine.builder().invokes(InfraTestSupport.testInvokes()).build();
        var result = new InfraRunner().run(website()
            .stack("prod")
            .config("website:size", "5")
            .engine(engine)
            .build());

        assertTrue(result.isSuccess(), () -> String.valueOf(result.metadata()));
        assertEquals("website-prod", result.outputs().get("bucketName"));
        assertEquals(5L, result.outputs().get("size"));
        assertEquals(2, engine.registrations().size());
        var tags = (Map<?, ?>) InfraTestSupport.value(engine.registrations().get(0).properties().get("tags"));
        assertEquals("eu-west-1", InfraTestSupport.value(tags.get("region")));
    }

    @Test
    void previewPlansWithoutCreating() {
        var result = new InfraRunner().run(website().preview(true).build());

        assertEquals(RunResult.Status.PLANNED, result.status(), () -> String.valueOf(result.metadata()));
        assertTrue(result.isSuccess());
        assertEquals("website-dev", result.outputs().get("bucketName"));
        assertEquals(InfraRunner.UNKNOWN_OUTPUT, result.outputs().get("arn"));
    }

    @Test
    void templateErrorsFailTheRun() {
        var broken = InfraTestSupport.fixture("templates", "broken");
        var result = new InfraRunner().run(RunConfiguration.builder()
            .target(TemplateTarget.forLocal(Path.of("Pulumi.yaml")))
            .workingDirectory(broken)
            .schemaDirectory(InfraTestSupport.fixture("schemas"))
            .build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("template has errors", result.metadata().get("error"));
        assertEquals(1, result.errors().size());
        assertEquals("resource, variable, or config value \"nothing\" not found", result.errors().get(0).summary());
        assertTrue(result.outputs().isEmpty());
    }

    @Test
    void unreadableTemplatesAreReportedAsFailures() {
        var result = new InfraRunner().run(RunConfiguration.builder()
            .target(TemplateTarget.forLocal(Path.of("missing.yaml")))
            .workingDirectory(WEBSITE)
            .build());

        assertFalse(result.isSuccess());
        assertTrue(String.valueOf(result.metadata().get("error")).startsWith("Failed to read template"));
    }

    @Test
    void runToJsonAttachesThePayload() {
        var result = new InfraRunner().runToJson(website().build());

        var payload = String.valueOf(result.metadata().get("payload"));
        assertTrue(payload.contains("\"status\" : \"success\""), payload);
        assertTrue(payload.contains("\"bucketName\" : \"website-dev\""), payload);
        assertTrue(result.toPrettyJson().contains("\"payload\""));
    }

    @Test
    void runsTemplatesServedOverHttp() throws Exception {
        var server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        var body = """
            name: remote
            variables:
              greeting: hello
            outputs:
              greeting: ${greeting}-${pulumi.stack}
            """.getBytes(StandardCharsets.UTF_8);
        server.createContext("/Pulumi.yaml", exchange -> {
            exchange.sendResponseHeaders(200, body.length);
            try (var out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        try {
            var uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/Pulumi.yaml");
            var target = TemplateTarget.forRemote(uri);
            var result = new InfraRunner().run(RunConfiguration.builder()
                .target(target)
                .timeout(Duration.ofSeconds(5))
                .build());

            assertTrue(target.isRemote());
            assertEquals(uri.toString(), result.metadata().get("template"));
            assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
            assertEquals("hello-dev", result.outputs().get("greeting"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void targetsNeedASource() {
        assertThrows(IllegalArgumentException.class, () -> new TemplateTarget(Optional.empty(), Optional.empty()));
        assertEquals("a/b.yaml", TemplateTarget.forLocal(Path.of("a", "b.yaml")).display().replace('\\', '/'));
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.WARN, LogLevel.from("warning"));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.OFF, LogLevel.from("Quiet"));
        var ex = assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
        assertEquals("unknown log level 'loud'; expected one of trace, debug, info, warn, error, off", ex.getMessage());
    }

    @Test
    void appliesTheLogLevelToRuntimeLoggers() {
        var logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LogLevel.ROOT_LOGGER);
        var previous = logger.getLevel();
        try {
            LogLevel.DEBUG.apply();
            assertEquals(ch.qos.logback.classic.Level.DEBUG, logger.getLevel());
            assertTrue(LoggerFactory.getLogger(InfraRunner.class).isDebugEnabled());
            LogLevel.OFF.apply();
            assertFalse(LoggerFactory.getLogger(InfraRunner.class).isErrorEnabled());
        } finally {
            logger.setLevel(previous);
        }
    }

    private static RunConfiguration.Builder website() {
        return RunConfiguration.builder()
            .target(TemplateTarget.forLocal(Path.of("Pulumi.yaml")))
            .workingDirectory(WEBSITE)
            .stackSettingsFile(InfraTestSupport.fixture("stacks", "dev.toml"))
            .schemaDirectory(InfraTestSupport.fixture("schemas"));
    }
}
