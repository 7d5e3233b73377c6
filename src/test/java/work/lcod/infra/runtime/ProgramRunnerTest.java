package work.lcod.infra.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.infra.config.StackSettings;
import work.lcod.infra.graph.GraphNode;
import work.lcod.infra.support.InfraTestSupport;
import work.lcod.infra.syntax.Diagnostics;

class ProgramRunnerTest {
    @Test
    void runsEveryPhase() {
        var engine = InfraTestSupport.engine();
        var run = InfraTestSupport.run("""
            variables:
              label: app
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: ${label}
            outputs:
              name: ${bucket.name}
            """, engine);

        assertFalse(run.hasErrors(), InfraTestSupport.summaries(run.diagnostics()));
        assertEquals(List.of("label", "bucket"), run.order().keys());
        assertNotNull(run.typing());
        assertTrue(run.evaluated());
        assertTrue(run.evaluation().completed());
        assertEquals("app", InfraTestSupport.output(run, "name"));
        assertEquals(1, engine.registrations().size());
    }

    @Test
    void schedulingErrorsStopBeforeTypeChecking() {
        var run = InfraTestSupport.run("""
            outputs:
              x: ${nowhere}
            """);

        assertNotNull(run.order());
        assertNull(run.typing());
        assertFalse(run.evaluated());
        assertEquals(List.of("resource, variable, or config value \"nowhere\" not found"),
            InfraTestSupport.errorSummaries(run.diagnostics()));
    }

    @Test
    void typeErrorsStopBeforeEvaluation() {
        var engine = InfraTestSupport.engine();
        var run = InfraTestSupport.run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  size: large
            """, engine);

        assertNotNull(run.typing());
        assertFalse(run.evaluated());
        assertTrue(engine.registrations().isEmpty());
        assertEquals(List.of("size: Cannot assign type 'string' to type 'int'"),
            InfraTestSupport.errorSummaries(run.diagnostics()));
    }

    @Test
    void parseErrorsSkipTheRun() {
        var run = InfraTestSupport.run("""
            name: [not, a, string]
            """);

        assertNull(run.order());
        assertTrue(run.hasErrors());
    }

    @Test
    void undeclaredSettingsBecomeExternalConfig() {
        var diags = new Diagnostics();
        var template = InfraTestSupport.parse("""
            name: web
            config:
              size:
                type: integer
            """, diags);
        var config = new LinkedHashMap<String, Object>();
        config.put("web:size", 2L);
        config.put("web:region", "eu");
        config.put("aws:region", "us");
        var settings = new StackSettings("web", "dev", "", config);
        var ctx = new ExecutionContext(InfraTestSupport.engine(), InfraTestSupport.testSchemas(), diags, settings,
            template.projectName(), null, null);

        assertEquals(List.of(
            new GraphNode.ExternalConfigNode("region", "eu"),
            new GraphNode.ExternalConfigNode("aws:region", "us")
        ), ProgramRunner.externalConfig(template, ctx));
    }

    @Test
    void contextFallsBackToSettingsIdentity() {
        var settings = new StackSettings("from-settings", "qa", "acme", Map.of());
        var ctx = new ExecutionContext(InfraTestSupport.engine(), InfraTestSupport.testSchemas(), null, settings, "", null, null);

        assertEquals("from-settings", ctx.project());
        assertEquals("qa", ctx.stack());
        assertEquals("acme", ctx.organization());
        assertEquals(Path.of("").toAbsolutePath().normalize(), ctx.workingDirectory());
        assertEquals(ctx.workingDirectory(), ctx.rootDirectory());
        assertNotNull(ctx.diagnostics());
    }

    @Test
    void loadsTemplatesFromDisk() {
        var diags = new Diagnostics();
        var template = TemplateLoader.loadFromLocalFile(InfraTestSupport.fixture("templates", "website", "Pulumi.yaml"), diags);

        assertEquals("website", template.projectName());
        assertEquals(2, template.resources().size());

        var ex = assertThrows(IllegalStateException.class,
            () -> TemplateLoader.loadFromLocalFile(InfraTestSupport.fixture("templates", "nope.yaml"), diags));
        assertTrue(ex.getMessage().startsWith("Failed to read template"));
    }
}
