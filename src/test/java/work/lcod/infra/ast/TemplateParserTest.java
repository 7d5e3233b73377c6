package work.lcod.infra.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.infra.syntax.Diagnostic;
import work.lcod.infra.syntax.Diagnostics;
import work.lcod.infra.syntax.Severity;
import work.lcod.infra.syntax.YamlSyntaxReader;

class TemplateParserTest {
    private final Diagnostics diags = new Diagnostics();

    @Test
    void parsesEverySection() {
        var template = parse("""
            name: website
            runtime: yaml
            description: A static site
            config:
              region:
                type: String
                default: eu-west-1
              apiKey:
                secret: true
            variables:
              prefix: site-
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: ${prefix}www
                options:
                  protect: true
                  dependsOn:
                    - ${other}
                  customTimeouts:
                    create: 5m
              other:
                type: test:index:Bucket
                get:
                  id: existing
                  state:
                    name: old
            outputs:
              url: ${bucket.name}
            """);

        assertEquals(0, diags.size(), diags::toString);
        assertEquals("website", template.projectName());
        assertEquals("yaml", template.runtime().value());
        assertEquals("A static site", template.description().value());

        assertEquals(List.of("region", "apiKey"), template.configuration().stream().map(TemplateDecl.ConfigEntry::name).toList());
        var region = template.configuration().get(0).param();
        assertEquals("String", region.type().value());
        assertInstanceOf(StringExpr.class, region.defaultValue());
        assertFalse(region.isSecret());
        assertTrue(template.configuration().get(1).param().isSecret());

        var bucket = template.resources().get(0).resource();
        assertEquals("test:index:Bucket", bucket.typeToken());
        assertInstanceOf(InterpolateExpr.class, bucket.properties().get(0).value());
        assertInstanceOf(BooleanExpr.class, bucket.options().protect());
        assertEquals("5m", bucket.options().customTimeouts().create().value());
        assertNull(bucket.options().customTimeouts().delete());
        assertEquals(1, bucket.options().references().size());
        assertNull(bucket.get());

        var other = template.resources().get(1).resource();
        assertInstanceOf(StringExpr.class, other.get().id());
        assertEquals("name", other.get().state().get(0).name());
        assertTrue(other.properties().isEmpty());
        assertEquals(ResourceOptionsDecl.EMPTY, other.options());

        assertEquals("url", template.outputs().get(0).name());
    }

    @Test
    void configurationIsAnAliasOfConfig() {
        var template = parse("""
            configuration:
              size:
                type: Integer
                default: 3
            """);

        assertEquals("size", template.configuration().get(0).name());
        assertInstanceOf(NumberExpr.class, template.configuration().get(0).param().defaultValue());
    }

    @Test
    void emptyDocumentIsAnEmptyTemplate() {
        var template = parse("");

        assertEquals("", template.projectName());
        assertTrue(template.resources().isEmpty());
        assertEquals(0, diags.size());
    }

    @Test
    void readsJsonTemplates() {
        var root = YamlSyntaxReader.read("Main.json", """
            {"name": "json-project", "resources": {"b": {"type": "test:index:Bucket"}}}
            """);
        var template = TemplateParser.parse(root, diags);

        assertEquals("json-project", template.projectName());
        assertEquals("b", template.resources().get(0).name());
    }

    @Test
    void warnsAboutUnknownAndMiscapitalizedFields() {
        var template = parse("""
            Resources:
              bucket:
                type: test:index:Bucket
                propertiez:
                  name: b
            extra: 1
            """);

        assertEquals(1, template.resources().size());
        assertFalse(diags.hasErrors());
        assertEquals(List.of(
            "'Resources' looks like a miscapitalization of 'resources'",
            "Object 'bucket' has no field named 'propertiez'",
            "Object 'template' has no field named 'extra'"
        ), warnings());
        var unknown = diags.snapshot().get(1);
        assertEquals("note: available fields are: 'type', 'defaultProvider', 'properties', 'options', 'get'", unknown.detail());
    }

    @Test
    void reportsStructuralErrors() {
        parse("""
            name: [a]
            resources:
              untyped:
                properties: {}
              flagged:
                type: test:index:Bucket
                defaultProvider: maybe
              read:
                type: test:index:Bucket
                get:
                  state: {}
            outputs: [a]
            """);

        assertEquals(List.of(
            "name must be a string",
            "Required field 'type' is missing on resource \"untyped\"",
            "defaultProvider must be a boolean value",
            "Required field 'id' is missing on get",
            "outputs must be an object"
        ), errors());
    }

    @Test
    void recordsSourceRanges() {
        var template = parse("""
            resources:
              bucket:
                type: test:index:Bucket
            """);

        var key = template.resources().get(0).key();
        assertEquals(2, key.range().start().line());
        assertEquals("test.yaml", key.range().file());
    }

    private TemplateDecl parse(String yaml) {
        return TemplateParser.parse(YamlSyntaxReader.read("test.yaml", yaml), diags);
    }

    private List<String> errors() {
        return diags.errors().stream().map(Diagnostic::summary).toList();
    }

    private List<String> warnings() {
        return diags.snapshot().stream()
            .filter(d -> d.severity() == Severity.WARNING)
            .map(Diagnostic::summary)
            .toList();
    }
}
