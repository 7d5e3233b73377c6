package work.lcod.infra.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.infra.support.InfraTestSupport;

class SchemaRegistryTest {
    private final SchemaRegistry registry = InfraTestSupport.testSchemas();

    @Test
    void resolvesExactTokens() {
        assertEquals("test:index:Bucket", registry.resolveResource("test:index:Bucket").token());
        assertEquals("test:index:echo", registry.resolveFunction("test:index:echo").token());
    }

    @Test
    void fallsBackToAlternateTokens() {
        assertEquals("test:index:Bucket", registry.resolveResource("test:Bucket").token());
        assertEquals("test:storage/disk:Disk", registry.resolveResource("test:storage:Disk").token());
        assertEquals("test:index:getZones", registry.resolveFunction("test:getZones").token());
    }

    @Test
    void resolvesProvidersAndStackReferences() {
        var provider = registry.resolveResource("pulumi:providers:test");
        assertTrue(provider.provider());

        var stackReference = registry.resolveResource(SchemaRegistry.STACK_REFERENCE_TOKEN);
        assertTrue(stackReference.outputs().property("outputs").required());
    }

    @Test
    void explainsResolutionFailures() {
        assertEquals("unable to find resource type \"test:index:Nope\" in resource provider \"test\"",
            assertThrows(SchemaResolutionException.class, () -> registry.resolveResource("test:index:Nope")).getMessage());
        assertEquals("unable to find function \"test:index:nope\" in resource provider \"test\"",
            assertThrows(SchemaResolutionException.class, () -> registry.resolveFunction("test:index:nope")).getMessage());
        assertEquals("resource provider \"aws\" not found",
            assertThrows(SchemaResolutionException.class, () -> registry.resolveResource("aws:s3:Bucket")).getMessage());
        assertEquals("invalid type token \"Bucket\"",
            assertThrows(SchemaResolutionException.class, () -> registry.resolveResource("Bucket")).getMessage());
    }

    @Test
    void loadsPackagesFromADirectoryOnce() {
        var loads = new AtomicInteger();
        var directory = new DirectoryPackageResolver(InfraTestSupport.fixture("schemas"));
        var counting = new SchemaRegistry(name -> {
            loads.incrementAndGet();
            return directory.load(name);
        });

        counting.resolveResource("test:index:Bucket");
        counting.resolveFunction("test:index:getZones");
        assertEquals(1, loads.get());

        assertEquals(Optional.empty(), counting.packageSchema("missing"));
        assertEquals(Optional.empty(), counting.packageSchema("missing"));
        assertEquals(2, loads.get());
    }

    @Test
    void computesTokenAlternates() {
        assertEquals(List.of("aws:index:Bucket", "aws:index/bucket:Bucket"), TypeTokens.alternates("aws:Bucket"));
        assertEquals(List.of("aws:s3/bucket:Bucket"), TypeTokens.alternates("aws:s3:Bucket"));
        assertEquals("aws", TypeTokens.packageName("pulumi:providers:aws"));
        assertTrue(TypeTokens.isProviderToken("pulumi:providers:aws"));
    }
}
