package work.lcod.infra.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.infra.support.InfraTestSupport.engine;
import static work.lcod.infra.support.InfraTestSupport.errorSummaries;
import static work.lcod.infra.support.InfraTestSupport.output;
import static work.lcod.infra.support.InfraTestSupport.resolve;
import static work.lcod.infra.support.InfraTestSupport.run;
import static work.lcod.infra.support.InfraTestSupport.summaries;
import static work.lcod.infra.support.InfraTestSupport.testInvokes;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.infra.config.StackSettings;
import work.lcod.infra.engine.InMemoryEngine;
import work.lcod.infra.engine.ResourceKind;
import work.lcod.infra.graph.MissingReferencePolicy;
import work.lcod.infra.runtime.ProgramRun;
import work.lcod.infra.syntax.Severity;

class EvaluatorTest {
    @Test
    void registersResourcesAndResolvesOutputs() {
        var engine = engine();
        var run = run("""
            name: web
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: assets
                  size: 3
                  tags:
                    env: prod
            outputs:
              bucketName: ${bucket.name}
              bucketUrn: ${bucket.urn}
              bucketId: ${bucket.id}
            """, engine);

        assertNoErrors(run);
        assertTrue(run.evaluation().completed());
        assertEquals("assets", output(run, "bucketName"));
        assertEquals("urn:pulumi:dev::project::test:index:Bucket::bucket", output(run, "bucketUrn"));
        assertEquals("bucket-id", output(run, "bucketId"));

        var registration = engine.registrations().get(0);
        assertEquals("test:index:Bucket", registration.token());
        assertEquals(ResourceKind.CUSTOM, registration.kind());
        assertEquals(List.of("name", "size", "tags"), List.copyOf(registration.properties().keySet()));
        assertEquals(Map.of("env", "prod"), registration.properties().get("tags"));
    }

    @Test
    void addsSchemaConstantsWithoutOverridingProperties() {
        var engine = engine();
        var run = run("""
            resources:
              obj:
                type: test:index:Object
                properties:
                  bucket: assets
            """, engine);

        assertNoErrors(run);
        assertEquals("blob", engine.registrations().get(0).properties().get("kind"));
    }

    @Test
    void componentsRegisterWithoutAnId() {
        var engine = engine();
        var run = run("""
            resources:
              group:
                type: test:index:Group
                properties:
                  label: edge
            """, engine);

        assertNoErrors(run);
        assertEquals(ResourceKind.COMPONENT, engine.registrations().get(0).kind());
        assertNull(run.evaluation().resources().get("group").id().toFuture().join().value());
    }

    @Test
    void readsConfigurationFromStackSettings() {
        var settings = new StackSettings("web", "dev", "acme", Map.of("web:count", "4", "token", "abc"));
        var run = run("""
            name: web
            config:
              count:
                type: integer
              label:
                default: hello
              token:
                type: string
                secret: true
            outputs:
              count: ${count}
              label: ${label}
              token: ${token}
              stack: ${pulumi.stack}
              org: ${pulumi.organization}
            """, engine(), settings);

        assertNoErrors(run);
        assertEquals(4L, output(run, "count"));
        assertEquals("hello", output(run, "label"));
        var token = resolve(run.evaluation().outputs().get("token"));
        assertTrue(token.secret());
        assertEquals("abc", token.value());
        assertEquals("dev", output(run, "stack"));
        assertEquals("acme", output(run, "org"));
    }

    @Test
    void coercesConfigToTheTypeOfItsDefault() {
        var settings = new StackSettings("web", "dev", "", Map.of("replicas", "7", "verbose", "true"));
        var run = run("""
            name: web
            config:
              replicas:
                default: 1
              verbose:
                default: false
            outputs:
              replicas: ${replicas}
              verbose: ${verbose}
            """, engine(), settings);

        assertNoErrors(run);
        assertEquals(7L, output(run, "replicas"));
        assertEquals(true, output(run, "verbose"));
    }

    @Test
    void reportsMissingRequiredConfiguration() {
        var run = run("""
            config:
              region:
                type: string
            outputs:
              region: ${region}
            """);

        assertFalse(run.evaluation().completed());
        assertEquals(List.of("missing required configuration variable 'region'"), errorSummaries(run.diagnostics()));
    }

    @Test
    void reportsConfigValuesOfTheWrongType() {
        var settings = new StackSettings("", "dev", "", Map.of("count", "many"));
        var run = run("""
            config:
              count:
                type: integer
            """, engine(), settings);

        assertEquals(List.of("config count: value many is not a valid int"), errorSummaries(run.diagnostics()));
    }

    @Test
    void formatsScalarsInInterpolations() {
        var run = run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
            variables:
              n: 3
              rate: 1.5
              flag: true
            outputs:
              text: "n=${n} rate=${rate} flag=${flag} urn=${bucket}"
              escaped: "cost: $${n}"
            """);

        assertNoErrors(run);
        assertEquals("n=3 rate=1.5 flag=true urn=urn:pulumi:dev::project::test:index:Bucket::bucket",
            output(run, "text"));
        assertEquals("cost: ${n}", output(run, "escaped"));
    }

    @Test
    void refusesToInterpolateCollections() {
        var run = run("""
            variables:
              xs: [a, b]
            outputs:
              bad: "v=${xs}"
            """);

        assertEquals(List.of("cannot interpolate a list into a string: ${xs}"), errorSummaries(run.diagnostics()));
        assertFalse(run.evaluation().outputs().containsKey("bad"));
    }

    @Test
    void deferredKeyPostponesLaterEntries() {
        var engine = InMemoryEngine.builder().invokes(testInvokes()).deferCompletion(true).build();
        var run = run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: keyed
            variables:
              obj:
                first: 1
                "${bucket.name}": 2
                last:
                  fn::invoke:
                    function: test:index:echo
                    arguments:
                      value: tail
                    return: value
            outputs:
              obj: ${obj}
            """, engine);

        assertNoErrors(run);
        var obj = run.evaluation().outputs().get("obj");
        assertInstanceOf(Output.class, obj);
        assertFalse(((Output) obj).isDone());
        assertTrue(engine.invocations().isEmpty());

        assertEquals(2, engine.completePending());
        assertEquals(1, engine.invocations().size());
        var value = (Map<?, ?>) resolve(obj).value();
        assertEquals(List.of("first", "keyed", "last"), List.copyOf(value.keySet()));
        assertEquals("tail", value.get("last"));
    }

    @Test
    void memoizesStackReferences() {
        var engine = InMemoryEngine.builder()
            .stackOutputs("acme/network/prod", Map.of("vpcId", "vpc-1", "subnet", "sn-1"))
            .build();
        var run = run("""
            variables:
              vpc:
                fn::stackReference:
                  - acme/network/prod
                  - vpcId
              subnet:
                fn::stackReference:
                  - acme/network/prod
                  - subnet
            outputs:
              vpc: ${vpc}
              subnet: ${subnet}
            """, engine);

        assertNoErrors(run);
        assertEquals("vpc-1", output(run, "vpc"));
        assertEquals("sn-1", output(run, "subnet"));
        assertEquals(List.of("acme/network/prod"), engine.stackLookups());
    }

    @Test
    void selectsListElements() {
        var run = run("""
            outputs:
              second:
                fn::select: [1, [a, b]]
            """);

        assertNoErrors(run);
        assertEquals("b", output(run, "second"));
    }

    @Test
    void rejectsFractionalAndOutOfRangeSelectIndexes() {
        var run = run("""
            outputs:
              fractional:
                fn::select: [1.5, [a, b]]
              outOfRange:
                fn::select: [5, [a, b]]
            """);

        assertEquals(List.of(
            "index must be a positive integral, not 1.5",
            "list index 5 out-of-bounds for list of length 2"
        ), errorSummaries(run.diagnostics()));
    }

    @Test
    void joinsAndSplitsStrings() {
        var run = run("""
            outputs:
              joined:
                fn::join: ["-", [a, b, c]]
              parts:
                fn::split: [",", "a,,b"]
            """);

        assertNoErrors(run);
        assertEquals("a-b-c", output(run, "joined"));
        assertEquals(List.of("a", "", "b"), output(run, "parts"));
    }

    @Test
    void splitsOnCodePointsWithAnEmptyDelimiter() {
        assertEquals(List.of("h", "é", "😀"), Evaluator.split("hé😀", ""));
        assertEquals(List.of("", ""), Evaluator.split(",", ","));
    }

    @Test
    void reportsNonStringJoinElements() {
        var run = run("""
            outputs:
              joined:
                fn::join: [",", [a, 1]]
            """);

        assertEquals(List.of("expected expression in fn::join to produce a string, but the element at index 1 is a number"),
            errorSummaries(run.diagnostics()));
    }

    @Test
    void encodesAndDecodesBase64() {
        var run = run("""
            outputs:
              encoded:
                fn::toBase64: hello
              decoded:
                fn::fromBase64: aGVsbG8=
            """);

        assertNoErrors(run);
        assertEquals("aGVsbG8=", output(run, "encoded"));
        assertEquals("hello", output(run, "decoded"));
    }

    @Test
    void reportsInvalidBase64() {
        var run = run("""
            outputs:
              decoded:
                fn::fromBase64: "!!notbase64"
            """);

        var errors = errorSummaries(run.diagnostics());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("fn::fromBase64 unable to decode !!notbase64, error: "), errors.get(0));
    }

    @Test
    void serializesValuesToJson() {
        var run = run("""
            outputs:
              json:
                fn::toJSON:
                  a: 1
                  b: [true, x]
            """);

        assertNoErrors(run);
        assertEquals("{\"a\":1,\"b\":[true,\"x\"]}", output(run, "json"));
    }

    @Test
    void secretnessSticksToDerivedValues() {
        var run = run("""
            variables:
              password:
                fn::secret: s3cr3t
            outputs:
              derived: "pre-${password}"
            """);

        assertNoErrors(run);
        var derived = resolve(run.evaluation().outputs().get("derived"));
        assertTrue(derived.secret());
        assertEquals("pre-s3cr3t", derived.value());
    }

    @Test
    void callsProviderFunctions() {
        var engine = engine();
        var run = run("""
            variables:
              zones:
                fn::test:index:getZones:
                  region: eu
            outputs:
              names:
                fn::invoke:
                  function: test:index:getZones
                  arguments:
                    region: us
                  return: names
              count: ${zones.count}
            """, engine);

        assertNoErrors(run);
        assertEquals(List.of("usa", "usb", "usc"), output(run, "names"));
        assertEquals(3, output(run, "count"));
        assertEquals(2, engine.invocations().size());
        assertEquals(Map.of("region", "eu"), engine.invocations().get(0).args());
    }

    @Test
    void buildsAssetArchivesInKeyOrder() {
        var engine = engine();
        var run = run("""
            variables:
              bundle:
                fn::assetArchive:
                  zeta:
                    fn::stringAsset: last
                  alpha:
                    fn::fileAsset:
                      fn::invoke:
                        function: test:index:echo
                        arguments:
                          value: ./a.txt
                        return: value
            outputs:
              bundle: ${bundle}
            """, engine);

        assertNoErrors(run);
        var archive = (Archive) output(run, "bundle");
        assertEquals(Archive.Kind.ASSETS, archive.kind());
        assertEquals(List.of("alpha", "zeta"), List.copyOf(archive.assets().keySet()));
        assertEquals(new Asset(Asset.Kind.FILE, "./a.txt"), archive.assets().get("alpha"));
        assertEquals(new Asset(Asset.Kind.STRING, "last"), archive.assets().get("zeta"));
        assertEquals(1, engine.invocations().size());
    }

    @Test
    void readsFilesRelativeToTheWorkingDirectory(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("notes.txt"), "remember the milk");
        var run = run("""
            outputs:
              notes:
                fn::readFile: notes.txt
              missing:
                fn::readFile: missing.txt
            """, engine(), StackSettings.EMPTY, dir, MissingReferencePolicy.ERROR);

        assertEquals("remember the milk", output(run, "notes"));
        var errors = errorSummaries(run.diagnostics());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Error reading file at path missing.txt: "), errors.get(0));
    }

    @Test
    void deferredFailureIsReportedOnceAndLogged() {
        var engine = engine();
        var run = run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
                  size: 3
            outputs:
              encoded:
                fn::toBase64: ${bucket.size}
            """, engine);

        assertEquals(List.of("fn::toBase64 requires a string argument, not a number"), errorSummaries(run.diagnostics()));
        assertEquals(1, engine.logs().size());
        assertEquals(Severity.ERROR, engine.logs().get(0).severity());
        assertTrue(engine.logs().get(0).message().endsWith("fn::toBase64 requires a string argument, not a number"));
        var encoded = (Output) run.evaluation().outputs().get("encoded");
        assertTrue(encoded.toFuture().isCompletedExceptionally());
    }

    @Test
    void unknownValuesSkipOperationsDuringPreview() {
        var engine = InMemoryEngine.builder().preview(true).build();
        var run = run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
            outputs:
              encoded:
                fn::toBase64: ${bucket.id}
              label: "id-${bucket.id}"
              name: ${bucket.name}
            """, engine);

        assertNoErrors(run);
        assertFalse(resolve(run.evaluation().outputs().get("encoded")).known());
        assertFalse(resolve(run.evaluation().outputs().get("label")).known());
        assertEquals("b", output(run, "name"));
        assertTrue(engine.logs().isEmpty());
    }

    @Test
    void appliesDefaultProviders() {
        var engine = engine();
        var run = run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
              prov:
                type: pulumi:providers:test
                defaultProvider: true
                properties:
                  region: eu
            """, engine);

        assertNoErrors(run);
        var registrations = engine.registrations();
        assertEquals(List.of("prov", "bucket"), registrations.stream().map(r -> r.name()).toList());
        assertEquals(ResourceKind.PROVIDER, registrations.get(0).kind());
        assertEquals("prov", registrations.get(1).options().provider().name());
    }

    @Test
    void evaluatesResourceOptions() {
        var engine = engine();
        var run = run("""
            resources:
              first:
                type: test:index:Bucket
                properties:
                  name: one
              second:
                type: test:index:Bucket
                properties:
                  name: two
                options:
                  protect: true
                  dependsOn:
                    - ${first}
                  ignoreChanges: [tags]
                  customTimeouts:
                    create: 5m
                  version: 1.2.3
            """, engine);

        assertNoErrors(run);
        var options = engine.registrations().get(1).options();
        assertTrue(options.protect());
        assertEquals("first", options.dependsOn().get(0).name());
        assertEquals(List.of("tags"), options.ignoreChanges());
        assertEquals(Duration.ofMinutes(5), options.customTimeouts().get("create"));
        assertEquals("1.2.3", options.version());
    }

    @Test
    void deferredOptionsAreRejected() {
        var settings = new StackSettings("", "dev", "", Map.of("locked", true));
        var engine = engine();
        var run = run("""
            config:
              locked:
                type: boolean
                secret: true
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
                options:
                  protect: ${locked}
            """, engine, settings);

        assertEquals(List.of("the protect option must be known when the resource is registered"),
            errorSummaries(run.diagnostics()));
        assertTrue(engine.registrations().isEmpty());
        assertFalse(run.evaluation().completed());
    }

    @Test
    void readsExistingResourcesWithGet() {
        var engine = engine();
        var run = run("""
            resources:
              existing:
                type: test:index:Bucket
                get:
                  id: bucket-123
                  state:
                    name: old
            outputs:
              name: ${existing.name}
              id: ${existing.id}
            """, engine);

        assertNoErrors(run);
        assertTrue(engine.registrations().isEmpty());
        assertEquals(1, engine.reads().size());
        assertEquals("old", output(run, "name"));
        assertEquals("bucket-123", output(run, "id"));
    }

    @Test
    void reportsAccessErrorsOnUntypedValues() {
        var engine = InMemoryEngine.builder()
            .stackOutputs("acme/app/prod", Map.of("hosts", List.of("h1")))
            .build();
        var run = run("""
            variables:
              hosts:
                fn::stackReference: [acme/app/prod, hosts]
            outputs:
              first: ${hosts[0]}
              named: ${hosts.primary}
              far: ${hosts[3]}
            """, engine);

        assertEquals("h1", output(run, "first"));
        assertEquals(List.of(
            "cannot access a list element using a property name",
            "list index 3 out-of-bounds for list of length 1"
        ), errorSummaries(run.diagnostics()));
    }

    @Test
    void sharesTheRegisteredHandleWithLaterReferences() {
        var run = run("""
            resources:
              bucket:
                type: test:index:Bucket
                properties:
                  name: b
            outputs:
              handle: ${bucket}
            """);

        assertNoErrors(run);
        assertSame(run.evaluation().resources().get("bucket"), output(run, "handle"));
    }

    private static void assertNoErrors(ProgramRun run) {
        assertFalse(run.hasErrors(), () -> summaries(run.diagnostics()));
    }
}
