package work.lcod.infra.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.eval.Output;
import work.lcod.infra.syntax.Severity;

/**
 * Engine that keeps all state in memory. Registered resources echo their inputs as outputs and
 * get deterministic urns and ids, which makes runs reproducible in tests and dry runs.
 *
 * <p>With {@code deferCompletion}, outputs stay pending until {@link #completePending()} is called,
 * so callers can observe how evaluation behaves while remote state is still unknown.
 */
public final class InMemoryEngine implements Engine {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEngine.class);

    private final String project;
    private final String stack;
    private final InvokeRegistry invokes;
    private final boolean preview;
    private final boolean deferCompletion;
    private final Map<String, Map<String, Object>> stackOutputs;

    private final List<ResourceRegistration> registrations = Collections.synchronizedList(new ArrayList<>());
    private final List<ResourceRegistration> reads = Collections.synchronizedList(new ArrayList<>());
    private final List<Invocation> invocations = Collections.synchronizedList(new ArrayList<>());
    private final List<String> stackLookups = Collections.synchronizedList(new ArrayList<>());
    private final List<LogEntry> logs = Collections.synchronizedList(new ArrayList<>());
    private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();

    private InMemoryEngine(Builder builder) {
        this.project = builder.project;
        this.stack = builder.stack;
        this.invokes = builder.invokes;
        this.preview = builder.preview;
        this.deferCompletion = builder.deferCompletion;
        this.stackOutputs = Map.copyOf(builder.stackOutputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String urnOf(String token, String name) {
        return "urn:pulumi:" + stack + "::" + project + "::" + token + "::" + name;
    }

    @Override
    public RemoteResource registerResource(ResourceRegistration registration) {
        registrations.add(registration);
        log.info("Registering {} resource {} ({})", registration.kind().name().toLowerCase(), registration.name(), registration.token());
        var id = registration.kind() == ResourceKind.COMPONENT ? null : registration.name() + "-id";
        return settle(registration, id, false);
    }

    @Override
    public RemoteResource readResource(ResourceRegistration registration, Object id) {
        reads.add(registration);
        log.info("Reading resource {} ({}) with id {}", registration.name(), registration.token(), id);
        return settle(registration, id, true);
    }

    private RemoteResource settle(ResourceRegistration registration, Object id, boolean read) {
        var state = Output.pending();
        var names = new ArrayList<>(registration.properties().keySet());
        Runnable complete = () -> state.complete(Output.all(new ArrayList<>(registration.properties().values())).apply(values -> {
            var outputs = new LinkedHashMap<String, Object>();
            var list = (List<?>) values;
            for (int i = 0; i < names.size(); i++) {
                outputs.put(names.get(i), list.get(i));
            }
            if (read && id != null) {
                outputs.put("id", id);
            }
            return outputs;
        }));
        schedule(complete);
        return new Resource(registration, urnOf(registration.token(), registration.name()), id, read, state.output());
    }

    @Override
    public Output invoke(String token, Map<String, Object> args, InvokeOptions options) {
        invocations.add(new Invocation(token, args));
        log.debug("Invoking {}", token);
        var entry = invokes.get(token);
        if (entry == null) {
            return Output.failed(new IllegalArgumentException("unknown function " + token));
        }
        var result = Output.pending();
        schedule(() -> {
            try {
                result.complete(entry.handler().invoke(args));
            } catch (Exception ex) {
                result.fail(ex);
            }
        });
        return result.output();
    }

    @Override
    public StackReference stackReference(String stackName) {
        stackLookups.add(stackName);
        log.debug("Reading outputs of stack {}", stackName);
        var outputs = stackOutputs.get(stackName);
        return new StackReference() {
            @Override
            public String stackName() {
                return stackName;
            }

            @Override
            public Output output(String name) {
                if (outputs == null) {
                    return Output.failed(new IllegalArgumentException("unknown stack " + stackName));
                }
                return Output.of(outputs.get(name));
            }
        };
    }

    @Override
    public void log(Severity severity, String message) {
        logs.add(new LogEntry(severity, message));
        if (severity == Severity.ERROR) {
            log.error(message);
        } else {
            log.warn(message);
        }
    }

    @Override
    public boolean isPreview() {
        return preview;
    }

    public int completePending() {
        int count = 0;
        Runnable next;
        while ((next = pending.poll()) != null) {
            next.run();
            count++;
        }
        return count;
    }

    private void schedule(Runnable completion) {
        if (deferCompletion) {
            pending.add(completion);
        } else {
            completion.run();
        }
    }

    public List<ResourceRegistration> registrations() {
        synchronized (registrations) {
            return List.copyOf(registrations);
        }
    }

    public List<ResourceRegistration> reads() {
        synchronized (reads) {
            return List.copyOf(reads);
        }
    }

    public List<Invocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    public List<String> stackLookups() {
        synchronized (stackLookups) {
            return List.copyOf(stackLookups);
        }
    }

    public List<LogEntry> logs() {
        synchronized (logs) {
            return List.copyOf(logs);
        }
    }

    public record Invocation(String token, Map<String, Object> args) {}

    public record LogEntry(Severity severity, String message) {}

    private final class Resource implements RemoteResource {
        private final ResourceRegistration registration;
        private final String urn;
        private final Object id;
        private final boolean read;
        private final Output state;

        private Resource(ResourceRegistration registration, String urn, Object id, boolean read, Output state) {
            this.registration = registration;
            this.urn = urn;
            this.id = id;
            this.read = read;
            this.state = state;
        }

        @Override
        public String name() {
            return registration.name();
        }

        @Override
        public String token() {
            return registration.token();
        }

        @Override
        public ResourceKind kind() {
            return registration.kind();
        }

        @Override
        public String urn() {
            return urn;
        }

        @Override
        public Output id() {
            if (id == null) {
                return Output.of(null);
            }
            if (preview && !read) {
                return Output.unknown();
            }
            return state.apply(ignored -> id);
        }

        @Override
        public Output output(String key) {
            return state.apply(outputs -> {
                var map = (Map<?, ?>) outputs;
                if (!map.containsKey(key) && preview) {
                    return Output.unknown();
                }
                return map.get(key);
            });
        }

        @Override
        public Output outputs() {
            return state;
        }

        @Override
        public String toString() {
            return urn;
        }
    }

    public static final class Builder {
        private String project = "project";
        private String stack = "dev";
        private InvokeRegistry invokes = new InvokeRegistry();
        private boolean preview;
        private boolean deferCompletion;
        private final Map<String, Map<String, Object>> stackOutputs = new HashMap<>();

        public Builder project(String value) {
            this.project = value;
            return this;
        }

        public Builder stack(String value) {
            this.stack = value;
            return this;
        }

        public Builder invokes(InvokeRegistry value) {
            this.invokes = value;
            return this;
        }

        public Builder preview(boolean value) {
            this.preview = value;
            return this;
        }

        public Builder deferCompletion(boolean value) {
            this.deferCompletion = value;
            return this;
        }

        public Builder stackOutputs(String stackName, Map<String, Object> outputs) {
            this.stackOutputs.put(stackName, Map.copyOf(outputs));
            return this;
        }

        public InMemoryEngine build() {
            return new InMemoryEngine(this);
        }
    }
}
