package work.lcod.infra.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.infra.syntax.Diagnostic;

public record RunResult(
    Status status,
    Map<String, Object> outputs,
    List<Diagnostic> diagnostics,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        diagnostics = List.copyOf(diagnostics);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> outputs, List<Diagnostic> diagnostics,
                                    Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, outputs, diagnostics, metadata, startedAt, Instant.now());
    }

    public static RunResult planned(Map<String, Object> outputs, List<Diagnostic> diagnostics,
                                    Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.PLANNED, outputs, diagnostics, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, List<Diagnostic> diagnostics,
                                    Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (message != null && !message.isBlank()) {
            meta.putIfAbsent("error", message);
        }
        return new RunResult(Status.FAILURE, Map.of(), diagnostics, meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status != Status.FAILURE;
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public RunResult withSerializedPayload(String payload) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("payload", payload);
        return new RunResult(status, outputs, diagnostics, meta, startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("outputs", outputs);
        serializable.put("diagnostics", diagnostics.stream().map(Diagnostic::toSerializableMap).toList());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        PLANNED(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
