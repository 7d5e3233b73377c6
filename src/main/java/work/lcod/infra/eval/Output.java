package work.lcod.infra.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * A value that becomes known later. Completion is driven by whoever produced the output, usually
 * the engine; composition only registers continuations and never blocks.
 *
 * <p>A resolved output may still be unknown (during a preview) or secret. Unknown values skip every
 * continuation; secrecy sticks to everything derived from the value.
 */
public final class Output {
    public record Resolution(Object value, boolean known, boolean secret) {}

    private final CompletableFuture<Resolution> future;

    private Output(CompletableFuture<Resolution> future) {
        this.future = future;
    }

    public static Output of(Object value) {
        if (value instanceof Output output) {
            return output;
        }
        return new Output(CompletableFuture.completedFuture(new Resolution(value, true, false)));
    }

    public static Output unknown() {
        return new Output(CompletableFuture.completedFuture(new Resolution(null, false, false)));
    }

    public static Output secret(Object value) {
        return of(value).asSecret();
    }

    public static Output failed(Throwable error) {
        return new Output(CompletableFuture.failedFuture(error));
    }

    public static Output fromFuture(CompletableFuture<?> value) {
        return new Output(value.thenCompose(v -> v instanceof Output o
            ? o.future
            : CompletableFuture.completedFuture(new Resolution(v, true, false))));
    }

    public static Completer pending() {
        return new Completer(new CompletableFuture<>());
    }

    /**
     * Waits for every operand, concrete values included, and yields the list of their values.
     * The result is unknown if any operand is unknown and secret if any is secret.
     */
    public static Output all(List<?> operands) {
        var futures = new ArrayList<CompletableFuture<Resolution>>();
        for (var operand : operands) {
            futures.add(of(operand).future);
        }
        var combined = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            var values = new ArrayList<Object>(futures.size());
            boolean known = true;
            boolean secret = false;
            for (var f : futures) {
                var resolution = f.join();
                known &= resolution.known();
                secret |= resolution.secret();
                values.add(resolution.value());
            }
            return new Resolution(known ? values : null, known, secret);
        });
        return new Output(combined);
    }

    /**
     * Runs {@code fn} once this output is known. A returned output is flattened into the result.
     */
    public Output apply(Function<Object, Object> fn) {
        return new Output(future.thenCompose(resolution -> {
            if (!resolution.known()) {
                return CompletableFuture.completedFuture(resolution);
            }
            var result = fn.apply(resolution.value());
            if (result instanceof Output inner) {
                return inner.future.thenApply(r -> new Resolution(r.value(), r.known(), r.secret() || resolution.secret()));
            }
            return CompletableFuture.completedFuture(new Resolution(result, true, resolution.secret()));
        }));
    }

    public Output asSecret() {
        return new Output(future.thenApply(r -> r.secret() ? r : new Resolution(r.value(), r.known(), true)));
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Blocks until the output resolves. Only callers outside the evaluation, such as the runner
     * collecting stack outputs, should wait.
     */
    public Resolution await() throws ExecutionException, InterruptedException {
        return future.get();
    }

    public CompletableFuture<Resolution> toFuture() {
        return future;
    }

    public static Throwable rootCause(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        if (!future.isDone()) {
            return "Output(pending)";
        }
        if (future.isCompletedExceptionally()) {
            return "Output(failed)";
        }
        var r = future.join();
        if (!r.known()) {
            return "Output(unknown)";
        }
        return r.secret() ? "Output([secret])" : "Output(" + r.value() + ")";
    }

    public static final class Completer {
        private final CompletableFuture<Resolution> future;
        private final Output output;

        private Completer(CompletableFuture<Resolution> future) {
            this.future = future;
            this.output = new Output(future);
        }

        public Output output() {
            return output;
        }

        public void complete(Object value) {
            if (value instanceof Output inner) {
                inner.future.whenComplete((r, error) -> {
                    if (error != null) {
                        future.completeExceptionally(error);
                    } else {
                        future.complete(r);
                    }
                });
                return;
            }
            future.complete(new Resolution(value, true, false));
        }

        public void completeUnknown() {
            future.complete(new Resolution(null, false, false));
        }

        public void fail(Throwable error) {
            future.completeExceptionally(error);
        }
    }
}
