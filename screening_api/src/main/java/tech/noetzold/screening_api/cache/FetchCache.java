package tech.noetzold.screening_api.cache;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.ScreeningWindow;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Per-session single-flight cache of provider payloads keyed by provider, subject and window.
 *
 * <p>The first caller for a key installs a promise and runs the fetch; later callers get the same
 * promise, so concurrent probes sharing a provider trigger one call. No lock is held while the
 * fetch runs. Failures are stored as {@link ProviderPayload#failure} sentinels and never retried
 * within the session.
 */
@Slf4j
public class FetchCache {

    private final ConcurrentMap<FetchKey, CompletableFuture<ProviderPayload>> entries = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public ProviderPayload getOrFetch(String providerId, String subjectId, ScreeningWindow window,
                                      Supplier<ProviderPayload> fetchFn) {
        return getOrFetchAsync(providerId, subjectId, window,
                () -> CompletableFuture.completedFuture(fetchFn.get())).join();
    }

    /**
     * Async variant. The returned future never completes exceptionally. Cancelling it leaves the
     * cached fetch running, so later callers in the session still get its result.
     */
    public CompletableFuture<ProviderPayload> getOrFetchAsync(String providerId, String subjectId, ScreeningWindow window,
                                                              Supplier<CompletableFuture<ProviderPayload>> fetchFn) {
        FetchKey key = FetchKey.of(providerId, subjectId, window);
        CompletableFuture<ProviderPayload> promise = new CompletableFuture<>();
        CompletableFuture<ProviderPayload> existing = entries.putIfAbsent(key, promise);
        if (existing != null) {
            hits.incrementAndGet();
            return existing.thenApply(payload -> payload);
        }

        misses.incrementAndGet();
        CompletableFuture<ProviderPayload> fetch;
        try {
            fetch = fetchFn.get();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.completedFuture(ProviderPayload.failure(providerId, "no response"));
        }
        fetch.handle((payload, error) -> error == null
                        ? payload
                        : ProviderPayload.failure(providerId, describe(error)))
                .thenAccept(promise::complete);
        return promise.thenApply(payload -> payload);
    }

    public int hits() {
        return hits.get();
    }

    public int misses() {
        return misses.get();
    }

    public int size() {
        return entries.size();
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
