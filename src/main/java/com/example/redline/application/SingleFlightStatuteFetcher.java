package com.example.redline.application;

import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs statute fetches on the fetch executor and coalesces concurrent requests for the same
 * {@link StatuteKey} onto one in-flight call. Callers receive their own dependent future, so
 * cancelling it never cancels the shared fetch.
 */
@Component
public class SingleFlightStatuteFetcher {
    private static final Logger log = LogManager.getLogger(SingleFlightStatuteFetcher.class);

    private final StatuteSource source;
    private final Executor executor;
    private final ConcurrentMap<StatuteKey, CompletableFuture<FetchedStatute>> inFlight =
            new ConcurrentHashMap<>();

    public SingleFlightStatuteFetcher(
            StatuteSource source, @Qualifier("statuteFetchExecutor") Executor executor) {
        this.source = source;
        this.executor = executor;
    }

    public CompletableFuture<FetchedStatute> fetch(StatuteKey key) {
        CompletableFuture<FetchedStatute> created = new CompletableFuture<>();
        CompletableFuture<FetchedStatute> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight fetch of {}", key);
            return existing.copy();
        }
        try {
            executor.execute(() -> run(key, created));
        } catch (RejectedExecutionException ex) {
            inFlight.remove(key, created);
            created.completeExceptionally(
                    new StatuteFetchException(
                            FetchFailureKind.TRANSPORT, "Fetch executor rejected " + key, ex));
        }
        return created.copy();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void run(StatuteKey key, CompletableFuture<FetchedStatute> shared) {
        try {
            FetchedStatute fetched = source.fetch(key);
            inFlight.remove(key, shared);
            shared.complete(fetched);
        } catch (RuntimeException ex) {
            inFlight.remove(key, shared);
            shared.completeExceptionally(ex);
        } catch (Throwable ex) {
            log.error("Fetch of {} aborted", key, ex);
            inFlight.remove(key, shared);
            shared.completeExceptionally(ex);
        }
    }
}
