package com.example.redline.application;

import com.example.redline.domain.CitationType;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleFlightStatuteFetcherTest {

    private static final StatuteKey KEY = new StatuteKey(CitationType.USC, 26, "501");

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentRequestsForTheSameSectionShareOneFetch() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SingleFlightStatuteFetcher fetcher =
                new SingleFlightStatuteFetcher(
                        key -> {
                            calls.incrementAndGet();
                            await(release);
                            return statute("Section text");
                        },
                        executor);

        List<CompletableFuture<FetchedStatute>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(fetcher.fetch(KEY));
        }
        assertThat(fetcher.inFlightCount()).isEqualTo(1);
        release.countDown();

        for (CompletableFuture<FetchedStatute> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS).text()).isEqualTo("Section text");
        }
        assertThat(calls.get()).isEqualTo(1);
        assertThat(fetcher.inFlightCount()).isZero();
    }

    @Test
    void cancellingOneCallerDoesNotCancelTheSharedFetch() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        SingleFlightStatuteFetcher fetcher =
                new SingleFlightStatuteFetcher(
                        key -> {
                            await(release);
                            return statute("Shared");
                        },
                        executor);

        CompletableFuture<FetchedStatute> first = fetcher.fetch(KEY);
        CompletableFuture<FetchedStatute> second = fetcher.fetch(KEY);
        first.cancel(true);
        release.countDown();

        assertThat(second.get(5, TimeUnit.SECONDS).text()).isEqualTo("Shared");
        assertThat(first.isCancelled()).isTrue();
    }

    @Test
    void laterRequestAfterCompletionFetchesAgain() {
        AtomicInteger calls = new AtomicInteger();
        SingleFlightStatuteFetcher fetcher =
                new SingleFlightStatuteFetcher(
                        key -> statute("Fetch " + calls.incrementAndGet()), Runnable::run);

        assertThat(fetcher.fetch(KEY).join().text()).isEqualTo("Fetch 1");
        assertThat(fetcher.fetch(KEY).join().text()).isEqualTo("Fetch 2");
    }

    @Test
    void failuresReachEveryWaitingCaller() {
        SingleFlightStatuteFetcher fetcher =
                new SingleFlightStatuteFetcher(
                        key -> {
                            throw new StatuteFetchException(FetchFailureKind.NOT_FOUND, "Section not found: " + key);
                        },
                        Runnable::run);

        assertThatThrownBy(() -> fetcher.fetch(KEY).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(StatuteFetchException.class)
                .hasMessageContaining("Section not found: usc:26:501");
        assertThat(fetcher.inFlightCount()).isZero();
    }

    @Test
    void errorsThrownBySourceStillCompleteTheSharedFetch() {
        SingleFlightStatuteFetcher fetcher =
                new SingleFlightStatuteFetcher(
                        key -> {
                            throw new StackOverflowError("parser recursion");
                        },
                        Runnable::run);

        assertThatThrownBy(() -> fetcher.fetch(KEY).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(StackOverflowError.class);
        assertThat(fetcher.inFlightCount()).isZero();
    }

    @Test
    void rejectedExecutionBecomesATransportFailure() {
        SingleFlightStatuteFetcher fetcher =
                new SingleFlightStatuteFetcher(
                        key -> statute("unused"),
                        command -> {
                            throw new RejectedExecutionException("shut down");
                        });

        CompletableFuture<FetchedStatute> future = fetcher.fetch(KEY);

        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(
                        StatuteFetchException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(FetchFailureKind.TRANSPORT));
        assertThat(fetcher.inFlightCount()).isZero();
    }

    private static FetchedStatute statute(String text) {
        return new FetchedStatute("§501", text, "https://example.test/501", Instant.EPOCH);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
