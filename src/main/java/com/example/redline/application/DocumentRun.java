package com.example.redline.application;

import com.example.redline.domain.AnalysisTiming;
import com.example.redline.domain.CitationProgress;
import com.example.redline.domain.DocumentAnalysis;
import com.example.redline.domain.StepTiming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.UnaryOperator;

/**
 * One document's pass through the pipeline. Each citation slot holds the latest immutable
 * {@link CitationProgress}; once the run is withdrawn no slot changes again.
 */
public class DocumentRun {
    private final String documentId;
    private final String name;
    private final AtomicReferenceArray<CitationProgress> citations;
    private final List<StepTiming> timings = Collections.synchronizedList(new ArrayList<>());
    private final CompletableFuture<DocumentAnalysis> completion = new CompletableFuture<>();
    private final List<CompletableFuture<?>> pending = Collections.synchronizedList(new ArrayList<>());
    private final long startNanos;
    private volatile boolean withdrawn;
    private volatile double totalDurationSeconds;

    DocumentRun(String documentId, String name, List<CitationProgress> detected, long startNanos) {
        this.documentId = documentId;
        this.name = name;
        this.citations = new AtomicReferenceArray<>(detected.toArray(new CitationProgress[0]));
        this.startNanos = startNanos;
    }

    public String documentId() {
        return documentId;
    }

    public boolean withdrawn() {
        return withdrawn;
    }

    /** Completes with the final analysis once every citation has reached a terminal state. */
    public CompletableFuture<DocumentAnalysis> completion() {
        return completion.copy();
    }

    public DocumentAnalysis snapshot() {
        return snapshot(completion.isDone() && !withdrawn);
    }

    private DocumentAnalysis snapshot(boolean complete) {
        List<CitationProgress> current = new ArrayList<>(citations.length());
        for (int i = 0; i < citations.length(); i++) {
            current.add(citations.get(i));
        }
        List<StepTiming> steps;
        synchronized (timings) {
            steps = new ArrayList<>(timings);
        }
        return DocumentAnalysis.of(
                documentId,
                name,
                current,
                complete,
                withdrawn,
                new AnalysisTiming(steps, totalDurationSeconds));
    }

    CitationProgress progress(int index) {
        return citations.get(index);
    }

    int size() {
        return citations.length();
    }

    /** Applies {@code transition} to the slot unless the run has been withdrawn. */
    synchronized boolean update(int index, UnaryOperator<CitationProgress> transition) {
        if (withdrawn) {
            return false;
        }
        citations.updateAndGet(index, transition);
        return true;
    }

    void track(CompletableFuture<?> future) {
        pending.add(future);
    }

    void recordStep(StepTiming step) {
        timings.add(step);
    }

    long startNanos() {
        return startNanos;
    }

    void finish(double totalSeconds) {
        totalDurationSeconds = totalSeconds;
        completion.complete(snapshot(!withdrawn));
    }

    void withdraw() {
        synchronized (this) {
            withdrawn = true;
        }
        List<CompletableFuture<?>> inFlight;
        synchronized (pending) {
            inFlight = new ArrayList<>(pending);
        }
        inFlight.forEach(future -> future.cancel(false));
        completion.complete(snapshot(false));
    }
}
