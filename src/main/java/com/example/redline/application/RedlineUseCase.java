package com.example.redline.application;

import com.example.redline.application.detect.CitationDetector;
import com.example.redline.application.detect.InstructionContextExtractor;
import com.example.redline.application.mutate.MutationOutcome;
import com.example.redline.application.mutate.TextMutator;
import com.example.redline.application.parse.AmendmentOperationParser;
import com.example.redline.domain.AmendmentOperation;
import com.example.redline.domain.AnalysisRequest;
import com.example.redline.domain.Citation;
import com.example.redline.domain.CitationProgress;
import com.example.redline.domain.ComparisonResult;
import com.example.redline.domain.DocumentAnalysis;
import com.example.redline.domain.EditOperation;
import com.example.redline.domain.EditScript;
import com.example.redline.domain.FetchFailure;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StepTiming;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;

/**
 * Drives each detected citation through fetch, parse, mutate and diff. Fetches run concurrently;
 * one citation's failure never affects its siblings.
 */
@Service
public class RedlineUseCase {
    private static final Logger log = LogManager.getLogger(RedlineUseCase.class);

    private final CitationDetector citationDetector;
    private final InstructionContextExtractor contextExtractor;
    private final AmendmentOperationParser operationParser;
    private final InstructionNormalizer normalizer;
    private final TextMutator textMutator;
    private final EditScriptGenerator editScriptGenerator;
    private final RedlineRenderer redlineRenderer;
    private final SingleFlightStatuteFetcher statuteFetcher;
    private final int retainedRuns;
    private final ConcurrentMap<String, DocumentRun> runs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<DocumentRun> finishedRuns = new ConcurrentLinkedDeque<>();

    public RedlineUseCase(
            CitationDetector citationDetector,
            InstructionContextExtractor contextExtractor,
            AmendmentOperationParser operationParser,
            InstructionNormalizer normalizer,
            TextMutator textMutator,
            EditScriptGenerator editScriptGenerator,
            RedlineRenderer redlineRenderer,
            SingleFlightStatuteFetcher statuteFetcher,
            @Value("${redline.runs.retained:100}") int retainedRuns) {
        this.citationDetector = citationDetector;
        this.contextExtractor = contextExtractor;
        this.operationParser = operationParser;
        this.normalizer = normalizer;
        this.textMutator = textMutator;
        this.editScriptGenerator = editScriptGenerator;
        this.redlineRenderer = redlineRenderer;
        this.statuteFetcher = statuteFetcher;
        this.retainedRuns = Math.max(1, retainedRuns);
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(DocumentRun run, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        run.recordStep(new StepTiming(label, seconds));
        return seconds;
    }

    /** Runs the whole document and waits for every citation to settle. */
    public DocumentAnalysis analyze(AnalysisRequest request) {
        return launch(request, false).completion().join();
    }

    /**
     * Detects citations synchronously and starts their fetches. The returned run can be polled
     * with {@link #snapshot(String)} or withdrawn with {@link #withdraw(String)}. Once finished it
     * stays pollable until withdrawn or until {@code redline.runs.retained} newer runs have finished.
     */
    public DocumentRun start(AnalysisRequest request) {
        return launch(request, true);
    }

    private DocumentRun launch(AnalysisRequest request, boolean retain) {
        long overallStart = System.nanoTime();
        String text = request.text();
        List<Citation> citations = citationDetector.detect(text);
        List<String> contexts = new ArrayList<>(citations.size());
        List<CitationProgress> detected = new ArrayList<>(citations.size());
        for (int i = 0; i < citations.size(); i++) {
            contexts.add(contextExtractor.extract(text, citations, i));
            detected.add(CitationProgress.detected(citations.get(i)));
        }

        DocumentRun run = new DocumentRun(request.documentId(), request.name(), detected, overallStart);
        DocumentRun previous = runs.put(request.documentId(), run);
        if (previous != null) {
            log.info("Replacing earlier run of document {}", request.documentId());
            finishedRuns.remove(previous);
            previous.withdraw();
        }
        double detectionSeconds = recordStep(run, "Detect citations", overallStart);
        log.info(
                "Detected {} citation(s) in document {} in {} s",
                citations.size(),
                request.documentId(),
                String.format("%.3f", detectionSeconds));

        long fetchStart = System.nanoTime();
        List<CompletableFuture<Void>> settled = new ArrayList<>();
        for (int i = 0; i < citations.size(); i++) {
            int index = i;
            Citation citation = citations.get(i);
            if (citation.definitional()) {
                run.update(index, CitationProgress::definitionalSkipped);
                continue;
            }
            run.update(index, CitationProgress::fetching);
            CompletableFuture<FetchedStatute> fetch = statuteFetcher.fetch(citation.statuteKey());
            run.track(fetch);
            settled.add(
                    fetch.handle(
                            (statute, error) -> {
                                settle(run, index, contexts.get(index), statute, error);
                                return null;
                            }));
        }

        CompletableFuture.allOf(settled.toArray(new CompletableFuture[0]))
                .whenComplete(
                        (ignored, error) -> {
                            recordStep(run, "Fetch and redline", fetchStart);
                            double total = nanosToSeconds(System.nanoTime() - run.startNanos());
                            log.info(
                                    "Document {} finished in {} s",
                                    run.documentId(),
                                    String.format("%.3f", total));
                            if (retain) {
                                retainFinished(run);
                            } else {
                                runs.remove(run.documentId(), run);
                            }
                            run.finish(total);
                        });
        return run;
    }

    public Optional<DocumentAnalysis> snapshot(String documentId) {
        return Optional.ofNullable(runs.get(documentId)).map(DocumentRun::snapshot);
    }

    /**
     * Detaches a document's run. Fetches already in flight keep going for other documents that
     * share them, but their results are no longer applied here.
     */
    public boolean withdraw(String documentId) {
        DocumentRun run = runs.remove(documentId);
        if (run == null) {
            return false;
        }
        finishedRuns.remove(run);
        log.info("Withdrawing run of document {}", documentId);
        run.withdraw();
        return true;
    }

    private void retainFinished(DocumentRun run) {
        if (run.withdrawn()) {
            return;
        }
        finishedRuns.addLast(run);
        while (finishedRuns.size() > retainedRuns) {
            DocumentRun oldest = finishedRuns.pollFirst();
            if (oldest != null && runs.remove(oldest.documentId(), oldest)) {
                log.debug("Evicted finished run of document {}", oldest.documentId());
            }
        }
    }

    private void settle(DocumentRun run, int index, String context, FetchedStatute statute, Throwable error) {
        if (run.withdrawn()) {
            log.debug("Discarding fetch result for withdrawn document {}", run.documentId());
            return;
        }
        if (error != null) {
            FetchFailure failure = failureOf(error);
            log.warn(
                    "Fetch failed for {} ({}): {}",
                    run.progress(index).citation().canonical(),
                    failure.kind(),
                    failure.message());
            run.update(index, progress -> progress.fetchFailed(failure));
            return;
        }
        if (!run.update(index, progress -> progress.fetched(statute))) {
            return;
        }
        CitationProgress fetched = run.progress(index);
        try {
            redline(run, index, fetched, context);
        } catch (RuntimeException ex) {
            log.error("Redlining failed for {}", fetched.citation().canonical(), ex);
            AmendmentOperation unknown =
                    AmendmentOperation.unknown(context, fetched.citation().address().path());
            String original = normalizer.normalize(statute.text());
            CitationProgress parsed = fetched.parsed(unknown);
            ComparisonResult unchanged =
                    compare(parsed.citation(), unknown, original, MutationOutcome.unresolved(original));
            run.update(index, progress -> parsed.mutated().diffed(unchanged));
        }
    }

    private void redline(DocumentRun run, int index, CitationProgress fetched, String context) {
        Citation citation = fetched.citation();
        String original = normalizer.normalize(citation.statute().text());
        AmendmentOperation operation =
                operationParser
                        .parse(citation, context, original)
                        .orElseGet(() -> AmendmentOperation.unknown(context, citation.address().path()));
        CitationProgress parsed = fetched.parsed(operation);
        run.update(index, progress -> parsed);

        MutationOutcome outcome = textMutator.apply(original, operation);
        if (!outcome.resolved()) {
            log.info("Unresolved {} for {}", operation.kind().code(), citation.canonical());
        }
        CitationProgress mutated = parsed.mutated();
        run.update(index, progress -> mutated);

        CitationProgress diffed = mutated.diffed(compare(citation, operation, original, outcome));
        run.update(index, progress -> diffed);
    }

    private ComparisonResult compare(
            Citation citation, AmendmentOperation operation, String original, MutationOutcome outcome) {
        EditScript script = editScriptGenerator.diff(original, outcome.amendedText());
        RedlineRenderer.Redline redline = redlineRenderer.render(script, operation.kind());
        return new ComparisonResult(
                citation.id(),
                citation.canonical(),
                operation.kind(),
                operation.chainedKinds(),
                outcome.resolved(),
                original,
                outcome.amendedText(),
                redline.inline(),
                redline.originalSide(),
                redline.amendedSide(),
                redline.condensed(),
                script.wordCount(EditOperation.DELETED),
                script.wordCount(EditOperation.INSERTED),
                outcome.resolved() && script.hasChanges());
    }

    private static FetchFailure failureOf(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof StatuteFetchException) {
            return ((StatuteFetchException) cause).toFailure();
        }
        return new FetchFailure(
                FetchFailureKind.TRANSPORT, cause.getMessage() != null ? cause.getMessage() : cause.toString());
    }
}
