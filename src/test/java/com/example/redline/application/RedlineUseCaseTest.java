package com.example.redline.application;

import com.example.redline.application.detect.CitationDetector;
import com.example.redline.application.detect.InstructionContextExtractor;
import com.example.redline.application.mutate.StructureLocator;
import com.example.redline.application.mutate.TextMutator;
import com.example.redline.application.parse.AmendmentOperationParser;
import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.AnalysisRequest;
import com.example.redline.domain.CitationProgress;
import com.example.redline.domain.CitationType;
import com.example.redline.domain.ComparisonResult;
import com.example.redline.domain.DocumentAnalysis;
import com.example.redline.domain.FetchFailureKind;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.PipelineState;
import com.example.redline.domain.StatuteKey;
import com.example.redline.domain.StepTiming;
import com.example.redline.infrastructure.HtmlRedlineRenderer;
import com.example.redline.infrastructure.WordEditScriptGenerator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RedlineUseCaseTest {

    private static final String STATUTE =
            "(a) In general.--The amount shall be $1,000 for fiscal year 2023.\n"
                    + "(b) Limitation.--\n"
                    + "    (1) In general.--No payment shall be made after fiscal year 2023.\n"
                    + "    (2) Exception.--Paragraph (1) shall not apply.\n"
                    + "    (3) Reports.--The Secretary shall report annually.\n"
                    + "(c) Definitions.--For purposes of this section, the term \"State\" includes the District of Columbia.\n";

    private static final String BILL =
            "SEC. 2. AMENDMENTS.\n"
                    + "Section 501(b) of title 26, United States Code, is amended—\n"
                    + "(1) in paragraph (1), by striking \"2023\" and inserting \"2024\"; and\n"
                    + "(2) by adding at the end the following:\n"
                    + "\"(4) Sunset.--This subsection expires in 2030.\".\n"
                    + "SEC. 3. DEFINITIONS.\n"
                    + "The term \"organization\" has the meaning given such term in section 7701 of title 26, "
                    + "United States Code.\n";

    private static final StatuteKey SECTION_501 = new StatuteKey(CitationType.USC, 26, "501");

    private final Map<StatuteKey, AtomicInteger> calls = new ConcurrentHashMap<>();

    @Test
    void redlinesEachAmendedSectionAndSkipsDefinitions() {
        RedlineUseCase useCase = useCase(this::fetchSample, Runnable::run);

        DocumentAnalysis analysis = useCase.analyze(new AnalysisRequest("doc-1", "Bill", BILL));

        assertThat(analysis.complete()).isTrue();
        assertThat(analysis.withdrawn()).isFalse();
        assertThat(analysis.citations())
                .extracting(CitationProgress::state)
                .containsExactly(PipelineState.DIFFED, PipelineState.DEFINITIONAL_SKIPPED);
        assertThat(analysis.results()).hasSize(1);

        ComparisonResult result = analysis.results().get(0);
        assertThat(result.citationId()).isEqualTo("c-1");
        assertThat(result.citationText()).isEqualTo("26 U.S.C. § 501(b)");
        assertThat(result.amendmentKind()).isEqualTo(AmendmentKind.STRIKE_INSERT);
        assertThat(result.chainedKinds()).containsExactly(AmendmentKind.ADD_AT_END);
        assertThat(result.resolved()).isTrue();
        assertThat(result.hasChanges()).isTrue();
        assertThat(result.originalText()).isEqualTo(STATUTE);
        assertThat(result.amendedText())
                .startsWith("(a) In general.--The amount shall be $1,000 for fiscal year 2023.")
                .contains("made after fiscal year 2024.")
                .contains("annually.\n    (4) Sunset.--This subsection expires in 2030.\n(c)");
        assertThat(result.diffHtml())
                .contains("<del class=\"redline-deleted\">2023</del><ins class=\"redline-inserted\">2024</ins>")
                .contains("Sunset");
        assertThat(result.deletedWords()).isEqualTo(1);

        assertThat(calls).containsOnlyKeys(SECTION_501);
        assertThat(analysis.timing().getSteps())
                .extracting(StepTiming::getLabel)
                .containsExactly("Detect citations", "Fetch and redline");
    }

    @Test
    void fetchFailureIsConfinedToItsCitation() {
        String bill =
                "Section 501(b)(3) of title 26, United States Code, is amended by striking \"annually\" and "
                        + "inserting \"biennially\".\n"
                        + "SEC. 3. REGULATIONS.\n"
                        + "42 CFR 482.12 is amended by striking \"hospital\" and inserting \"facility\".\n";
        RedlineUseCase useCase = useCase(this::fetchSample, Runnable::run);

        DocumentAnalysis analysis = useCase.analyze(new AnalysisRequest("doc-2", "Mixed", bill));

        assertThat(analysis.citations())
                .extracting(CitationProgress::state)
                .containsExactly(PipelineState.DIFFED, PipelineState.FETCH_FAILED);
        CitationProgress failed = analysis.citations().get(1);
        assertThat(failed.citation().fetchFailure().kind()).isEqualTo(FetchFailureKind.NOT_FOUND);
        assertThat(failed.result()).isNull();
        assertThat(analysis.results().get(0).amendedText()).contains("report biennially.");
    }

    @Test
    void unresolvedOperationStillProducesAnUnchangedResult() {
        String bill =
                "Section 501(b) of title 26, United States Code, is amended by striking \"no such text\" and "
                        + "inserting \"other text\".";
        RedlineUseCase useCase = useCase(this::fetchSample, Runnable::run);

        ComparisonResult result = useCase.analyze(new AnalysisRequest("doc-3", "Miss", bill)).results().get(0);

        assertThat(result.resolved()).isFalse();
        assertThat(result.hasChanges()).isFalse();
        assertThat(result.amendedText()).isEqualTo(result.originalText());
        assertThat(result.diffHtml()).contains("No changes detected");
    }

    @Test
    void documentWithoutCitationsCompletesEmpty() {
        RedlineUseCase useCase = useCase(this::fetchSample, Runnable::run);

        DocumentAnalysis analysis = useCase.analyze(new AnalysisRequest("doc-4", "Empty", "Nothing to amend."));

        assertThat(analysis.complete()).isTrue();
        assertThat(analysis.citations()).isEmpty();
        assertThat(useCase.snapshot("doc-4")).isEmpty();
    }

    @Test
    void withdrawnRunIgnoresLateFetchResults() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        RedlineUseCase useCase =
                useCase(
                        key -> {
                            try {
                                release.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException ex) {
                                Thread.currentThread().interrupt();
                            }
                            return fetchSample(key);
                        },
                        executor);

        DocumentRun run = useCase.start(new AnalysisRequest("doc-5", "Slow", BILL));
        assertThat(useCase.snapshot("doc-5")).isPresent();
        assertThat(useCase.withdraw("doc-5")).isTrue();
        release.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        DocumentAnalysis analysis = run.completion().get(5, TimeUnit.SECONDS);
        assertThat(analysis.withdrawn()).isTrue();
        assertThat(analysis.complete()).isFalse();
        assertThat(run.snapshot().citations().get(0).state()).isEqualTo(PipelineState.FETCHING);
        assertThat(useCase.snapshot("doc-5")).isEmpty();
        assertThat(useCase.withdraw("doc-5")).isFalse();
    }

    @Test
    void finishedRunStaysPollableUntilWithdrawn() throws Exception {
        RedlineUseCase useCase = useCase(this::fetchSample, Runnable::run);

        DocumentRun run = useCase.start(new AnalysisRequest("doc-6", "Async", BILL));
        run.completion().get(5, TimeUnit.SECONDS);

        DocumentAnalysis polled = useCase.snapshot("doc-6").orElseThrow();
        assertThat(polled.complete()).isTrue();
        assertThat(polled.results()).hasSize(1);
        assertThat(polled.results().get(0).hasChanges()).isTrue();

        assertThat(useCase.withdraw("doc-6")).isTrue();
        assertThat(useCase.snapshot("doc-6")).isEmpty();
    }

    @Test
    void oldestFinishedRunIsEvictedBeyondTheRetainedCount() throws Exception {
        RedlineUseCase useCase = useCase(this::fetchSample, Runnable::run, 1);

        useCase.start(new AnalysisRequest("doc-7", "First", BILL)).completion().get(5, TimeUnit.SECONDS);
        useCase.start(new AnalysisRequest("doc-8", "Second", BILL)).completion().get(5, TimeUnit.SECONDS);

        assertThat(useCase.snapshot("doc-7")).isEmpty();
        assertThat(useCase.snapshot("doc-8")).isPresent();
    }

    private FetchedStatute fetchSample(StatuteKey key) {
        calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        if (!key.equals(SECTION_501)) {
            throw new StatuteFetchException(FetchFailureKind.NOT_FOUND, "Section not found: " + key);
        }
        return new FetchedStatute("§501. Exemption", STATUTE, "https://example.test/501", Instant.EPOCH);
    }

    private static RedlineUseCase useCase(StatuteSource source, Executor executor) {
        return useCase(source, executor, 100);
    }

    private static RedlineUseCase useCase(StatuteSource source, Executor executor, int retainedRuns) {
        InstructionNormalizer normalizer = new InstructionNormalizer();
        StructureLocator locator = new StructureLocator();
        return new RedlineUseCase(
                new CitationDetector(8),
                new InstructionContextExtractor(4000),
                new AmendmentOperationParser(normalizer, locator),
                normalizer,
                new TextMutator(locator),
                new WordEditScriptGenerator(),
                new HtmlRedlineRenderer(8),
                new SingleFlightStatuteFetcher(source, executor),
                retainedRuns);
    }
}
