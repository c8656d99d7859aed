package com.example.redline.application;

import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.AmendmentOperation;
import com.example.redline.domain.AnalysisTiming;
import com.example.redline.domain.Citation;
import com.example.redline.domain.CitationProgress;
import com.example.redline.domain.CitationType;
import com.example.redline.domain.ComparisonResult;
import com.example.redline.domain.DocumentAnalysis;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.PipelineState;
import com.example.redline.domain.StepTiming;
import com.example.redline.domain.StructuralAddress;
import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;
import com.example.redline.infrastructure.persistence.StoredAnalysis;
import com.example.redline.infrastructure.persistence.StoredAnalysisRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisPersistenceServiceTest {

    @Mock private StoredAnalysisRepository repository;

    private AnalysisPersistenceService service;

    @BeforeEach
    void setUp() {
        service = new AnalysisPersistenceService(repository, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void savedAnalysisCanBeLoadedBack() {
        when(repository.save(any(StoredAnalysis.class)))
                .thenAnswer(
                        invocation -> {
                            StoredAnalysis stored = invocation.getArgument(0);
                            stored.setId(9L);
                            return stored;
                        });

        long id = service.saveAnalysis(sampleAnalysis());

        ArgumentCaptor<StoredAnalysis> captor = ArgumentCaptor.forClass(StoredAnalysis.class);
        verify(repository).save(captor.capture());
        StoredAnalysis stored = captor.getValue();
        assertThat(id).isEqualTo(9L);
        assertThat(stored.getDocumentId()).isEqualTo("doc-1");
        assertThat(stored.getName()).isEqualTo("Tax Bill");
        assertThat(stored.getCitationCount()).isEqualTo(1);
        assertThat(stored.getResultCount()).isEqualTo(1);
        assertThat(stored.getAnalysisJson()).contains("\"amendmentKind\":\"strike_insert\"");

        stored.setCreated(LocalDateTime.of(2024, 3, 1, 12, 30));
        when(repository.findById(9L)).thenReturn(Optional.of(stored));

        AnalysisPersistenceService.StoredAnalysisView view = service.loadAnalysis(9L);

        assertThat(view.id()).isEqualTo(9L);
        assertThat(view.created()).isEqualTo(LocalDateTime.of(2024, 3, 1, 12, 30));
        DocumentAnalysis analysis = view.analysis();
        assertThat(analysis.documentId()).isEqualTo("doc-1");
        assertThat(analysis.complete()).isTrue();
        CitationProgress progress = analysis.citations().get(0);
        assertThat(progress.state()).isEqualTo(PipelineState.DIFFED);
        assertThat(progress.citation().type()).isEqualTo(CitationType.USC);
        assertThat(progress.citation().address().path())
                .containsExactly(new StructuralLabel(StructuralLevel.SUBSECTION, "b"));
        assertThat(progress.citation().statute().retrievedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(progress.operation().oldTexts()).containsExactly("2023");
        assertThat(analysis.results().get(0).amendmentKind()).isEqualTo(AmendmentKind.STRIKE_INSERT);
        assertThat(analysis.results().get(0).amendedText()).isEqualTo("fiscal year 2024.");
        assertThat(analysis.timing().getSteps()).extracting(StepTiming::getLabel).containsExactly("Detect citations");
    }

    @Test
    void blankNameFallsBackToTheDocumentId() {
        when(repository.save(any(StoredAnalysis.class))).thenAnswer(invocation -> invocation.getArgument(0));
        DocumentAnalysis unnamed =
                new DocumentAnalysis("doc-7", " ", List.of(), List.of(), true, false, new AnalysisTiming(List.of(), 0.0));

        service.saveAnalysis(unnamed);

        ArgumentCaptor<StoredAnalysis> captor = ArgumentCaptor.forClass(StoredAnalysis.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getName()).isEqualTo("doc-7");
    }

    @Test
    void missingAnalysisIsNotFound() {
        when(repository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.loadAnalysis(5L))
                .isInstanceOfSatisfying(
                        ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void searchAnalysesReturnsMappedSummaries() {
        StoredAnalysis entity = new StoredAnalysis();
        entity.setId(42L);
        entity.setDocumentId("doc-42");
        entity.setName("Appropriations Act");
        entity.setCreated(LocalDateTime.of(2024, 3, 1, 12, 30));
        entity.setCitationCount(4);
        entity.setResultCount(3);
        PageImpl<StoredAnalysis> page =
                new PageImpl<>(List.of(entity), PageRequest.of(0, 5, Sort.by(Sort.Direction.DESC, "created")), 1);
        when(repository.findByNameContainingIgnoreCase(eq("appropriations"), any(Pageable.class))).thenReturn(page);

        Page<AnalysisPersistenceService.StoredAnalysisSummary> result =
                service.searchAnalyses(" appropriations ", 0, 5);

        assertThat(result.getTotalElements()).isEqualTo(1);
        AnalysisPersistenceService.StoredAnalysisSummary summary = result.getContent().get(0);
        assertThat(summary.id()).isEqualTo(42L);
        assertThat(summary.documentId()).isEqualTo("doc-42");
        assertThat(summary.citationCount()).isEqualTo(4);
        assertThat(summary.resultCount()).isEqualTo(3);
    }

    @Test
    void searchAnalysesSanitizesPagingAndFilter() {
        when(repository.findByNameContainingIgnoreCase(any(), any(Pageable.class))).thenReturn(Page.empty());

        service.searchAnalyses(null, -3, 500);

        ArgumentCaptor<Pageable> pageableCaptor = ArgumentCaptor.forClass(Pageable.class);
        verify(repository).findByNameContainingIgnoreCase(eq(""), pageableCaptor.capture());
        Pageable pageable = pageableCaptor.getValue();
        assertThat(pageable.getPageNumber()).isZero();
        assertThat(pageable.getPageSize()).isEqualTo(100);
        Sort.Order createdOrder = pageable.getSort().getOrderFor("created");
        assertThat(createdOrder).isNotNull();
        assertThat(createdOrder.getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    private static DocumentAnalysis sampleAnalysis() {
        StructuralLabel subsectionB = new StructuralLabel(StructuralLevel.SUBSECTION, "b");
        Citation citation =
                Citation.detected(
                        1,
                        CitationType.USC,
                        new StructuralAddress(26, "501", List.of(subsectionB)),
                        "Section 501(b) of title 26, United States Code",
                        0,
                        46,
                        false);
        FetchedStatute statute =
                new FetchedStatute(
                        "§501", "fiscal year 2023.", "https://example.test/501", Instant.parse("2024-03-01T12:00:00Z"));
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.STRIKE_INSERT)
                        .targetPath(List.of(subsectionB))
                        .oldTexts(List.of("2023"))
                        .newText("2024")
                        .build();
        ComparisonResult result =
                new ComparisonResult(
                        "c-1",
                        "26 U.S.C. § 501(b)",
                        AmendmentKind.STRIKE_INSERT,
                        List.of(),
                        true,
                        "fiscal year 2023.",
                        "fiscal year 2024.",
                        "<div></div>",
                        "",
                        "",
                        "",
                        1,
                        1,
                        true);
        CitationProgress progress =
                CitationProgress.detected(citation)
                        .fetching()
                        .fetched(statute)
                        .parsed(operation)
                        .mutated()
                        .diffed(result);
        return DocumentAnalysis.of(
                "doc-1",
                "Tax Bill",
                List.of(progress),
                true,
                false,
                new AnalysisTiming(List.of(new StepTiming("Detect citations", 0.01)), 0.5));
    }
}
