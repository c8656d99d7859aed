package com.example.redline.web;

import com.example.redline.application.AnalysisPersistenceService;
import com.example.redline.application.AnalysisPersistenceService.StoredAnalysisSummary;
import com.example.redline.application.AnalysisPersistenceService.StoredAnalysisView;
import com.example.redline.application.RedlineUseCase;
import com.example.redline.domain.AnalysisRequest;
import com.example.redline.domain.DocumentAnalysis;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
public class RedlineController {
    private final RedlineUseCase redlineUseCase;
    private final MultipartDocumentInputAdapter documentInputAdapter;
    private final AnalysisPersistenceService analysisPersistenceService;

    public RedlineController(
            RedlineUseCase redlineUseCase,
            MultipartDocumentInputAdapter documentInputAdapter,
            AnalysisPersistenceService analysisPersistenceService) {
        this.redlineUseCase = redlineUseCase;
        this.documentInputAdapter = documentInputAdapter;
        this.analysisPersistenceService = analysisPersistenceService;
    }

    @PostMapping("/documents")
    public ResponseEntity<StoredAnalysisView> analyze(@RequestBody AnalyzeTextRequest request) {
        return analyzeAndStore(toAnalysisRequest(request));
    }

    @PostMapping("/documents/upload")
    public ResponseEntity<StoredAnalysisView> upload(@RequestParam("file") MultipartFile file)
            throws IOException {
        return analyzeAndStore(documentInputAdapter.adapt(file, newDocumentId()));
    }

    @PostMapping("/documents/async")
    public ResponseEntity<RunStarted> start(@RequestBody AnalyzeTextRequest request) {
        AnalysisRequest analysisRequest = toAnalysisRequest(request);
        redlineUseCase.start(analysisRequest);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunStarted(analysisRequest.documentId()));
    }

    @GetMapping("/runs/{documentId}")
    public DocumentAnalysis run(@PathVariable("documentId") String documentId) {
        return redlineUseCase
                .snapshot(documentId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No active run"));
    }

    @DeleteMapping("/runs/{documentId}")
    public ResponseEntity<Void> withdraw(@PathVariable("documentId") String documentId) {
        if (!redlineUseCase.withdraw(documentId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active run");
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/documents")
    public Page<StoredAnalysisSummary> search(
            @RequestParam(name = "name", required = false) String nameFilter,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        return analysisPersistenceService.searchAnalyses(nameFilter, page, size);
    }

    @GetMapping("/documents/{id}")
    public StoredAnalysisView load(@PathVariable("id") long id) {
        return analysisPersistenceService.loadAnalysis(id);
    }

    private ResponseEntity<StoredAnalysisView> analyzeAndStore(AnalysisRequest request) {
        DocumentAnalysis analysis = redlineUseCase.analyze(request);
        long id = analysisPersistenceService.saveAnalysis(analysis);
        return ResponseEntity.status(HttpStatus.CREATED).body(analysisPersistenceService.loadAnalysis(id));
    }

    private AnalysisRequest toAnalysisRequest(AnalyzeTextRequest request) {
        if (request == null || request.getText() == null || request.getText().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Document text must not be empty");
        }
        return new AnalysisRequest(newDocumentId(), request.getName(), request.getText());
    }

    private String newDocumentId() {
        return UUID.randomUUID().toString();
    }

    public record RunStarted(String documentId) {}
}
