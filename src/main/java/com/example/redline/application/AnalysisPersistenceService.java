package com.example.redline.application;

import com.example.redline.domain.DocumentAnalysis;
import com.example.redline.infrastructure.persistence.StoredAnalysis;
import com.example.redline.infrastructure.persistence.StoredAnalysisRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;

@Service
public class AnalysisPersistenceService {
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final StoredAnalysisRepository repository;
    private final ObjectMapper objectMapper;

    public AnalysisPersistenceService(StoredAnalysisRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public long saveAnalysis(DocumentAnalysis analysis) {
        StoredAnalysis entity = new StoredAnalysis();
        entity.setDocumentId(analysis.documentId());
        entity.setName(analysis.name() == null || analysis.name().isBlank() ? analysis.documentId() : analysis.name());
        entity.setCitationCount(analysis.citations().size());
        entity.setResultCount(analysis.results().size());
        entity.setAnalysisJson(toJson(analysis));
        return repository.save(entity).getId();
    }

    @Transactional(readOnly = true)
    public StoredAnalysisView loadAnalysis(long id) {
        StoredAnalysis entity =
                repository
                        .findById(id)
                        .orElseThrow(
                                () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Analysis not found"));
        return new StoredAnalysisView(
                entity.getId(), entity.getName(), entity.getCreated(), fromJson(entity.getAnalysisJson()));
    }

    @Transactional(readOnly = true)
    public Page<StoredAnalysisSummary> searchAnalyses(String nameFilter, int page, int size) {
        Pageable pageable = PageRequest.of(sanitizePage(page), sanitizeSize(size), sortByCreatedDesc());
        return repository
                .findByNameContainingIgnoreCase(sanitizeFilter(nameFilter), pageable)
                .map(
                        stored ->
                                new StoredAnalysisSummary(
                                        stored.getId(),
                                        stored.getDocumentId(),
                                        stored.getName(),
                                        stored.getCreated(),
                                        stored.getCitationCount(),
                                        stored.getResultCount()));
    }

    private String toJson(DocumentAnalysis analysis) {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store document analysis", ex);
        }
    }

    private DocumentAnalysis fromJson(String json) {
        try {
            return objectMapper.readValue(json, DocumentAnalysis.class);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read document analysis", ex);
        }
    }

    public record StoredAnalysisView(Long id, String name, LocalDateTime created, DocumentAnalysis analysis) {}

    public record StoredAnalysisSummary(
            Long id, String documentId, String name, LocalDateTime created, int citationCount, int resultCount) {}

    private Sort sortByCreatedDesc() {
        return Sort.by(Sort.Direction.DESC, "created");
    }

    private int sanitizePage(int page) {
        return Math.max(page, 0);
    }

    private int sanitizeSize(int requestedSize) {
        if (requestedSize <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(requestedSize, MAX_PAGE_SIZE);
    }

    private String sanitizeFilter(String filter) {
        if (filter == null) {
            return "";
        }
        return filter.trim();
    }
}
