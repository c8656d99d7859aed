package com.example.redline.infrastructure.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "DOCUMENT_ANALYSES")
@Getter
@Setter
public class StoredAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "document_analysis_sequence")
    @SequenceGenerator(
            name = "document_analysis_sequence",
            sequenceName = "DOCUMENT_ANALYSIS_SEQ",
            allocationSize = 1)
    private Long id;

    @Column(name = "DOCUMENT_ID", nullable = false)
    private String documentId;

    @Column(name = "NAME", nullable = false)
    private String name;

    @Column(name = "CREATED", nullable = false, updatable = false)
    private LocalDateTime created;

    @Column(name = "CITATION_COUNT", nullable = false)
    private int citationCount;

    @Column(name = "RESULT_COUNT", nullable = false)
    private int resultCount;

    @Lob
    @Column(name = "ANALYSIS", nullable = false)
    private String analysisJson;

    @PrePersist
    void onCreate() {
        if (created == null) {
            created = LocalDateTime.now();
        }
    }
}
