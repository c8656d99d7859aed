package com.example.redline.infrastructure.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoredAnalysisRepository extends JpaRepository<StoredAnalysis, Long> {
    Page<StoredAnalysis> findByNameContainingIgnoreCase(String name, Pageable pageable);
}
