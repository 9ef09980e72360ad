package com.example.SmartDairy.repository;

import com.example.SmartDairy.model.DocumentChunk;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, Long> {

    /**
     * Candidate chunks for lexical scoring, in stable (document, chunk index) order.
     */
    List<DocumentChunk> findByDocumentIdInOrderByDocumentIdAscChunkIndexAsc(Collection<String> documentIds,
                                                                            Pageable pageable);

    long countByDocumentId(String documentId);

    @Modifying
    @Transactional
    void deleteByDocumentId(String documentId);
}
