package com.example.SmartDairy.service;

import com.example.SmartDairy.exception.ResourceNotFoundException;
import com.example.SmartDairy.model.DocumentSummary;
import com.example.SmartDairy.repository.DocumentChunkRepository;
import com.example.SmartDairy.repository.FarmDocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    private final FarmDocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;

    /**
     * All documents, newest first, with their chunk counts.
     */
    public List<DocumentSummary> listDocuments() {
        return documentRepository.findAllByOrderByUploadedAtDesc().stream()
                .map(doc -> new DocumentSummary(
                        doc.getId(),
                        doc.getFileName(),
                        doc.getFileType(),
                        doc.getFileSize(),
                        doc.getCategory(),
                        doc.getUploadedAt(),
                        chunkRepository.countByDocumentId(doc.getId())
                ))
                .toList();
    }

    @Transactional
    public void deleteDocument(String documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new ResourceNotFoundException("Document not found: " + documentId);
        }
        chunkRepository.deleteByDocumentId(documentId);
        documentRepository.deleteById(documentId);
    }
}
