package com.example.SmartDairy.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

import lombok.Getter;
import lombok.Setter;

/**
 * Uploaded reference document (manual, paper). Its extracted text lives in {@link DocumentChunk}s.
 */
@Entity
@Table(name = "documents")
@Getter
@Setter
public class FarmDocument {

    @Id
    private String id;

    private String fileName;

    private String filePath;

    private String fileType;

    private long fileSize;

    private String category;

    private Instant uploadedAt;

    private Instant processedAt;

    @PrePersist
    public void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (uploadedAt == null) {
            uploadedAt = Instant.now();
        }
    }
}
