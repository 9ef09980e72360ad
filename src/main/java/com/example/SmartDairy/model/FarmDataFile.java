package com.example.SmartDairy.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

import lombok.Getter;
import lombok.Setter;

/**
 * Registered herd-management export (CSV or Excel) available for tabular analysis.
 */
@Entity
@Table(name = "farm_data_files")
@Getter
@Setter
public class FarmDataFile {

    @Id
    private String id;

    private String fileName;

    private String filePath;

    /** "csv" or "excel". */
    private String fileType;

    private int rowCount;

    @Column(name = "columns", columnDefinition = "TEXT")
    private String columnsJson;

    private Instant uploadedAt;

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
