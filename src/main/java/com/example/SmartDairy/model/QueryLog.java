package com.example.SmartDairy.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;

import lombok.Getter;
import lombok.Setter;

/**
 * Analytics row appended once per answered query.
 */
@Entity
@Table(name = "query_logs")
@Getter
@Setter
public class QueryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String sessionId;

    @Column(columnDefinition = "TEXT")
    private String query;

    /** Stored as the wire label, see {@link StrategyLabelConverter}. */
    private StrategyLabel queryType;

    @Column(name = "documents", columnDefinition = "TEXT")
    private String documentsJson;

    private String csvFile;

    private boolean triggeredWebSearch;

    private Instant createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
