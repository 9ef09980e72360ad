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
 * One persisted turn of a conversation. Assistant turns carry sources, strategy and timing.
 */
@Entity
@Table(name = "chat_messages")
@Getter
@Setter
public class ChatMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String sessionId;

    private String role;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "sources", columnDefinition = "TEXT")
    private String sourcesJson;

    /** Stored as the wire label, see {@link StrategyLabelConverter}. */
    private StrategyLabel queryType;

    /** Seconds spent answering, assistant turns only. */
    private Double responseTime;

    private Instant createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
