package com.example.SmartDairy.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "chat_sessions")
@Getter
@Setter
public class ChatSession {

    public static final String DEFAULT_TITLE = "New Conversation";

    @Id
    private String id;

    private String title;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    public void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (title == null) {
            title = DEFAULT_TITLE;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
