package com.evaluate.interviewcoach.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "session_snapshots")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionSnapshot {

    @Id
    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "interview_type", nullable = false)
    private String interviewType;

    @Column(nullable = false)
    private String state;

    @Column(name = "mean_score")
    private Double meanScore;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "archived_at")
    private LocalDateTime archivedAt;

    @PrePersist
    @PreUpdate
    protected void onSave() {
        archivedAt = LocalDateTime.now();
    }
}
