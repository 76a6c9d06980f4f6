package com.backoffice.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String actorId;
    private String action; // e.g. "RECORD_PAYMENT", "APPLY_CREDIT"
    private String entityType;
    private String entityId;

    // Unbounded: a payment snapshot lists every invoice it touched
    @Column(columnDefinition = "text")
    private String beforeSnapshot;

    @Column(columnDefinition = "text")
    private String afterSnapshot;

    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}
