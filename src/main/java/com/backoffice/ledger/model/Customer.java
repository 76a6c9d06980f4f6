package com.backoffice.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "customers")
@Data
public class Customer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String companyName;
    private String phone;
    private String email;

    // Amount owed before any tracked invoice or payment. Written once.
    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal openingBalance;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (openingBalance == null)
            openingBalance = BigDecimal.ZERO;
    }

    public String getDisplayName() {
        return companyName != null && !companyName.isBlank() ? companyName : name;
    }
}
