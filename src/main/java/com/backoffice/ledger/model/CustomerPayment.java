package com.backoffice.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Immutable
@Table(name = "customer_payments", indexes = @Index(name = "idx_payments_customer_date", columnList = "customer_id, payment_date"))
@Data
public class CustomerPayment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_date", nullable = false)
    private LocalDate paymentDate;

    private String referenceNumber; // e.g. Cheque #, bank transaction ID

    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus status;

    // Split of amount between invoices and the spawned credit
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal allocatedAmount;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal creditAmount;

    private String recordedBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = PaymentStatus.COMPLETED;
    }
}
