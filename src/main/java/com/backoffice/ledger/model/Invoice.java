package com.backoffice.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "invoices", indexes = @Index(name = "idx_invoices_customer_status", columnList = "customer_id, status"))
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String invoiceNumber;

    @ManyToOne
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @Column(nullable = false)
    private LocalDate invoiceDate;

    private LocalDate dueDate;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    // Null only on rows created before balances were tracked; see BalanceInitializationService.
    @Column(precision = 14, scale = 2)
    private BigDecimal balance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InvoiceStatus status;

    private String notes;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (balance == null)
            balance = totalAmount;
        if (status == null)
            status = InvoiceStatus.OPEN;
    }

    /**
     * Pays down the balance and recomputes the status. Callers validate the
     * amount first; the checks here only guard the invariant.
     */
    public void reduceBalance(BigDecimal amount, LocalDate today) {
        if (amount.signum() <= 0 || amount.compareTo(balance) > 0) {
            throw new IllegalStateException("Cannot apply " + amount + " to invoice " + invoiceNumber
                    + " with balance " + balance);
        }
        balance = balance.subtract(amount);
        refreshStatus(today);
    }

    public void refreshStatus(LocalDate today) {
        status = InvoiceStatusPolicy.derive(status, balance, totalAmount, dueDate, today);
    }

    public boolean isOverdue(LocalDate today) {
        return dueDate != null && dueDate.isBefore(today) && balance != null && balance.signum() > 0;
    }
}
