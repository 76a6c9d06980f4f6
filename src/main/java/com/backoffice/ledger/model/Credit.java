package com.backoffice.ledger.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "credits")
@Data
public class Credit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @Column(nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal availableAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CreditStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CreditReason reason;

    private String description;

    // The over-payment this credit is the change from
    @OneToOne
    @JoinColumn(name = "source_payment_id", unique = true)
    private CustomerPayment sourcePayment;

    private String createdBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (availableAmount == null)
            availableAmount = amount;
        if (status == null)
            status = CreditStatus.ACTIVE;
    }

    public boolean isActive() {
        return status == CreditStatus.ACTIVE;
    }

    /**
     * Draws down the available amount; a credit with nothing left is EXHAUSTED.
     */
    public void consume(BigDecimal value) {
        if (value.signum() <= 0 || value.compareTo(availableAmount) > 0) {
            throw new IllegalStateException("Cannot draw " + value + " from credit " + id
                    + " with " + availableAmount + " available");
        }
        availableAmount = availableAmount.subtract(value);
        if (availableAmount.signum() == 0) {
            status = CreditStatus.EXHAUSTED;
        }
    }
}
