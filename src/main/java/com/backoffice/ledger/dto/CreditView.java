package com.backoffice.ledger.dto;

import com.backoffice.ledger.model.CreditReason;
import com.backoffice.ledger.model.CreditStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class CreditView {
    Long id;
    BigDecimal amount;
    BigDecimal availableAmount;
    CreditStatus status;
    CreditReason reason;
    String description;
    Long sourcePaymentId;
    String createdBy;
    LocalDateTime createdAt;
    List<Application> applications;

    @Value
    public static class Application {
        Long invoiceId;
        String invoiceNumber;
        BigDecimal amountApplied;
        LocalDate appliedDate;
        String appliedBy;
    }
}
