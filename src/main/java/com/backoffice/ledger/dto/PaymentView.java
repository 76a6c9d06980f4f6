package com.backoffice.ledger.dto;

import com.backoffice.ledger.model.PaymentMethod;
import com.backoffice.ledger.model.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class PaymentView {
    Long id;
    Long customerId;
    String customerName;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    LocalDate paymentDate;
    String referenceNumber;
    String notes;
    PaymentStatus status;
    BigDecimal allocatedAmount;
    BigDecimal creditAmount;
    String recordedBy;
    List<Application> applications;

    @Value
    public static class Application {
        Long invoiceId;
        String invoiceNumber;
        BigDecimal amountApplied;
    }
}
