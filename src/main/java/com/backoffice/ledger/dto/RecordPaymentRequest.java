package com.backoffice.ledger.dto;

import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.model.PaymentMethod;
import com.backoffice.ledger.util.MoneyUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class RecordPaymentRequest {
    Long customerId;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    LocalDate paymentDate; // defaults to today
    String referenceNumber;
    String notes;
    List<Long> invoiceIds; // optional: restrict allocation to these invoices
    String recordedBy;

    public void validate() {
        if (customerId == null) {
            throw new InvalidArgumentException("customerId is required");
        }
        MoneyUtils.requirePositive(amount, "amount");
        if (paymentMethod == null) {
            throw new InvalidArgumentException("paymentMethod is required");
        }
        if (invoiceIds != null && invoiceIds.stream().anyMatch(id -> id == null)) {
            throw new InvalidArgumentException("invoiceIds must not contain null entries");
        }
    }
}
