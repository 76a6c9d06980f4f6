package com.backoffice.ledger.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
@Jacksonized
public class PreviewAllocationRequest {
    Long customerId;
    BigDecimal amount;
    List<Long> invoiceIds;
}
