package com.backoffice.ledger.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class AllocationPreview {
    BigDecimal amount;
    BigDecimal totalAllocated;
    BigDecimal totalCredit;
    List<AllocationPreviewLine> lines;
}
