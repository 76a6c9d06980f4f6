package com.backoffice.ledger.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class CustomerCredits {
    List<CreditView> credits;
    BigDecimal totalAvailableCredit;
}
