package com.backoffice.ledger.dto;

import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.util.MoneyUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ApplyCreditRequest {
    Long creditId;
    Long invoiceId;
    BigDecimal amount;
    String actorId;

    public void validate() {
        if (creditId == null || invoiceId == null) {
            throw new InvalidArgumentException("creditId and invoiceId are required");
        }
        MoneyUtils.requirePositive(amount, "amount");
    }
}
