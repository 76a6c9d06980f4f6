package com.backoffice.ledger.util;

import com.backoffice.ledger.exception.InvalidArgumentException;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 2;

    private MoneyUtils() {
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * Validates a caller-supplied amount: present, strictly positive and at most
     * two decimal places. Returns it normalized to scale 2.
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new InvalidArgumentException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidArgumentException(field + " must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new InvalidArgumentException(field + " must have at most " + SCALE + " decimal places: " + amount);
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
