package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.error.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary amount rules: positive, at most two fractional digits, stored at scale 2.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {
    }

    /**
     * Validates a client-supplied amount and returns it at scale 2.
     *
     * @throws InvalidAmountException if the amount is missing, not positive or finer than a cent
     */
    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException(null, "Amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException(amount, "Amount must be greater than zero: " + amount.toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new InvalidAmountException(amount,
                "Amount must have at most " + SCALE + " decimal places: " + amount.toPlainString());
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal scaled(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_EVEN);
    }
}
