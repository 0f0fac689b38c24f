package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Body of deposit and withdrawal requests. Amount rules are enforced by the ledger,
 * which reports violations as INVALID_AMOUNT.
 */
@Value
public class AmountRequest {

    @JsonProperty("amount")
    BigDecimal amount;
}
