package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {

    @JsonProperty("accountId")
    String accountId;

    @JsonProperty("balance")
    BigDecimal balance;

    public static BalanceResponse of(String accountId, BigDecimal balance) {
        return new BalanceResponse(accountId, balance);
    }
}
