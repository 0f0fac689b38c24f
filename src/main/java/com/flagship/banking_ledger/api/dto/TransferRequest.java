package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TransferRequest {

    @Size(max = 64, message = "Account id must be at most 64 characters")
    @JsonProperty("fromAccountId")
    String fromAccountId;

    @Size(max = 64, message = "Account id must be at most 64 characters")
    @JsonProperty("toAccountId")
    String toAccountId;

    @JsonProperty("amount")
    BigDecimal amount;
}
