package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.banking_ledger.transfer.TransferResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("transferId")
    UUID transferId;

    @JsonProperty("fromAccountId")
    String fromAccountId;

    @JsonProperty("toAccountId")
    String toAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fromBalance")
    BigDecimal fromBalance;

    @JsonProperty("toBalance")
    BigDecimal toBalance;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static TransferResponse from(TransferResult result) {
        return TransferResponse.builder()
            .transferId(result.getTransferId())
            .fromAccountId(result.getFromAccountId())
            .toAccountId(result.getToAccountId())
            .amount(result.getAmount())
            .fromBalance(result.getFromBalanceAfter())
            .toBalance(result.getToBalanceAfter())
            .timestamp(result.getTimestamp())
            .build();
    }
}
