package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.banking_ledger.ledger.Transaction;
import com.flagship.banking_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("transactionId")
    long transactionId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("balanceAfter")
    BigDecimal balanceAfter;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("description")
    String description;

    @JsonProperty("transferId")
    UUID transferId;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .transactionId(transaction.getTransactionId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .balanceAfter(transaction.getBalanceAfter())
            .timestamp(transaction.getTimestamp())
            .description(transaction.getDescription())
            .transferId(transaction.getTransferId())
            .build();
    }
}
