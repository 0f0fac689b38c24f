package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.banking_ledger.ledger.ReconciliationReport;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("accountId")
    String accountId;

    @JsonProperty("initialBalance")
    BigDecimal initialBalance;

    @JsonProperty("transactionTotal")
    BigDecimal transactionTotal;

    @JsonProperty("expectedBalance")
    BigDecimal expectedBalance;

    @JsonProperty("actualBalance")
    BigDecimal actualBalance;

    @JsonProperty("balanced")
    boolean balanced;

    public static ReconciliationResponse from(ReconciliationReport report) {
        return ReconciliationResponse.builder()
            .accountId(report.getAccountId())
            .initialBalance(report.getInitialBalance())
            .transactionTotal(report.getTransactionTotal())
            .expectedBalance(report.getExpectedBalance())
            .actualBalance(report.getActualBalance())
            .balanced(report.isBalanced())
            .build();
    }
}
