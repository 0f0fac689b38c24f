package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.banking_ledger.query.AccountInfo;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class AccountInfoResponse {

    @JsonProperty("accountId")
    String accountId;

    @JsonProperty("customerName")
    String customerName;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("recentTransactions")
    List<TransactionResponse> recentTransactions;

    @JsonProperty("accumulatedInterest")
    BigDecimal accumulatedInterest;

    public static AccountInfoResponse from(AccountInfo info) {
        return AccountInfoResponse.builder()
            .accountId(info.getAccountId())
            .customerName(info.getCustomerName())
            .balance(info.getBalance())
            .recentTransactions(info.getRecentTransactions().stream()
                .map(TransactionResponse::from)
                .toList())
            .accumulatedInterest(info.getAccumulatedInterest())
            .build();
    }
}
