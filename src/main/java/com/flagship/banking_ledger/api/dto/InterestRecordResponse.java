package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.banking_ledger.interest.InterestRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class InterestRecordResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("accountId")
    String accountId;

    @JsonProperty("interestRate")
    BigDecimal interestRate;

    @JsonProperty("calculatedInterest")
    BigDecimal calculatedInterest;

    @JsonProperty("calculationDate")
    LocalDate calculationDate;

    @JsonProperty("transactionId")
    long transactionId;

    public static InterestRecordResponse from(InterestRecord record) {
        return InterestRecordResponse.builder()
            .id(record.getId())
            .accountId(record.getAccountId())
            .interestRate(record.getInterestRate())
            .calculatedInterest(record.getCalculatedInterest())
            .calculationDate(record.getCalculationDate())
            .transactionId(record.getTransactionId())
            .build();
    }
}
