package com.flagship.banking_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.banking_ledger.interest.AccrualSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class AccrualResponse {

    @JsonProperty("calculationDate")
    LocalDate calculationDate;

    @JsonProperty("interestRate")
    BigDecimal interestRate;

    @JsonProperty("accountsCredited")
    int accountsCredited;

    @JsonProperty("alreadyAccrued")
    int alreadyAccrued;

    @JsonProperty("zeroInterest")
    int zeroInterest;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("totalInterest")
    BigDecimal totalInterest;

    public static AccrualResponse from(AccrualSummary summary) {
        return AccrualResponse.builder()
            .calculationDate(summary.getCalculationDate())
            .interestRate(summary.getInterestRate())
            .accountsCredited(summary.getAccountsCredited())
            .alreadyAccrued(summary.getAlreadyAccrued())
            .zeroInterest(summary.getZeroInterest())
            .failed(summary.getFailed())
            .totalInterest(summary.getTotalInterest())
            .build();
    }
}
