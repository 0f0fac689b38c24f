package com.flagship.banking_ledger.api;

import com.flagship.banking_ledger.api.dto.AccrualResponse;
import com.flagship.banking_ledger.interest.AccrualSummary;
import com.flagship.banking_ledger.interest.InterestAccrualEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/interest")
@RequiredArgsConstructor
public class InterestController {

    private final InterestAccrualEngine accrualEngine;

    /**
     * Runs accrual for {@code date}, or for today in the configured zone when omitted.
     */
    @PostMapping("/calculate")
    public ResponseEntity<AccrualResponse> calculate(
            @RequestParam(value = "date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        AccrualSummary summary = date != null ? accrualEngine.accrueDaily(date) : accrualEngine.accrueDaily();
        return ResponseEntity.ok(AccrualResponse.from(summary));
    }
}
