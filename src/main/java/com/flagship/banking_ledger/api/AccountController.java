package com.flagship.banking_ledger.api;

import com.flagship.banking_ledger.api.dto.AccountInfoResponse;
import com.flagship.banking_ledger.api.dto.AmountRequest;
import com.flagship.banking_ledger.api.dto.BalanceResponse;
import com.flagship.banking_ledger.api.dto.InterestRecordResponse;
import com.flagship.banking_ledger.api.dto.ReconciliationResponse;
import com.flagship.banking_ledger.ledger.AccountService;
import com.flagship.banking_ledger.ledger.ReconciliationService;
import com.flagship.banking_ledger.query.AccountQueryFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final AccountQueryFacade queryFacade;
    private final ReconciliationService reconciliationService;

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountInfoResponse> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(AccountInfoResponse.from(accountService.getAccountInfo(accountId)));
    }

    @PostMapping("/{accountId}/deposit")
    public ResponseEntity<BalanceResponse> deposit(@PathVariable String accountId,
                                                   @RequestBody AmountRequest request) {
        log.info("Received deposit request: accountId={}, amount={}", accountId, request.getAmount());
        BigDecimal balance = accountService.deposit(accountId, request.getAmount());
        return ResponseEntity.ok(BalanceResponse.of(accountId, balance));
    }

    @PostMapping("/{accountId}/withdrawal")
    public ResponseEntity<BalanceResponse> withdraw(@PathVariable String accountId,
                                                    @RequestBody AmountRequest request) {
        log.info("Received withdrawal request: accountId={}, amount={}", accountId, request.getAmount());
        BigDecimal balance = accountService.withdraw(accountId, request.getAmount());
        return ResponseEntity.ok(BalanceResponse.of(accountId, balance));
    }

    @GetMapping("/{accountId}/interest-history")
    public ResponseEntity<List<InterestRecordResponse>> getInterestHistory(@PathVariable String accountId) {
        return ResponseEntity.ok(queryFacade.getInterestHistory(accountId).stream()
            .map(InterestRecordResponse::from)
            .toList());
    }

    @GetMapping("/{accountId}/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(@PathVariable String accountId) {
        return ResponseEntity.ok(ReconciliationResponse.from(reconciliationService.reconcile(accountId)));
    }
}
