package com.flagship.banking_ledger.api;

import com.flagship.banking_ledger.api.dto.TransferRequest;
import com.flagship.banking_ledger.api.dto.TransferResponse;
import com.flagship.banking_ledger.transfer.TransferCoordinator;
import com.flagship.banking_ledger.transfer.TransferResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Transfers between accounts. {@code Idempotency-Key} is optional; when present a retried
 * request returns the original confirmation instead of moving money twice.
 */
@RestController
@RequestMapping("/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransferCoordinator transferCoordinator;

    @PostMapping
    public ResponseEntity<TransferResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received transfer request: from={}, to={}, amount={}, idempotencyKey={}",
                request.getFromAccountId(), request.getToAccountId(), request.getAmount(), idempotencyKey);

        TransferResult result = transferCoordinator.transfer(
                request.getFromAccountId(), request.getToAccountId(), request.getAmount(), idempotencyKey);
        return ResponseEntity.ok(TransferResponse.from(result));
    }

    @GetMapping("/{transferId}")
    public ResponseEntity<TransferResponse> getTransfer(@PathVariable UUID transferId) {
        return ResponseEntity.ok(TransferResponse.from(transferCoordinator.findTransfer(transferId)));
    }
}
