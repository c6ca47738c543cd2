package com.flagship.gambling_ledger.ledger;

import com.flagship.gambling_ledger.guard.GuardPolicies;
import com.flagship.gambling_ledger.guard.PolicyGuard;
import com.flagship.gambling_ledger.ledger.dto.BalanceOperationResponse;
import com.flagship.gambling_ledger.ledger.dto.BalanceResponse;
import com.flagship.gambling_ledger.ledger.dto.UpdateBalanceBatchRequest;
import com.flagship.gambling_ledger.ledger.dto.UpdateBalanceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Internal ledger API used by the game, wallet and bonus services.
 *
 * POST returns 201 for a newly applied operation and 200 for a replay. A
 * batch returns 201 when any entry was newly applied.
 */
@RestController
@RequestMapping("/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final BalanceLedgerService ledgerService;
    private final PolicyGuard policyGuard;

    @PostMapping("/operations")
    public ResponseEntity<BalanceOperationResponse> updateBalance(@Valid @RequestBody UpdateBalanceRequest request) {
        log.info("Received balance operation: operationId={}, operation={}, asset={}, amount={}",
                request.getOperationId(), request.getOperation(), request.getAsset(), request.getAmount());

        policyGuard.enforce(request.getUserId(), GuardPolicies.LEDGER_WRITE, request.getPlatformType());
        BalanceUpdateResult result = ledgerService.updateBalance(request.toUpdate());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(BalanceOperationResponse.from(result));
    }

    @PostMapping("/operations/batch")
    public ResponseEntity<List<BalanceOperationResponse>> updateBalances(
            @Valid @RequestBody UpdateBalanceBatchRequest request) {
        List<BalanceUpdate> updates = request.toUpdates();
        BalanceUpdate first = updates.get(0);
        log.info("Received balance batch: size={}, firstOperationId={}, asset={}",
                updates.size(), first.getOperationId(), first.getAsset());

        policyGuard.enforce(first.getUserId(), GuardPolicies.LEDGER_WRITE, first.getPlatformType());
        List<BalanceUpdateResult> results = ledgerService.updateBalances(updates);

        boolean anyApplied = results.stream().anyMatch(result -> !result.isReplayed());
        HttpStatus status = anyApplied ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(results.stream()
                .map(BalanceOperationResponse::from)
                .toList());
    }

    @GetMapping("/operations")
    public ResponseEntity<List<BalanceOperationResponse>> getHistory(
            @RequestParam("userId") UUID userId,
            @RequestParam(name = "asset", required = false) String asset,
            @RequestParam(name = "operation", required = false) BalanceOperationType operation,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        Asset parsed = asset == null ? null : Asset.parse(asset);
        return ResponseEntity.ok(ledgerService.getHistory(userId, parsed, operation, limit, offset).stream()
                .map(BalanceOperationResponse::from)
                .toList());
    }

    @GetMapping("/operations/{operationId}")
    public ResponseEntity<BalanceOperationResponse> getOperation(@PathVariable("operationId") String operationId) {
        return ResponseEntity.ok(BalanceOperationResponse.from(ledgerService.findOperation(operationId)));
    }

    @GetMapping("/balances/{userId}")
    public ResponseEntity<List<BalanceResponse>> getBalances(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(ledgerService.getBalances(userId).stream()
                .map(BalanceResponse::from)
                .toList());
    }

    @GetMapping("/balances/{userId}/{asset}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") UUID userId,
                                                      @PathVariable("asset") String asset) {
        Asset parsed = Asset.parse(asset);
        return ResponseEntity.ok(BalanceResponse.builder()
                .userId(userId)
                .asset(parsed)
                .balance(ledgerService.getBalance(userId, parsed))
                .build());
    }
}
