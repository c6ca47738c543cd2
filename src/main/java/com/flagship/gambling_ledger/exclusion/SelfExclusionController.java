package com.flagship.gambling_ledger.exclusion;

import com.flagship.gambling_ledger.exclusion.dto.CreateSelfExclusionRequest;
import com.flagship.gambling_ledger.exclusion.dto.ExtendSelfExclusionRequest;
import com.flagship.gambling_ledger.exclusion.dto.SelfExclusionResponse;
import com.flagship.gambling_ledger.guard.GuardPolicies;
import com.flagship.gambling_ledger.guard.PolicyGuard;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Self-service exclusion and limit endpoints. The caller is identified by
 * the X-User-Id header set by the gateway.
 */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Slf4j
public class SelfExclusionController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final SelfExclusionService selfExclusionService;
    private final PolicyGuard policyGuard;

    @PostMapping("/self-exclusion")
    public ResponseEntity<SelfExclusionResponse> create(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @Valid @RequestBody CreateSelfExclusionRequest request) {

        log.info("Self-exclusion requested: type={}, platformType={}, period={}",
                request.getType(), request.getPlatformType(), request.getPeriod());
        policyGuard.enforce(userId, GuardPolicies.SELF_EXCLUSION_WRITE, null);

        SelfExclusion created = selfExclusionService.create(userId, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SelfExclusionResponse.from(created, Instant.now()));
    }

    /**
     * Cooldowns are deleted (204). Limits enter their removal grace period
     * and are returned (200).
     */
    @DeleteMapping("/self-exclusions/{id}")
    public ResponseEntity<SelfExclusionResponse> cancel(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id) {

        policyGuard.enforce(userId, GuardPolicies.SELF_EXCLUSION_WRITE, null);
        return selfExclusionService.cancel(userId, id)
                .map(pending -> ResponseEntity.ok(SelfExclusionResponse.from(pending, Instant.now())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/self-exclusions")
    public ResponseEntity<List<SelfExclusionResponse>> list(@RequestHeader(USER_ID_HEADER) UUID userId) {
        Instant now = Instant.now();
        return ResponseEntity.ok(selfExclusionService.getSelfExclusions(userId).stream()
                .map(exclusion -> SelfExclusionResponse.from(exclusion, now))
                .toList());
    }

    @GetMapping("/self-exclusions/active")
    public ResponseEntity<List<SelfExclusionResponse>> active(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam(name = "platformType", required = false) PlatformType platformType) {
        Instant now = Instant.now();
        return ResponseEntity.ok(selfExclusionService.getActiveSelfExclusions(userId, platformType).stream()
                .map(exclusion -> SelfExclusionResponse.from(exclusion, now))
                .toList());
    }

    @PostMapping("/self-exclusion/extend/{id}")
    public ResponseEntity<SelfExclusionResponse> extend(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @PathVariable("id") UUID id,
            @RequestBody(required = false) ExtendSelfExclusionRequest request) {

        ExtendSelfExclusionRequest body = request == null ? new ExtendSelfExclusionRequest() : request;
        log.info("Cooldown extension requested: cooldownId={}, durationDays={}", id, body.getDurationDays());
        policyGuard.enforce(userId, GuardPolicies.SELF_EXCLUSION_WRITE, null);

        SelfExclusion extended = selfExclusionService.extend(userId, id, body.getPlatformType(), body.getDurationDays());
        return ResponseEntity.ok(SelfExclusionResponse.from(extended, Instant.now()));
    }
}
