package com.flagship.gambling_ledger.limits;

import com.flagship.gambling_ledger.limits.dto.GamblingLimitsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class GamblingLimitsController {

    private final PeriodicLimitEvaluator limitEvaluator;

    @GetMapping("/gambling-limits")
    public ResponseEntity<GamblingLimitsResponse> getGamblingLimits(@RequestHeader("X-User-Id") UUID userId) {
        return ResponseEntity.ok(GamblingLimitsResponse.from(userId, limitEvaluator.getGamblingLimits(userId)));
    }
}
