package com.bybot.backend.controller;

import com.bybot.backend.config.AdminAccessGuard;
import com.bybot.backend.dto.RateLimitStats;
import com.bybot.backend.dto.RateLimitUpdateRequest;
import com.bybot.backend.exception.NotFoundException;
import com.bybot.backend.service.circuit.CircuitBreakerRegistry;
import com.bybot.backend.service.circuit.CircuitSnapshot;
import com.bybot.backend.service.ratelimit.LimitSnapshot;
import com.bybot.backend.service.ratelimit.RateLimiter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/resilience")
@RequiredArgsConstructor
@Tag(name = "Resilience")
public class ResilienceController {

    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final AdminAccessGuard adminAccessGuard;

    @GetMapping("/rate-limits")
    @Operation(summary = "Current token levels per rate-limit key")
    public Map<String, LimitSnapshot> rateLimits() {
        return rateLimiter.getLimits();
    }

    @GetMapping("/rate-limits/stats")
    @Operation(summary = "Call and rejection counts per rate-limit key")
    public RateLimitStats rateLimitStats() {
        return new RateLimitStats(rateLimiter.getStats(), rateLimiter.getRejections());
    }

    @PutMapping("/rate-limits/{key}")
    @Operation(summary = "Create or replace a rate limit")
    public ResponseEntity<LimitSnapshot> updateRateLimit(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token,
                                                         @PathVariable String key,
                                                         @Valid @RequestBody RateLimitUpdateRequest request) {
        adminAccessGuard.requireAdmin(token);
        rateLimiter.addLimit(key, request.getMaxTokens(), Duration.ofSeconds(request.getIntervalSeconds()));
        log.info("Rate limit updated key={} maxTokens={} intervalSeconds={}", key, request.getMaxTokens(), request.getIntervalSeconds());
        return ResponseEntity.ok(rateLimiter.getLimits().get(key));
    }

    @PostMapping("/rate-limits/stats/reset")
    @Operation(summary = "Clear rate-limit counters")
    public ResponseEntity<Void> resetRateLimitStats(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token) {
        adminAccessGuard.requireAdmin(token);
        rateLimiter.resetStats();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/circuits")
    @Operation(summary = "Circuit breaker snapshots")
    public List<CircuitSnapshot> circuits() {
        return circuitBreakerRegistry.getSnapshots();
    }

    @PostMapping("/circuits/reset")
    @Operation(summary = "Force every circuit closed")
    public List<CircuitSnapshot> resetAllCircuits(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token) {
        adminAccessGuard.requireAdmin(token);
        circuitBreakerRegistry.resetAll();
        return circuitBreakerRegistry.getSnapshots();
    }

    @PostMapping("/circuits/{name}/reset")
    @Operation(summary = "Force one circuit closed")
    public CircuitSnapshot resetCircuit(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token,
                                        @PathVariable String name) {
        adminAccessGuard.requireAdmin(token);
        if (!circuitBreakerRegistry.reset(name)) {
            throw new NotFoundException("Unknown circuit: " + name);
        }
        return circuitBreakerRegistry.getCircuitBreaker(name).snapshot();
    }
}
