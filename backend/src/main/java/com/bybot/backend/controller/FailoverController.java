package com.bybot.backend.controller;

import com.bybot.backend.config.AdminAccessGuard;
import com.bybot.backend.dto.FailoverConfigUpdateRequest;
import com.bybot.backend.dto.RecoveryResponse;
import com.bybot.backend.exception.NotFoundException;
import com.bybot.backend.service.failover.ComponentStatusView;
import com.bybot.backend.service.failover.FailoverManager;
import com.bybot.backend.service.failover.FailoverSettings;
import com.bybot.backend.service.failover.FailoverStatusView;
import com.bybot.backend.service.failover.SupervisedComponent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/failover")
@RequiredArgsConstructor
@Tag(name = "Failover")
public class FailoverController {

    private final FailoverManager failoverManager;
    private final AdminAccessGuard adminAccessGuard;

    @GetMapping("/status")
    @Operation(summary = "Global failover state and every component")
    public FailoverStatusView status() {
        return failoverManager.getFailoverStatus();
    }

    @GetMapping("/components/{name}")
    @Operation(summary = "Status of one supervised component")
    public ComponentStatusView component(@PathVariable String name) {
        return failoverManager.getComponentStatus(name)
                .orElseThrow(() -> unknownComponent(name));
    }

    @PostMapping("/components/{name}/reset")
    @Operation(summary = "Mark a component healthy and clear its counters")
    public ComponentStatusView reset(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token,
                                     @PathVariable String name) {
        adminAccessGuard.requireAdmin(token);
        if (!failoverManager.resetComponent(name)) {
            throw unknownComponent(name);
        }
        return component(name);
    }

    @PostMapping("/components/{name}/recover")
    @Operation(summary = "Attempt recovery of a component, subject to backoff and attempt limits")
    public RecoveryResponse recover(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token,
                                    @PathVariable String name) {
        adminAccessGuard.requireAdmin(token);
        SupervisedComponent component = SupervisedComponent.fromName(name)
                .orElseThrow(() -> unknownComponent(name));
        log.warn("Manual recovery requested component={}", component.wireName());
        boolean recovered = failoverManager.attemptRecovery(component);
        return new RecoveryResponse(recovered, component(name));
    }

    @PutMapping("/config")
    @Operation(summary = "Update failover settings; omitted fields are unchanged")
    public FailoverSettings updateConfig(@RequestHeader(value = AdminAccessGuard.HEADER, required = false) String token,
                                         @Valid @RequestBody FailoverConfigUpdateRequest request) {
        adminAccessGuard.requireAdmin(token);
        return failoverManager.updateFailoverConfig(request.toUpdate());
    }

    private NotFoundException unknownComponent(String name) {
        return new NotFoundException("Unknown component: " + name);
    }
}
