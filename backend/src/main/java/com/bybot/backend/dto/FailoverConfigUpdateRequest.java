package com.bybot.backend.dto;

import com.bybot.backend.service.failover.FailoverConfigUpdate;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailoverConfigUpdateRequest {

    private Boolean enabled;
    private Boolean autoRecovery;

    @Min(0)
    private Integer maxRecoveryAttempts;

    @PositiveOrZero
    private Long recoveryBackoffSeconds;

    private Boolean emergencyShutdown;
    private Boolean notificationEnabled;

    @Positive
    private Long checkIntervalSeconds;

    public FailoverConfigUpdate toUpdate() {
        return new FailoverConfigUpdate(
                enabled,
                autoRecovery,
                maxRecoveryAttempts,
                recoveryBackoffSeconds == null ? null : Duration.ofSeconds(recoveryBackoffSeconds),
                emergencyShutdown,
                notificationEnabled,
                checkIntervalSeconds == null ? null : Duration.ofSeconds(checkIntervalSeconds)
        );
    }
}
