package com.bybot.backend.service;

import com.bybot.backend.dto.MetricsSnapshot;
import com.bybot.backend.service.circuit.CircuitState;
import com.bybot.backend.service.failover.FailoverState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    @Test
    void countersFeedSnapshotAndMeterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsService service = new MetricsService(registry);
        service.init();

        service.recordRateLimitRejection("order");
        service.recordRateLimitRejection("order");
        service.recordCircuitTransition("place_order", CircuitState.CLOSED, CircuitState.OPEN);
        service.recordRecoveryAttempt("api_client", false);
        service.recordRecoveryAttempt("api_client", true);
        service.incrementExchangeFailures();
        service.recordEmergencyShutdown();
        service.updateFailoverState(FailoverState.EMERGENCY);

        MetricsSnapshot snapshot = service.snapshot();
        assertThat(snapshot.rateLimitRejections()).containsEntry("order", 2L);
        assertThat(snapshot.circuitTransitions()).containsEntry("OPEN", 1L);
        assertThat(snapshot.recoveryAttempts()).isEqualTo(2);
        assertThat(snapshot.recoveryFailures()).isEqualTo(1);
        assertThat(snapshot.exchangeFailures()).isEqualTo(1);
        assertThat(snapshot.emergencyShutdowns()).isEqualTo(1);
        assertThat(snapshot.failoverState()).isEqualTo("EMERGENCY");

        assertThat(registry.get("rate_limit_rejections_total").tag("key", "order").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("exchange_errors_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("failover_state").gauge().value()).isEqualTo(FailoverState.EMERGENCY.ordinal());
    }
}
