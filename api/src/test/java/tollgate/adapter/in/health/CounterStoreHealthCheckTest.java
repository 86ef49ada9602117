package tollgate.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.config.RateLimitingConfig;
import tollgate.core.model.ratelimit.CounterStoreState;
import tollgate.core.model.ratelimit.FailurePolicy;
import tollgate.core.port.in.AdmissionControl;

@DisplayName("CounterStoreHealthCheck")
class CounterStoreHealthCheckTest {

    private static final CounterStoreState DEGRADED =
            CounterStoreState.healthy("redis").failed(Instant.parse("2026-03-14T12:00:00Z"), "connection refused");

    private AdmissionControl admissionControl;
    private RateLimitingConfig config;
    private CounterStoreHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        admissionControl = mock(AdmissionControl.class);
        config = mock(RateLimitingConfig.class);
        when(config.failurePolicy()).thenReturn(FailurePolicy.FAIL_OPEN);
        when(admissionControl.counterStoreState()).thenReturn(CounterStoreState.healthy("redis"));

        healthCheck = new CounterStoreHealthCheck(admissionControl, config);
    }

    @Test
    @DisplayName("should return UP for a healthy store")
    void shouldReturnUpWhenHealthy() {
        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("counter-store", response.getName());
        var data = response.getData().get();
        assertEquals("redis", data.get("store"));
        assertEquals(false, data.get("degraded"));
        assertFalse(data.containsKey("lastError"));
    }

    @Test
    @DisplayName("should stay UP when degraded under fail-open")
    void shouldStayUpUnderFailOpen() {
        when(admissionControl.counterStoreState()).thenReturn(DEGRADED);

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        var data = response.getData().get();
        assertEquals(true, data.get("degraded"));
        assertEquals("connection refused", data.get("lastError"));
        assertEquals("2026-03-14T12:00:00Z", data.get("lastFailureAt"));
    }

    @Test
    @DisplayName("should return DOWN when degraded under fail-closed")
    void shouldReturnDownUnderFailClosed() {
        when(config.failurePolicy()).thenReturn(FailurePolicy.FAIL_CLOSED);
        when(admissionControl.counterStoreState()).thenReturn(DEGRADED);

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("FAIL_CLOSED", response.getData().get().get("failurePolicy"));
    }
}
