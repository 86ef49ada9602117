package tollgate.system.pipeline;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.core.config.RateLimitingConfig;
import tollgate.core.config.TelemetryConfig;
import tollgate.core.model.ratelimit.AdmissionDecision;
import tollgate.core.model.ratelimit.WindowStatus;
import tollgate.core.model.tier.Tier;
import tollgate.core.model.tier.TierPolicy;
import tollgate.core.model.window.WindowKind;
import tollgate.core.port.in.AdmissionControl;
import tollgate.mock.TestConfigs;

@DisplayName("AdmissionStage")
class AdmissionStageTest {

    private static final AdmissionDecision ALLOWED = AdmissionDecision.fromWindows(
            "alice",
            Tier.BASIC,
            List.of(
                    WindowStatus.evaluate(WindowKind.MINUTE, 100, 40, 30),
                    WindowStatus.evaluate(WindowKind.HOUR, 1000, 400, 1800),
                    WindowStatus.evaluate(WindowKind.DAY, 10000, 4000, 43200)),
            false,
            false,
            "u-1");

    private static final AdmissionDecision LIMITED = AdmissionDecision.fromWindows(
            "alice",
            Tier.BASIC,
            List.of(
                    WindowStatus.evaluate(WindowKind.MINUTE, 100, 101, 30),
                    WindowStatus.evaluate(WindowKind.HOUR, 1000, 500, 1800),
                    WindowStatus.evaluate(WindowKind.DAY, 10000, 4000, 43200)),
            false,
            false,
            "u-2");

    private AdmissionControl admission;
    private RateLimitingConfig config;
    private AdmissionStage stage;
    private MeteringContext context;

    @BeforeEach
    void setUp() {
        admission = mock(AdmissionControl.class);
        config = TestConfigs.rateLimiting();
        stage = new AdmissionStage(admission, config, TestConfigs.telemetry(false));
        context = new MeteringContext("alice", "basic", "chat", "/api/chat", Instant.EPOCH, 0);
    }

    @Nested
    @DisplayName("onRequest")
    class OnRequest {

        @Test
        @DisplayName("lets allowed requests through and keeps the decision")
        void allowed() {
            when(admission.check("alice", "basic")).thenReturn(Uni.createFrom().item(ALLOWED));

            var result = stage.onRequest(context).await().indefinitely();

            assertFalse(result.halted());
            assertEquals(ALLOWED, context.decision().orElseThrow());
        }

        @Test
        @DisplayName("rejects with 429, Retry-After and limit headers")
        void rateLimited() {
            when(admission.check("alice", "basic")).thenReturn(Uni.createFrom().item(LIMITED));

            var result = stage.onRequest(context).await().indefinitely();

            assertTrue(result.halted());
            var response = result.response();
            assertEquals(429, response.getStatus());
            assertEquals("30", response.getHeaderString("Retry-After"));
            assertEquals("0", response.getHeaderString(AdmissionStage.HEADER_REMAINING));
            assertEquals("100", response.getHeaderString(AdmissionStage.HEADER_LIMIT));
            assertEquals("u-2", response.getHeaderString(AdmissionStage.HEADER_USAGE_ID));
        }

        @Test
        @DisplayName("rejects with 503 when the limiter is unavailable")
        void unavailable() {
            var decision = AdmissionDecision.unavailable("alice", Tier.BASIC, 5, false, "u-3");
            when(admission.check("alice", "basic")).thenReturn(Uni.createFrom().item(decision));

            var response = stage.onRequest(context).await().indefinitely().response();

            assertEquals(503, response.getStatus());
            assertEquals("5", response.getHeaderString("Retry-After"));
            assertEquals("true", response.getHeaderString(AdmissionStage.HEADER_DEGRADED));
        }
    }

    @Nested
    @DisplayName("headers")
    class Headers {

        @Test
        @DisplayName("describes the minute window and the daily quota")
        void allowedHeaders() {
            var headers = stage.headersFor(ALLOWED);

            assertEquals("u-1", headers.get(AdmissionStage.HEADER_USAGE_ID));
            assertEquals("100", headers.get(AdmissionStage.HEADER_LIMIT));
            assertEquals("60", headers.get(AdmissionStage.HEADER_REMAINING));
            assertEquals("30", headers.get(AdmissionStage.HEADER_RESET));
            assertEquals("10000", headers.get(AdmissionStage.HEADER_QUOTA_LIMIT));
            assertEquals("6000", headers.get(AdmissionStage.HEADER_QUOTA_REMAINING));
            assertEquals("43200", headers.get(AdmissionStage.HEADER_QUOTA_RESET));
            assertFalse(headers.containsKey(AdmissionStage.HEADER_DEGRADED));
        }

        @Test
        @DisplayName("renders unlimited windows as unlimited")
        void unlimitedDay() {
            var decision = AdmissionDecision.fromWindows(
                    "acme",
                    Tier.ENTERPRISE,
                    List.of(
                            WindowStatus.evaluate(WindowKind.MINUTE, 2000, 1, 30),
                            WindowStatus.evaluate(WindowKind.HOUR, 20000, 1, 1800),
                            WindowStatus.evaluate(WindowKind.DAY, TierPolicy.UNLIMITED, 1, 43200)),
                    false,
                    false,
                    "u-4");

            var headers = stage.headersFor(decision);

            assertEquals(AdmissionStage.UNLIMITED, headers.get(AdmissionStage.HEADER_QUOTA_LIMIT));
            assertEquals(AdmissionStage.UNLIMITED, headers.get(AdmissionStage.HEADER_QUOTA_REMAINING));
        }

        @Test
        @DisplayName("omits limit headers when there are no counts")
        void degradedWithoutCounts() {
            var headers = stage.headersFor(AdmissionDecision.degradedAllow("alice", Tier.BASIC, false, "u-5"));

            assertEquals("true", headers.get(AdmissionStage.HEADER_DEGRADED));
            assertFalse(headers.containsKey(AdmissionStage.HEADER_LIMIT));
        }

        @Test
        @DisplayName("keeps only the usage id when limit headers are switched off")
        void headersDisabled() {
            when(config.includeHeaders()).thenReturn(false);

            var headers = stage.headersFor(ALLOWED);

            assertEquals(1, headers.size());
            assertEquals("u-1", headers.get(AdmissionStage.HEADER_USAGE_ID));
        }

        @Test
        @DisplayName("adds the headers to the handler's response")
        void onResponse() {
            context.decision(ALLOWED);

            stage.onResponse(context);

            assertEquals("60", context.responseHeaders().getFirst(AdmissionStage.HEADER_REMAINING));
        }
    }
}
