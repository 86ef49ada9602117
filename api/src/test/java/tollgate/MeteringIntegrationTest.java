package tollgate;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import java.time.Duration;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import tollgate.mock.MutableClock;
import tollgate.mock.TestClockProducer;

@QuarkusTest
@DisplayName("Metering Integration Tests")
class MeteringIntegrationTest {

    private static final String ECHO = "/api/test/echo";

    @Inject
    MutableClock clock;

    private String identity;

    @BeforeEach
    void setUp() {
        clock.set(TestClockProducer.START);
        identity = "it-" + UUID.randomUUID();
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("Should add limit headers to admitted requests")
        void shouldAddLimitHeaders() {
            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "basic")
                .when()
                .get(ECHO)
                .then()
                .statusCode(200)
                .body(equalTo("ok"))
                .header("X-RateLimit-Limit", "100")
                .header("X-RateLimit-Remaining", "99")
                .header("X-RateLimit-Reset", "30")
                .header("X-Quota-Limit", "10000")
                .header("X-Quota-Remaining", "9999")
                .header("X-Usage-Id", notNullValue());
        }

        @Test
        @DisplayName("Should reject requests over the minute limit with 429")
        void shouldRejectOverLimit() {
            for (int i = 0; i < 20; i++) {
                given()
                    .header("X-Identity-Id", identity)
                    .header("X-Identity-Tier", "free")
                    .when()
                    .get(ECHO)
                    .then()
                    .statusCode(200);
            }

            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "free")
                .when()
                .get(ECHO)
                .then()
                .statusCode(429)
                .contentType("application/problem+json")
                .header("Retry-After", "30")
                .header("X-RateLimit-Remaining", "0")
                .body("status", equalTo(429))
                .body("window", equalTo("minute"))
                .body("limit", equalTo(20));
        }

        @Test
        @DisplayName("Should admit again once the window rolls over")
        void shouldAdmitAfterRollover() {
            for (int i = 0; i < 21; i++) {
                given()
                    .header("X-Identity-Id", identity)
                    .header("X-Identity-Tier", "free")
                    .get(ECHO);
            }

            clock.advance(Duration.ofSeconds(30));

            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "free")
                .when()
                .get(ECHO)
                .then()
                .statusCode(200)
                .header("X-RateLimit-Remaining", "19");
        }

        @Test
        @DisplayName("Should treat an unknown tier as the most restrictive one")
        void shouldFallBackForUnknownTier() {
            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "platinum")
                .when()
                .get(ECHO)
                .then()
                .statusCode(200)
                .header("X-RateLimit-Limit", "20");
        }
    }

    @Nested
    @DisplayName("Path Selection")
    class PathSelectionTests {

        @Test
        @DisplayName("Should not meter paths outside the metered prefixes")
        void shouldNotMeterOtherPaths() {
            given()
                .header("X-Identity-Id", identity)
                .when()
                .get("/q/health/live")
                .then()
                .statusCode(200)
                .header("X-Usage-Id", nullValue());
        }

        @Test
        @DisplayName("Should strip reported usage headers from the response")
        void shouldStripUsageHeaders() {
            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "pro")
                .body("hello")
                .when()
                .post(ECHO + "/generate")
                .then()
                .statusCode(200)
                .header("X-Usage-Tokens-In", nullValue())
                .header("X-Usage-Model", nullValue())
                .header("X-Usage-Id", notNullValue());
        }
    }

    @Nested
    @DisplayName("Rate Limit Status")
    class StatusTests {

        @Test
        @DisplayName("Should report window counts without counting")
        void shouldReportStatus() {
            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "basic")
                .get(ECHO);

            given()
                .queryParam("tier", "basic")
                .when()
                .get("/rate-limits/" + identity)
                .then()
                .statusCode(200)
                .body("tier", equalTo("basic"))
                .body("windows[0].window", equalTo("minute"))
                .body("windows[0].count", equalTo(1))
                .body("windows[0].remaining", equalTo(99));
        }

        @Test
        @DisplayName("Should reset counters through the admin API")
        void shouldResetCounters() {
            given()
                .header("X-Identity-Id", identity)
                .header("X-Identity-Tier", "basic")
                .get(ECHO);

            given().when().delete("/admin/rate-limits/" + identity).then().statusCode(204);

            given()
                .queryParam("tier", "basic")
                .when()
                .get("/rate-limits/" + identity)
                .then()
                .statusCode(200)
                .body("windows[0].count", equalTo(0));
        }
    }
}
