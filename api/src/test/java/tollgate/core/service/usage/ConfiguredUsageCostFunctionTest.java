package tollgate.core.service.usage;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.usage.RequestMetrics;

@DisplayName("ConfiguredUsageCostFunction")
class ConfiguredUsageCostFunctionTest {

    private final ConfiguredUsageCostFunction costFunction = new ConfiguredUsageCostFunction(
            4, 1.0, Map.of("embedding", 0.2), Map.of("large", 2.0));

    private static RequestMetrics.Builder metrics() {
        return RequestMetrics.builder("usage-1", Instant.parse("2026-03-14T12:00:00Z"));
    }

    @Test
    @DisplayName("reported token counts win over estimates")
    void reportedTokens() {
        var quantities = costFunction.quantify(
                "chat", metrics().requestBytes(4000).responseBytes(8000).tokensIn(12).tokensOut(34).build());

        assertEquals(12, quantities.tokensIn());
        assertEquals(34, quantities.tokensOut());
    }

    @Test
    @DisplayName("tokens are estimated from body sizes, rounded up")
    void estimatedTokens() {
        var quantities = costFunction.quantify("chat", metrics().requestBytes(10).responseBytes(0).build());

        assertEquals(3, quantities.tokensIn());
        assertEquals(0, quantities.tokensOut());
    }

    @Test
    @DisplayName("compute units are seconds times category and model weights")
    void computeUnits() {
        var chat = costFunction.quantify("chat", metrics().duration(Duration.ofMillis(1500)).build());
        var embedding = costFunction.quantify(
                "embedding", metrics().duration(Duration.ofSeconds(2)).model("large").build());
        var unknownModel = costFunction.quantify(
                "chat", metrics().duration(Duration.ofSeconds(1)).model("other").build());

        assertEquals(1.5, chat.computeUnits(), 1e-9);
        assertEquals(0.8, embedding.computeUnits(), 1e-9);
        assertEquals(1.0, unknownModel.computeUnits(), 1e-9);
    }

    @Test
    @DisplayName("storage bytes default to the request body size")
    void storageBytes() {
        var estimated = costFunction.quantify("storage", metrics().requestBytes(2048).build());
        var reported = costFunction.quantify("storage", metrics().requestBytes(2048).storageBytes(4096).build());

        assertEquals(2048, estimated.storageBytes());
        assertEquals(4096, reported.storageBytes());
    }

    @Test
    @DisplayName("rejects invalid settings")
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new ConfiguredUsageCostFunction(0, 1.0, Map.of(), Map.of()));
        assertThrows(
                IllegalArgumentException.class, () -> new ConfiguredUsageCostFunction(4, -0.5, Map.of(), Map.of()));
    }
}
