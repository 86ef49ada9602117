package tollgate.core.service.usage;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;

import tollgate.core.config.UsageConfig;
import tollgate.core.model.usage.RequestMetrics;
import tollgate.core.model.usage.UsageQuantities;

/**
 * Default cost function driven by configuration.
 *
 * <ul>
 *   <li>Tokens: the reported counts, otherwise {@code ceil(bytes / charsPerToken)}
 *       of the request (in) and response (out) payloads.</li>
 *   <li>Compute units: request seconds times the category weight times the model
 *       weight. Unknown categories and models weigh the default weight and 1.0.</li>
 *   <li>Storage bytes: the reported value, otherwise the request payload size.</li>
 * </ul>
 */
@DefaultBean
@ApplicationScoped
public class ConfiguredUsageCostFunction implements UsageCostFunction {

    private final int charsPerToken;
    private final double defaultWeight;
    private final Map<String, Double> categoryWeights;
    private final Map<String, Double> modelWeights;

    @Inject
    public ConfiguredUsageCostFunction(UsageConfig config) {
        this(
                config.cost().charsPerToken(),
                config.cost().defaultWeight(),
                config.cost().categoryWeights(),
                config.cost().modelWeights());
    }

    public ConfiguredUsageCostFunction(
            int charsPerToken,
            double defaultWeight,
            Map<String, Double> categoryWeights,
            Map<String, Double> modelWeights) {
        if (charsPerToken < 1) {
            throw new IllegalArgumentException("charsPerToken must be at least 1, got " + charsPerToken);
        }
        if (defaultWeight < 0) {
            throw new IllegalArgumentException("defaultWeight cannot be negative, got " + defaultWeight);
        }
        this.charsPerToken = charsPerToken;
        this.defaultWeight = defaultWeight;
        this.categoryWeights = Map.copyOf(categoryWeights);
        this.modelWeights = Map.copyOf(modelWeights);
    }

    @Override
    public UsageQuantities quantify(String category, RequestMetrics metrics) {
        final var tokensIn = metrics.tokensIn().orElseGet(() -> estimateTokens(metrics.requestBytes()));
        final var tokensOut = metrics.tokensOut().orElseGet(() -> estimateTokens(metrics.responseBytes()));
        final var seconds = metrics.duration().toNanos() / 1_000_000_000.0;
        final var categoryWeight = categoryWeights.getOrDefault(category, defaultWeight);
        final var modelWeight =
                metrics.model().map(model -> modelWeights.getOrDefault(model, 1.0)).orElse(1.0);
        final var storageBytes = metrics.storageBytes().orElse(metrics.requestBytes());

        return new UsageQuantities(
                Math.max(0, tokensIn),
                Math.max(0, tokensOut),
                seconds * categoryWeight * modelWeight,
                Math.max(0, storageBytes));
    }

    private long estimateTokens(long bytes) {
        if (bytes <= 0) {
            return 0;
        }
        return (bytes + charsPerToken - 1) / charsPerToken;
    }
}
