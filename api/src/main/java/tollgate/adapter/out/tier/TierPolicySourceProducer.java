package tollgate.adapter.out.tier;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import tollgate.core.config.TierConfig;
import tollgate.core.port.out.TierPolicySource;

/**
 * CDI producer for the tier policy source.
 *
 * <p>A JSON file wins when {@code tollgate.tiers.file} is set, otherwise
 * policies come from configuration properties.
 */
@ApplicationScoped
public class TierPolicySourceProducer {

    private static final Logger LOG = Logger.getLogger(TierPolicySourceProducer.class);

    private final TierConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public TierPolicySourceProducer(TierConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Produces
    @ApplicationScoped
    public TierPolicySource tierPolicySource() {
        final TierPolicySource source = config.file()
                .<TierPolicySource>map(file -> new JsonFileTierPolicySource(Path.of(file), objectMapper))
                .orElseGet(() -> new ConfiguredTierPolicySource(config));
        LOG.infov("Tier policies will be loaded from {0}", source.describe());
        return source;
    }
}
