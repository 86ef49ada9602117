package tollgate.adapter.out.tier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import tollgate.core.model.tier.TierPolicy;
import tollgate.core.port.out.TierPolicySource;

/**
 * Reads tier policies from a JSON file on every load, so a reload picks up edits.
 */
public class JsonFileTierPolicySource implements TierPolicySource {

    private static final Logger LOG = Logger.getLogger(JsonFileTierPolicySource.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileTierPolicySource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<TierPolicy> load() {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Tier policy file not found: " + path);
        }
        try {
            final var schema = objectMapper.readValue(Files.readString(path), TierPolicyFileSchema.class);
            final var policies = schema.toPolicies();
            LOG.infof("Read %d tier policies from %s (file version %d)", policies.size(), path, schema.version());
            return policies;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read tier policy file: " + path, e);
        }
    }

    @Override
    public String describe() {
        return "file:" + path;
    }
}
