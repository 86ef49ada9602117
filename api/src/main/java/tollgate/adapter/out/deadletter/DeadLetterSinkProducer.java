package tollgate.adapter.out.deadletter;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.core.config.UsageConfig;
import tollgate.core.port.out.DeadLetterSink;

/**
 * CDI producer for the usage dead-letter sink.
 */
@ApplicationScoped
public class DeadLetterSinkProducer {

    private static final Logger LOG = Logger.getLogger(DeadLetterSinkProducer.class);

    private final UsageConfig config;

    @Inject
    public DeadLetterSinkProducer(UsageConfig config) {
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public DeadLetterSink deadLetterSink() {
        return config.deadLetter()
                .path()
                .<DeadLetterSink>map(path -> {
                    LOG.infov("Dead-lettered usage records go to {0}", path);
                    return new FileDeadLetterSink(Path.of(path));
                })
                .orElseGet(() -> {
                    LOG.warn("No dead-letter path configured, dead-lettered usage records are kept in memory only");
                    return new InMemoryDeadLetterSink();
                });
    }
}
