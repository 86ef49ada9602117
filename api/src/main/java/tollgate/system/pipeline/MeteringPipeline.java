package tollgate.system.pipeline;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Ordered composition of {@link MeteringStage}s.
 *
 * <p>On the way in, stages run in ascending order until one halts. On the way
 * out, every stage whose {@code onRequest} ran (including a halting one) sees
 * the response, in descending order.
 */
@ApplicationScoped
public class MeteringPipeline {

    private static final Logger LOG = Logger.getLogger(MeteringPipeline.class);

    private final List<MeteringStage> stages;

    @Inject
    public MeteringPipeline(Instance<MeteringStage> stages) {
        this(stages.stream().toList());
    }

    public MeteringPipeline(List<MeteringStage> stages) {
        this.stages = stages.stream()
                .sorted(Comparator.comparingInt(MeteringStage::order))
                .toList();
        LOG.infov(
                "Metering pipeline: {0}",
                this.stages.stream()
                        .map(stage -> stage.name() + "(" + stage.order() + ")")
                        .toList());
    }

    /**
     * Run the request side.
     *
     * @param context the request's metering context
     * @return Uni with the halting stage's response, or null to let the request through
     */
    public Uni<Response> onRequest(MeteringContext context) {
        return runFrom(0, context);
    }

    /**
     * Run the response side for every stage that saw the request.
     */
    public void onResponse(MeteringContext context) {
        final var ran = context.ranStages();
        for (var i = ran.size() - 1; i >= 0; i--) {
            final var stage = ran.get(i);
            try {
                stage.onResponse(context);
            } catch (RuntimeException e) {
                LOG.errorv(e, "Metering stage {0} failed on response for {1}", stage.name(), context.path());
            }
        }
    }

    public List<MeteringStage> stages() {
        return stages;
    }

    private Uni<Response> runFrom(int index, MeteringContext context) {
        if (index >= stages.size()) {
            return Uni.createFrom().nullItem();
        }
        final var stage = stages.get(index);
        context.markRan(stage);
        return stage.onRequest(context).flatMap(result -> {
            if (result.halted()) {
                return Uni.createFrom().item(result.response());
            }
            return runFrom(index + 1, context);
        });
    }
}
