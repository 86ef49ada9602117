package tollgate.system.pipeline;

import io.smallrye.mutiny.Uni;

/**
 * One step of the metering pipeline.
 *
 * <p>Stages are CDI beans discovered by {@link MeteringPipeline}. {@code onRequest}
 * runs in ascending {@link #order()}; {@code onResponse} runs in descending order,
 * and only for stages whose {@code onRequest} ran.
 */
public interface MeteringStage {

    /**
     * Position in the pipeline. Lower runs first on the way in.
     */
    int order();

    /**
     * Inspect the request before it reaches the handler.
     *
     * @param context the request's metering context
     * @return Uni with {@link StageResult#proceed()} or a halting result
     */
    Uni<StageResult> onRequest(MeteringContext context);

    /**
     * Observe the completed response. Must not throw.
     *
     * @param context the request's metering context, with response fields filled in
     */
    default void onResponse(MeteringContext context) {}

    default String name() {
        return getClass().getSimpleName();
    }
}
