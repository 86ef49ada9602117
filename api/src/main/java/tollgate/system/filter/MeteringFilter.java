package tollgate.system.filter;

import java.time.Clock;
import java.util.function.LongConsumer;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import tollgate.core.config.MeteringConfig;
import tollgate.system.pipeline.MeteringContext;
import tollgate.system.pipeline.MeteringPipeline;

/**
 * Reactive filter that applies the metering pipeline to metered paths.
 *
 * <p>The identity and tier are read from headers set by the upstream auth
 * layer. Requests without an identity are metered under the anonymous
 * identity. Business handlers can report exact usage through
 * {@code X-Usage-*} response headers, which are consumed here and never
 * reach the client.
 *
 * <p>Runs after authentication so that the identity headers are final.
 */
public class MeteringFilter {

    private static final Logger LOG = Logger.getLogger(MeteringFilter.class);

    static final String METERING_CONTEXT = "tollgate.metering.context";
    static final String HEADER_TOKENS_IN = "X-Usage-Tokens-In";
    static final String HEADER_TOKENS_OUT = "X-Usage-Tokens-Out";
    static final String HEADER_MODEL = "X-Usage-Model";
    static final String HEADER_STORAGE_BYTES = "X-Usage-Storage-Bytes";

    private final MeteringPipeline pipeline;
    private final MeteringConfig config;
    private final MeteredPaths paths;
    private final Clock clock;

    @Inject
    public MeteringFilter(MeteringPipeline pipeline, MeteringConfig config, Clock clock) {
        this.pipeline = pipeline;
        this.config = config;
        this.paths = MeteredPaths.from(config);
        this.clock = clock;
    }

    /**
     * Run the request side of the pipeline.
     *
     * @param requestContext the request context
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHORIZATION + 100)
    public Uni<Response> meterRequest(ContainerRequestContext requestContext) {
        if (!config.enabled()) {
            return Uni.createFrom().nullItem();
        }

        final var path = requestContext.getUriInfo().getPath();
        if (!paths.isMetered(path)) {
            return Uni.createFrom().nullItem();
        }

        final var context = new MeteringContext(
                identityOf(requestContext),
                requestContext.getHeaderString(config.tierHeader()),
                paths.categoryFor(path),
                path,
                clock.instant(),
                requestContext.getLength());
        requestContext.setProperty(METERING_CONTEXT, context);
        return pipeline.onRequest(context);
    }

    /**
     * Run the response side of the pipeline for requests the request side saw.
     */
    @ServerResponseFilter
    public void meterResponse(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!(requestContext.getProperty(METERING_CONTEXT) instanceof MeteringContext context)) {
            return;
        }

        final var headers = responseContext.getHeaders();
        consumeReportedUsage(context, headers);
        context.completed(responseContext.getStatus(), responseContext.getLength(), headers);
        pipeline.onResponse(context);
    }

    private String identityOf(ContainerRequestContext requestContext) {
        final var identity = requestContext.getHeaderString(config.identityHeader());
        if (identity == null || identity.isBlank()) {
            return config.anonymousIdentity();
        }
        return identity.trim();
    }

    private void consumeReportedUsage(MeteringContext context, MultivaluedMap<String, Object> headers) {
        readLong(headers, HEADER_TOKENS_IN, context::reportedTokensIn);
        readLong(headers, HEADER_TOKENS_OUT, context::reportedTokensOut);
        readLong(headers, HEADER_STORAGE_BYTES, context::reportedStorageBytes);
        final var model = headers.remove(HEADER_MODEL);
        if (model != null && !model.isEmpty() && model.get(0) != null) {
            context.reportedModel(String.valueOf(model.get(0)).trim());
        }
    }

    private void readLong(MultivaluedMap<String, Object> headers, String name, LongConsumer target) {
        final var values = headers.remove(name);
        if (values == null || values.isEmpty() || values.get(0) == null) {
            return;
        }
        final var raw = String.valueOf(values.get(0)).trim();
        try {
            final var value = Long.parseLong(raw);
            if (value >= 0) {
                target.accept(value);
            }
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric %s header: %s", name, raw);
        }
    }
}
