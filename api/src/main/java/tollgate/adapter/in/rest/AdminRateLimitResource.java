package tollgate.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.port.in.AdmissionControl;

/**
 * REST resource for rate limit administration.
 *
 * <p>Access control is left to the external auth layer in front of {@code /admin}.
 */
@Path("/admin/rate-limits")
@ApplicationScoped
public class AdminRateLimitResource {

    private static final Logger LOG = Logger.getLogger(AdminRateLimitResource.class);

    private final AdmissionControl admissionControl;

    public AdminRateLimitResource(AdmissionControl admissionControl) {
        this.admissionControl = admissionControl;
    }

    /**
     * Clear an identity's counters for the current windows.
     */
    @DELETE
    @Path("/{identity}")
    public Uni<Response> reset(@PathParam("identity") String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity is required");
        }
        return admissionControl.reset(identity).map(ignored -> {
            LOG.infov("Rate limit counters reset for {0}", identity);
            return Response.noContent().build();
        });
    }
}
