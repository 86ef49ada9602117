package tollgate.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import tollgate.adapter.in.dto.RateLimitStatusDto;
import tollgate.core.port.in.AdmissionControl;

/**
 * REST resource exposing an identity's current rate limit windows.
 *
 * <p>Reading the status does not count a request.
 */
@Path("/rate-limits")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RateLimitResource {

    private final AdmissionControl admissionControl;

    public RateLimitResource(AdmissionControl admissionControl) {
        this.admissionControl = admissionControl;
    }

    @GET
    @Path("/{identity}")
    public Uni<RateLimitStatusDto> status(@PathParam("identity") String identity, @QueryParam("tier") String tier) {
        return admissionControl.status(identity, tier).map(RateLimitStatusDto::fromModel);
    }
}
