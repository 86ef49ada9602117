package tollgate.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.logging.Logger;

import tollgate.adapter.in.dto.TierPolicyDto;
import tollgate.adapter.in.dto.TierPolicyTableDto;
import tollgate.adapter.in.dto.UpdateTierPoliciesRequest;
import tollgate.core.port.in.TierPolicyManagement;

/**
 * REST resource for viewing and hot-swapping tier policies.
 *
 * <p>Both replacement and reload validate the complete table before it is
 * installed. An invalid table is answered with 400 and the active table stays
 * in place.
 */
@Path("/admin/tier-policies")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AdminTierPolicyResource {

    private static final Logger LOG = Logger.getLogger(AdminTierPolicyResource.class);

    private final TierPolicyManagement policies;

    public AdminTierPolicyResource(TierPolicyManagement policies) {
        this.policies = policies;
    }

    @GET
    public TierPolicyTableDto current() {
        return TierPolicyTableDto.fromModel(policies.current());
    }

    @PUT
    @Consumes(MediaType.APPLICATION_JSON)
    public TierPolicyTableDto replace(@Valid @NotNull UpdateTierPoliciesRequest request) {
        final var table = policies.replace(
                request.tiers().stream().map(TierPolicyDto::toModel).toList());
        LOG.infov("Tier policies replaced through admin API, now version {0}", table.version());
        return TierPolicyTableDto.fromModel(table);
    }

    @POST
    @Path("/reload")
    public TierPolicyTableDto reload() {
        return TierPolicyTableDto.fromModel(policies.reload());
    }
}
