package appraiser.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import appraiser.adapter.in.auth.SessionTokenIdentityProvider;
import appraiser.adapter.in.dto.PredictionLogListResponse;
import appraiser.adapter.in.dto.PredictionLogResponse;
import appraiser.adapter.in.dto.PredictionStatsResponse;
import appraiser.adapter.in.problem.ApiProblem;
import appraiser.core.model.audit.LogAccess;
import appraiser.core.port.in.PredictionLogQuery;

/**
 * Read access to the caller's own prediction audit trail.
 */
@Path("/logs")
@ApplicationScoped
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
public class PredictionLogResource {

    private final PredictionLogQuery logs;
    private final SecurityIdentity identity;

    @Inject
    public PredictionLogResource(PredictionLogQuery logs, SecurityIdentity identity) {
        this.logs = logs;
        this.identity = identity;
    }

    @GET
    public Uni<PredictionLogListResponse> listLogs(
            @QueryParam("skip") @DefaultValue("0") @Min(0) int skip,
            @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(1000) int limit) {
        var caller = SessionTokenIdentityProvider.callerOf(identity);
        return logs.listOwn(caller, skip, limit).map(PredictionLogListResponse::from);
    }

    @GET
    @Path("/stats")
    public Uni<PredictionStatsResponse> stats() {
        var caller = SessionTokenIdentityProvider.callerOf(identity);
        return logs.stats(caller).map(PredictionStatsResponse::from);
    }

    @GET
    @Path("/{id}")
    public Uni<PredictionLogResponse> getLog(@PathParam("id") long id) {
        var caller = SessionTokenIdentityProvider.callerOf(identity);
        return logs.get(caller, id).map(access -> {
            if (access instanceof LogAccess.Granted granted) {
                return PredictionLogResponse.from(granted.log());
            }
            if (access instanceof LogAccess.Forbidden) {
                throw ApiProblem.forbidden("Not authorized to view this log");
            }
            throw ApiProblem.notFound("Prediction log not found");
        });
    }
}
