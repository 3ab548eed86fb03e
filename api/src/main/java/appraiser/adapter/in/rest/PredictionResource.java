package appraiser.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import io.smallrye.mutiny.Uni;

import appraiser.adapter.in.auth.SessionTokenIdentityProvider;
import appraiser.adapter.in.dto.BatchPredictionRequest;
import appraiser.adapter.in.dto.BatchPredictionResponse;
import appraiser.adapter.in.dto.HouseFeaturesDto;
import appraiser.adapter.in.dto.PredictionResponse;
import appraiser.core.port.in.HousePricing;

/**
 * House price estimates for authenticated callers.
 */
@Path("/predict")
@ApplicationScoped
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PredictionResource {

    private final HousePricing pricing;
    private final SecurityIdentity identity;

    @Inject
    public PredictionResource(HousePricing pricing, SecurityIdentity identity) {
        this.pricing = pricing;
        this.identity = identity;
    }

    @POST
    public Uni<PredictionResponse> predict(@NotNull @Valid HouseFeaturesDto features) {
        var caller = SessionTokenIdentityProvider.callerOf(identity);
        return pricing.predict(features.toModel(), caller).map(PredictionResponse::from);
    }

    /**
     * Estimate up to 100 houses in one request. All estimates share a batch id in the audit log.
     */
    @POST
    @Path("/batch")
    public Uni<BatchPredictionResponse> predictBatch(@NotNull @Valid BatchPredictionRequest request) {
        var caller = SessionTokenIdentityProvider.callerOf(identity);
        var houses = request.houses().stream().map(HouseFeaturesDto::toModel).toList();
        return pricing.predictBatch(houses, caller).map(BatchPredictionResponse::from);
    }
}
