package appraiser.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.Authenticated;
import io.smallrye.mutiny.Uni;

import appraiser.adapter.in.dto.IssueKeyRequest;
import appraiser.adapter.in.dto.IssueKeyResponse;
import appraiser.adapter.in.dto.KeyResponse;
import appraiser.adapter.in.dto.MessageResponse;
import appraiser.adapter.in.dto.TokenRequest;
import appraiser.adapter.in.dto.TokenResponse;
import appraiser.adapter.in.problem.ApiProblem;
import appraiser.core.port.in.CredentialManagement;
import appraiser.core.port.in.SessionAuthentication;

/**
 * API key issuance, token exchange and key lifecycle.
 *
 * <p>Issuing a key and exchanging it for a token are anonymous; every other
 * operation requires a bearer session token.
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    static final String KEY_NOT_FOUND = "API key not found";

    private final CredentialManagement credentials;
    private final SessionAuthentication sessions;

    @Inject
    public AuthResource(CredentialManagement credentials, SessionAuthentication sessions) {
        this.credentials = credentials;
        this.sessions = sessions;
    }

    /**
     * Issue a new API key. The plaintext key is only returned in this response.
     */
    @POST
    @Path("/keys")
    public Uni<Response> issueKey(@NotNull @Valid IssueKeyRequest request) {
        return credentials
                .issue(request.name(), request.description())
                .map(result -> Response.status(Response.Status.CREATED)
                        .entity(IssueKeyResponse.from(result))
                        .build());
    }

    /**
     * Exchange an API key for a session token.
     */
    @POST
    @Path("/token")
    public Uni<TokenResponse> exchangeToken(@NotNull @Valid TokenRequest request) {
        return sessions.exchange(request.apiKey()).map(token -> token.map(TokenResponse::from)
                .orElseThrow(() -> ApiProblem.unauthorized("Invalid API key")));
    }

    @GET
    @Path("/keys")
    @Authenticated
    public Uni<List<KeyResponse>> listKeys(
            @QueryParam("skip") @DefaultValue("0") @Min(0) int skip,
            @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(1000) int limit) {
        return credentials
                .list(skip, limit)
                .map(keys -> keys.stream().map(KeyResponse::from).toList());
    }

    /**
     * Deactivate a key. Deactivating an inactive key succeeds again.
     */
    @DELETE
    @Path("/keys/{id}")
    @Authenticated
    public Uni<MessageResponse> deactivateKey(@PathParam("id") long id) {
        return credentials.deactivate(id).map(found -> {
            if (!found) {
                throw ApiProblem.notFound(KEY_NOT_FOUND);
            }
            return new MessageResponse("API key deactivated successfully");
        });
    }

    /**
     * Delete a key record. Soft deletion keeps the row for restore; hard deletion removes
     * it and detaches its audit entries.
     */
    @DELETE
    @Path("/keys/{id}/record")
    @Authenticated
    public Uni<MessageResponse> deleteKey(
            @PathParam("id") long id, @QueryParam("hard") @DefaultValue("false") boolean hard) {
        return credentials.delete(id, hard).map(found -> {
            if (!found) {
                throw ApiProblem.notFound(KEY_NOT_FOUND);
            }
            return new MessageResponse(hard ? "API key permanently deleted" : "API key deleted successfully");
        });
    }

    @POST
    @Path("/keys/{id}/restore")
    @Authenticated
    public Uni<KeyResponse> restoreKey(@PathParam("id") long id) {
        return credentials.restore(id).map(restored -> restored.map(KeyResponse::from)
                .orElseThrow(() -> ApiProblem.notFound("API key not found or not deleted")));
    }
}
