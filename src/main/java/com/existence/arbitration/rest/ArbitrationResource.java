package com.existence.arbitration.rest;

import com.existence.arbitration.api.Page;
import com.existence.arbitration.api.PageRequest;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.engine.TransitionResult;
import com.existence.arbitration.reconcile.ReconcileResult;
import com.existence.arbitration.rest.dto.ActorRequest;
import com.existence.arbitration.rest.dto.InconsistencyResponse;
import com.existence.arbitration.rest.dto.ReconcileResponse;
import com.existence.arbitration.rest.dto.RejectRequest;
import com.existence.arbitration.rest.dto.TransitionResponse;
import com.existence.arbitration.api.ExistenceEngineRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * REST resource for reconciliation and human arbitration of pending bindings.
 */
@Path("/api/v1/scopes/{scopeId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Arbitration", description = "Reconciliation passes and the human review queue")
public class ArbitrationResource {
    private static final Logger log = LoggerFactory.getLogger(ArbitrationResource.class);

    private final ExistenceEngineRegistry registry;

    @Inject
    public ArbitrationResource(ExistenceEngineRegistry registry) {
        this.registry = registry;
    }

    /**
     * Runs a reconciliation pass.
     *
     * POST /api/v1/scopes/{scopeId}/reconcile?autoFix=true
     */
    @POST
    @Path("/reconcile")
    @Operation(summary = "Reconcile scope",
            description = "Detects divergences between the canvas and document projections. High-confidence "
                    + "findings are repaired when autoFix is set, the rest are queued for review.")
    @APIResponse(responseCode = "200", description = "Reconciliation completed")
    @APIResponse(responseCode = "500", description = "Projection signals unavailable")
    public Response reconcile(@PathParam("scopeId") String scopeId,
                              @QueryParam("autoFix") @DefaultValue("true") boolean autoFix) {
        String path = "/api/v1/scopes/" + scopeId + "/reconcile";
        try {
            ReconcileResult result = registry.forScope(scopeId).reconcile(scopeId, autoFix);
            return Response.ok(ReconcileResponse.from(result)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "reconcile", path, log);
        }
    }

    /**
     * GET /api/v1/scopes/{scopeId}/reviews?page=0&size=20
     */
    @GET
    @Path("/reviews")
    @Operation(summary = "List pending reviews", description = "Returns open findings whose binding awaits a human decision.")
    public Response getPendingReviews(@PathParam("scopeId") String scopeId,
                                      @QueryParam("page") @DefaultValue("0") int page,
                                      @QueryParam("size") @DefaultValue("20") int size) {
        String path = "/api/v1/scopes/" + scopeId + "/reviews";
        try {
            Page<Inconsistency> result = registry.forScope(scopeId).getPendingReviews(PageRequest.of(page, size));
            Page<InconsistencyResponse> body = new Page<>(
                    result.content().stream().map(InconsistencyResponse::from).toList(),
                    result.totalElements(), result.pageNumber(), result.pageSize());
            return Response.ok(body).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getPendingReviews", path, log);
        }
    }

    /**
     * POST /api/v1/scopes/{scopeId}/bindings/{id}/approve
     */
    @POST
    @Path("/bindings/{id}/approve")
    @Operation(summary = "Approve binding", description = "Makes a pending binding visible and closes its open finding.")
    @APIResponse(responseCode = "200", description = "Binding approved")
    @APIResponse(responseCode = "403", description = "Actor does not match the authenticated principal")
    @APIResponse(responseCode = "404", description = "Binding not found")
    public Response approve(@PathParam("scopeId") String scopeId,
                            @Parameter(description = "Binding ID") @PathParam("id") String bindingId,
                            ActorRequest request, @Context SecurityContext securityContext) {
        String path = "/api/v1/scopes/" + scopeId + "/bindings/" + bindingId + "/approve";
        if (request == null) {
            return ErrorResponses.badRequest("actorId is required", path);
        }
        Optional<Response> forbidden = ErrorResponses.checkActor(securityContext, request.actorId(), path);
        if (forbidden.isPresent()) {
            return forbidden.get();
        }
        try {
            TransitionResult result = registry.forScope(scopeId).approve(bindingId, request.actorId());
            return Response.ok(TransitionResponse.from(result)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "approveBinding", path, log);
        }
    }

    /**
     * POST /api/v1/scopes/{scopeId}/bindings/{id}/reject
     */
    @POST
    @Path("/bindings/{id}/reject")
    @Operation(summary = "Reject binding", description = "Soft-deletes a pending binding and closes its open finding.")
    @APIResponse(responseCode = "200", description = "Binding rejected")
    @APIResponse(responseCode = "403", description = "Actor does not match the authenticated principal")
    @APIResponse(responseCode = "404", description = "Binding not found")
    public Response reject(@PathParam("scopeId") String scopeId,
                           @Parameter(description = "Binding ID") @PathParam("id") String bindingId,
                           RejectRequest request, @Context SecurityContext securityContext) {
        String path = "/api/v1/scopes/" + scopeId + "/bindings/" + bindingId + "/reject";
        if (request == null) {
            return ErrorResponses.badRequest("userId and reason are required", path);
        }
        Optional<Response> forbidden = ErrorResponses.checkActor(securityContext, request.userId(), path);
        if (forbidden.isPresent()) {
            return forbidden.get();
        }
        try {
            TransitionResult result = registry.forScope(scopeId)
                    .reject(bindingId, request.userId(), request.reason());
            return Response.ok(TransitionResponse.from(result)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "rejectBinding", path, log);
        }
    }
}
