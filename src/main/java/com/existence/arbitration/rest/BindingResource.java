package com.existence.arbitration.rest;

import com.existence.arbitration.api.ExistenceEngine;
import com.existence.arbitration.api.ExistenceEngineRegistry;
import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.engine.TransitionResult;
import com.existence.arbitration.rest.dto.ActorRequest;
import com.existence.arbitration.rest.dto.BindingResponse;
import com.existence.arbitration.rest.dto.ElementIdsRequest;
import com.existence.arbitration.rest.dto.StatusLogResponse;
import com.existence.arbitration.rest.dto.TransitionResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * REST resource for binding queries and user-driven status changes within a scope.
 */
@Path("/api/v1/scopes/{scopeId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Bindings", description = "Binding status queries and user-driven visibility changes")
public class BindingResource {
    private static final Logger log = LoggerFactory.getLogger(BindingResource.class);

    private final ExistenceEngineRegistry registry;

    @Inject
    public BindingResource(ExistenceEngineRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/v1/scopes/{scopeId}/bindings/{id}
     */
    @GET
    @Path("/bindings/{id}")
    @Operation(summary = "Get binding", description = "Returns the stored binding record.")
    @APIResponse(responseCode = "200", description = "Binding found")
    @APIResponse(responseCode = "404", description = "Binding not found in this scope")
    public Response getBinding(@PathParam("scopeId") String scopeId,
                               @Parameter(description = "Binding ID") @PathParam("id") String bindingId) {
        String path = base(scopeId) + "/bindings/" + bindingId;
        try {
            Optional<Binding> binding = registry.forScope(scopeId).getBinding(bindingId)
                    .filter(b -> scopeId.equals(b.getContainerId()));
            if (binding.isEmpty()) {
                return ErrorResponses.notFound("Unknown binding: " + bindingId, path);
            }
            return Response.ok(BindingResponse.from(binding.get())).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getBinding", path, log);
        }
    }

    /**
     * GET /api/v1/scopes/{scopeId}/bindings?status=hidden
     */
    @GET
    @Path("/bindings")
    @Operation(summary = "List bindings by status", description = "Returns the ids of indexed bindings with the given status.")
    @APIResponse(responseCode = "400", description = "Missing or unknown status")
    public Response getBindingsByStatus(@PathParam("scopeId") String scopeId,
                                        @Parameter(description = "visible, hidden, deleted or pending")
                                        @QueryParam("status") String status) {
        String path = base(scopeId) + "/bindings";
        try {
            BindingStatus parsed = BindingStatus.fromWireName(status);
            List<String> ids = registry.forScope(scopeId).getBindingsByStatus(parsed);
            return Response.ok(Map.of("status", parsed.wireName(), "bindingIds", ids)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getBindingsByStatus", path, log);
        }
    }

    /**
     * GET /api/v1/scopes/{scopeId}/elements/{elementId}/binding
     */
    @GET
    @Path("/elements/{elementId}/binding")
    @Operation(summary = "Find binding by element", description = "Returns the binding linked to a canvas element.")
    @APIResponse(responseCode = "404", description = "Element is not bound")
    public Response getBindingByElement(@PathParam("scopeId") String scopeId,
                                        @PathParam("elementId") String elementId) {
        String path = base(scopeId) + "/elements/" + elementId + "/binding";
        try {
            ExistenceEngine engine = registry.forScope(scopeId);
            Optional<String> bindingId = engine.getBindingByElementId(elementId);
            if (bindingId.isEmpty()) {
                return ErrorResponses.notFound("No binding for element: " + elementId, path);
            }
            return Response.ok(Map.of(
                    "elementId", elementId,
                    "bindingId", bindingId.get(),
                    "status", engine.getStatus(bindingId.get()).map(BindingStatus::wireName).orElse("unknown")
            )).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getBindingByElement", path, log);
        }
    }

    /**
     * GET /api/v1/scopes/{scopeId}/blocks/{blockId}/bindings
     */
    @GET
    @Path("/blocks/{blockId}/bindings")
    @Operation(summary = "List bindings of a block", description = "Returns the ids of bindings linked to a document block.")
    public Response getBindingsByBlock(@PathParam("scopeId") String scopeId,
                                       @PathParam("blockId") String blockId) {
        String path = base(scopeId) + "/blocks/" + blockId + "/bindings";
        try {
            Set<String> ids = registry.forScope(scopeId).getBindingsByBlockId(blockId);
            return Response.ok(Map.of("blockId", blockId, "bindingIds", ids)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getBindingsByBlock", path, log);
        }
    }

    /**
     * GET /api/v1/scopes/{scopeId}/bindings/{id}/history
     */
    @GET
    @Path("/bindings/{id}/history")
    @Operation(summary = "Status history", description = "Returns the append-only status log of a binding, oldest first.")
    public Response getHistory(@PathParam("scopeId") String scopeId,
                               @PathParam("id") String bindingId) {
        String path = base(scopeId) + "/bindings/" + bindingId + "/history";
        try {
            List<StatusLogResponse> history = registry.forScope(scopeId).getStatusHistory(bindingId).stream()
                    .map(StatusLogResponse::from)
                    .toList();
            return Response.ok(history).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getHistory", path, log);
        }
    }

    /**
     * GET /api/v1/scopes/{scopeId}/status
     */
    @GET
    @Path("/status")
    @Operation(summary = "Engine status", description = "Returns index and cache sizes for the scope.")
    public Response getEngineStatus(@PathParam("scopeId") String scopeId) {
        String path = base(scopeId) + "/status";
        try {
            return Response.ok(registry.forScope(scopeId).getEngineStatus()).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, "getEngineStatus", path, log);
        }
    }

    @POST
    @Path("/bindings/{id}/hide")
    @Operation(summary = "Hide binding")
    @APIResponse(responseCode = "200", description = "Transition applied or already hidden")
    @APIResponse(responseCode = "403", description = "Actor does not match the authenticated principal")
    @APIResponse(responseCode = "404", description = "Binding not found")
    @APIResponse(responseCode = "409", description = "Transition not allowed or concurrent modification")
    public Response hide(@PathParam("scopeId") String scopeId, @PathParam("id") String bindingId,
                         ActorRequest request, @Context SecurityContext securityContext) {
        return transition(scopeId, bindingId, "hide", request, securityContext, ExistenceEngine::hide);
    }

    @POST
    @Path("/bindings/{id}/show")
    @Operation(summary = "Show binding")
    public Response show(@PathParam("scopeId") String scopeId, @PathParam("id") String bindingId,
                         ActorRequest request, @Context SecurityContext securityContext) {
        return transition(scopeId, bindingId, "show", request, securityContext, ExistenceEngine::show);
    }

    @POST
    @Path("/bindings/{id}/delete")
    @Operation(summary = "Soft-delete binding", description = "Tombstones the binding. The record is kept and can be restored.")
    public Response softDelete(@PathParam("scopeId") String scopeId, @PathParam("id") String bindingId,
                               ActorRequest request, @Context SecurityContext securityContext) {
        return transition(scopeId, bindingId, "delete", request, securityContext, ExistenceEngine::softDelete);
    }

    @POST
    @Path("/bindings/{id}/restore")
    @Operation(summary = "Restore binding", description = "Makes a tombstoned binding visible again.")
    public Response restore(@PathParam("scopeId") String scopeId, @PathParam("id") String bindingId,
                            ActorRequest request, @Context SecurityContext securityContext) {
        return transition(scopeId, bindingId, "restore", request, securityContext, ExistenceEngine::restore);
    }

    /**
     * POST /api/v1/scopes/{scopeId}/elements/hide
     */
    @POST
    @Path("/elements/hide")
    @Operation(summary = "Hide bindings of elements", description = "Hides the bindings of the given canvas elements. Unmapped ids are ignored.")
    public Response hideElements(@PathParam("scopeId") String scopeId, ElementIdsRequest request,
                                 @Context SecurityContext securityContext) {
        return elements(scopeId, "hide", request, securityContext, true);
    }

    /**
     * POST /api/v1/scopes/{scopeId}/elements/show
     */
    @POST
    @Path("/elements/show")
    @Operation(summary = "Show bindings of elements", description = "Shows the bindings of the given canvas elements. Unmapped ids are ignored.")
    public Response showElements(@PathParam("scopeId") String scopeId, ElementIdsRequest request,
                                 @Context SecurityContext securityContext) {
        return elements(scopeId, "show", request, securityContext, false);
    }

    private Response transition(String scopeId, String bindingId, String action, ActorRequest request,
                                SecurityContext securityContext,
                                TransitionCall call) {
        String path = base(scopeId) + "/bindings/" + bindingId + "/" + action;
        if (request == null) {
            return ErrorResponses.badRequest("actorId is required", path);
        }
        Optional<Response> forbidden = ErrorResponses.checkActor(securityContext, request.actorId(), path);
        if (forbidden.isPresent()) {
            return forbidden.get();
        }
        try {
            TransitionResult result = call.apply(registry.forScope(scopeId), bindingId, request.actorId());
            return Response.ok(TransitionResponse.from(result)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, action + "Binding", path, log);
        }
    }

    private Response elements(String scopeId, String action, ElementIdsRequest request,
                              SecurityContext securityContext, boolean hide) {
        String path = base(scopeId) + "/elements/" + action;
        if (request == null) {
            return ErrorResponses.badRequest("elementIds and actorId are required", path);
        }
        Optional<Response> forbidden = ErrorResponses.checkActor(securityContext, request.actorId(), path);
        if (forbidden.isPresent()) {
            return forbidden.get();
        }
        try {
            ExistenceEngine engine = registry.forScope(scopeId);
            BiFunction<List<String>, String, Integer> batch = hide
                    ? engine::hideByElementIds : engine::showByElementIds;
            int changed = batch.apply(request.elementIds(), request.actorId());
            return Response.ok(Map.of("requested", request.elementIds().size(), "changed", changed)).build();
        } catch (Exception e) {
            return ErrorResponses.from(e, action + "Elements", path, log);
        }
    }

    private static String base(String scopeId) {
        return "/api/v1/scopes/" + scopeId;
    }

    @FunctionalInterface
    private interface TransitionCall {
        TransitionResult apply(ExistenceEngine engine, String bindingId, String actorId);
    }
}
