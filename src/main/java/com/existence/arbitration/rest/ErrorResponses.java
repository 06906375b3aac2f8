package com.existence.arbitration.rest;

import com.existence.arbitration.core.BindingNotFoundException;
import com.existence.arbitration.engine.IllegalTransitionException;
import com.existence.arbitration.index.EngineNotInitializedException;
import com.existence.arbitration.rest.dto.ErrorResponse;
import com.existence.arbitration.store.StaleBindingVersionException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;

import java.security.Principal;
import java.util.Map;
import java.util.Optional;

/**
 * Maps engine exceptions to HTTP responses and checks caller-supplied actor ids.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static Response from(Exception e, String operation, String path, Logger log) {
        if (e instanceof BindingNotFoundException) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(e.getMessage(), path))
                    .build();
        }
        if (e instanceof StaleBindingVersionException stale) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path, Map.of(
                            "expectedVersion", String.valueOf(stale.getExpectedVersion()),
                            "actualVersion", String.valueOf(stale.getActualVersion()))))
                    .build();
        }
        if (e instanceof IllegalTransitionException || e instanceof EngineNotInitializedException) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path))
                    .build();
        }
        if (e instanceof IllegalArgumentException) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        }
        log.error("{}.failed path={} error={}", operation, path, e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(e.getMessage(), path))
                .build();
    }

    /**
     * Returns a 403 response when an authenticated caller acts under another identity.
     */
    static Optional<Response> checkActor(SecurityContext securityContext, String actorId, String path) {
        if (securityContext == null) {
            return Optional.empty();
        }
        Principal principal = securityContext.getUserPrincipal();
        if (principal == null || principal.getName().equals(actorId)) {
            return Optional.empty();
        }
        return Optional.of(Response.status(Response.Status.FORBIDDEN)
                .entity(ErrorResponse.forbidden(
                        "Actor " + actorId + " does not match authenticated principal", path))
                .build());
    }

    static Response badRequest(String message, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, path))
                .build();
    }

    static Response notFound(String message, String path) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(ErrorResponse.notFound(message, path))
                .build();
    }
}
