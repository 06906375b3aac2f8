package com.existence.arbitration.detect;

import com.existence.arbitration.core.model.EntityState;

import java.util.Map;

/**
 * Read-only access to projection B's existence signals (document marks, keyed by
 * mark id or, for bindings without a mark, by block id).
 */
@FunctionalInterface
public interface MarkSignalSource {

    /**
     * Gets the state of every mark in a document. Marks missing from the map are
     * {@link EntityState#ABSENT}.
     *
     * @throws Exception if the projection cannot be read
     */
    Map<String, EntityState> markStates(String documentId) throws Exception;
}
