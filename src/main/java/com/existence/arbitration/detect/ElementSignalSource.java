package com.existence.arbitration.detect;

import com.existence.arbitration.core.model.EntityState;

import java.util.Map;

/**
 * Read-only access to projection A's existence signals (canvas elements).
 * The projection owns these flags; the engine never writes them.
 */
@FunctionalInterface
public interface ElementSignalSource {

    /**
     * Gets the state of every element the canvas knows, including those flagged deleted.
     * Elements missing from the map are {@link EntityState#ABSENT}.
     *
     * @throws Exception if the projection cannot be read
     */
    Map<String, EntityState> elementStates(String containerId) throws Exception;
}
