package com.existence.arbitration.api;

/**
 * Snapshot of an engine's in-memory state.
 *
 * @param scopeId             active scope, null before initialization
 * @param indexedBindings     entries in the status index
 * @param elementIndexSize    entries in the element id index
 * @param blockIndexSize      distinct block ids indexed
 * @param cachedEntries       estimated existence cache size
 * @param openInconsistencies unresolved findings across all scopes sharing the repository
 */
public record EngineStatus(
        boolean initialized,
        String scopeId,
        int indexedBindings,
        int elementIndexSize,
        int blockIndexSize,
        long cachedEntries,
        long openInconsistencies
) {
}
