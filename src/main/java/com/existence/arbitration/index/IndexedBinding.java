package com.existence.arbitration.index;

import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;

/**
 * Slice of a binding held in memory for O(1) lookups.
 *
 * @param version store version the status was read at, used as the compare-and-swap token
 */
public record IndexedBinding(
        String bindingId,
        String containerId,
        String documentId,
        String elementId,
        String blockId,
        BindingStatus status,
        long version
) {

    static IndexedBinding of(Binding binding) {
        return new IndexedBinding(
                binding.getId(),
                binding.getContainerId(),
                binding.getDocumentId(),
                binding.getLinkedElementId(),
                binding.getLinkedBlockId(),
                binding.getCurrentStatus(),
                binding.getVersion());
    }

    IndexedBinding withStatus(BindingStatus newStatus, long newVersion) {
        return new IndexedBinding(bindingId, containerId, documentId, elementId, blockId, newStatus, newVersion);
    }
}
