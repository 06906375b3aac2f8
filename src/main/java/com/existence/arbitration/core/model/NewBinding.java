package com.existence.arbitration.core.model;

import java.util.Objects;

/**
 * Request to establish a new cross-projection link.
 *
 * @param containerId          canvas the binding belongs to
 * @param documentId           document hosting the linked block
 * @param linkedElementId      canvas element id
 * @param linkedBlockId        document block id
 * @param linkedMarkId         optional mark id inside the block
 * @param provenance           who created the link
 * @param provenanceConfidence confidence of the creator, 1.0 for users
 */
public record NewBinding(
        String containerId,
        String documentId,
        String linkedElementId,
        String linkedBlockId,
        String linkedMarkId,
        Provenance provenance,
        double provenanceConfidence
) {
    public NewBinding {
        Objects.requireNonNull(containerId, "containerId is required");
        Objects.requireNonNull(linkedElementId, "linkedElementId is required");
        provenance = provenance != null ? provenance : Provenance.USER;
        if (provenanceConfidence < 0.0 || provenanceConfidence > 1.0) {
            throw new IllegalArgumentException("provenanceConfidence must be in [0, 1]");
        }
    }

    public static NewBinding byUser(String containerId, String documentId,
                                    String elementId, String blockId) {
        return new NewBinding(containerId, documentId, elementId, blockId, null, Provenance.USER, 1.0);
    }
}
