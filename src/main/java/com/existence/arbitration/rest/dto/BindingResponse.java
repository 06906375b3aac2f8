package com.existence.arbitration.rest.dto;

import com.existence.arbitration.core.model.Binding;

import java.time.Instant;
import java.util.Locale;

/**
 * Response DTO for a binding record.
 */
public record BindingResponse(
        String id,
        String containerId,
        String documentId,
        String linkedElementId,
        String linkedBlockId,
        String linkedMarkId,
        String status,
        Instant statusUpdatedAt,
        String statusUpdatedBy,
        String provenance,
        double provenanceConfidence,
        long version,
        Instant createdAt
) {
    public static BindingResponse from(Binding binding) {
        return new BindingResponse(
                binding.getId(),
                binding.getContainerId(),
                binding.getDocumentId(),
                binding.getLinkedElementId(),
                binding.getLinkedBlockId(),
                binding.getLinkedMarkId(),
                binding.getCurrentStatus().wireName(),
                binding.getStatusUpdatedAt(),
                binding.getStatusUpdatedBy(),
                binding.getProvenance() != null ? binding.getProvenance().name().toLowerCase(Locale.ROOT) : null,
                binding.getProvenanceConfidence(),
                binding.getVersion(),
                binding.getCreatedAt()
        );
    }
}
