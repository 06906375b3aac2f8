package com.existence.arbitration.rest.dto;

/**
 * Request DTO for rejecting a pending binding.
 */
public record RejectRequest(
        String userId,
        String reason
) {
    public RejectRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason is required");
        }
    }
}
