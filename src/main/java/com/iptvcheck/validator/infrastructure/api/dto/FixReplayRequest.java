package com.iptvcheck.validator.infrastructure.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for re-applying a serialized fix list to the original playlist.
 */
public record FixReplayRequest(
        @NotBlank(message = "originalContent must not be empty or blank")
        String originalContent,
        @NotBlank(message = "fixes must not be empty or blank")
        String fixes
) {}
