package com.iptvcheck.validator.infrastructure.api.dto;

/**
 * Request DTO for analyzing a playlist and/or a guide. At least one content field must be non-blank.
 */
public record AnalysisRequest(
        String playlistContent,
        String guideContent,
        String mode
) {}
