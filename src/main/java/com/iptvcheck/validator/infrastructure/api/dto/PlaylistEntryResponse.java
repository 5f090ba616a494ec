package com.iptvcheck.validator.infrastructure.api.dto;

/**
 * Response DTO for a recognized playlist entry.
 */
public record PlaylistEntryResponse(
        String name,
        String tvgId,
        String tvgName,
        String tvgLogo,
        String groupTitle,
        String streamUrl
) {}
