package com.iptvcheck.validator.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a guide channel.
 */
public record GuideChannelResponse(
        String id,
        List<String> displayNames,
        String iconUrl
) {}
