package com.iptvcheck.validator.infrastructure.api.dto;

/**
 * Response DTO for a guide program. Times are the raw XMLTV attribute values; the flags tell which
 * optional program details the guide carried.
 */
public record GuideProgramResponse(
        String channelId,
        String start,
        String stop,
        String title,
        boolean hasDescription,
        boolean hasSeriesId,
        boolean hasEpisodeNum,
        boolean movie
) {}
