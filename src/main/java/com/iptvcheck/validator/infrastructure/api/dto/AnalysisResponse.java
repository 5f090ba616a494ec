package com.iptvcheck.validator.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a complete analysis.
 * The message lists hold the rendered diagnostics; the diagnostic lists hold the same findings in structured form.
 */
public record AnalysisResponse(
        List<String> playlistMessages,
        List<String> guideMessages,
        List<String> compatibilityMessages,
        List<String> advisories,
        List<DiagnosticResponse> playlistDiagnostics,
        List<DiagnosticResponse> guideDiagnostics,
        List<DiagnosticResponse> compatibilityDiagnostics,
        List<PlaylistEntryResponse> entries,
        List<GuideChannelResponse> guideChannels,
        List<GuideProgramResponse> guidePrograms,
        String correctedPlaylist,
        int fixesApplied,
        String fixesJson,
        String fixedPlaylistId
) {}
