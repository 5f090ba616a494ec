package com.iptvcheck.validator.infrastructure.api.controller;

import com.iptvcheck.validator.application.service.AnalysisService;
import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.ValidationMode;
import com.iptvcheck.validator.infrastructure.api.dto.AnalysisRequest;
import com.iptvcheck.validator.infrastructure.api.dto.AnalysisResponse;
import com.iptvcheck.validator.infrastructure.api.dto.DiagnosticResponse;
import com.iptvcheck.validator.infrastructure.api.dto.FixReplayRequest;
import com.iptvcheck.validator.infrastructure.api.dto.GuideChannelResponse;
import com.iptvcheck.validator.infrastructure.api.dto.GuideProgramResponse;
import com.iptvcheck.validator.infrastructure.api.dto.PlaylistEntryResponse;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for playlist and guide analysis.
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    static final MediaType M3U_MEDIA_TYPE = MediaType.parseMediaType("application/x-mpegurl");
    static final String FIXED_PLAYLIST_FILENAME = "fixed_playlist.m3u";

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analysis")
    public ResponseEntity<AnalysisResponse> analyze(@RequestBody AnalysisRequest request) {
        ValidationMode mode = analysisService.resolveMode(request.mode());
        AnalysisService.AnalysisReport report = analysisService.analyze(
                request.playlistContent(),
                request.guideContent(),
                mode
        );

        List<PlaylistEntryResponse> entries = report.entries().stream()
                .map(entry -> new PlaylistEntryResponse(entry.getName(), entry.getTvgId(), entry.getTvgName(),
                        entry.getTvgLogo(), entry.getGroupTitle(), entry.getStreamUrl()))
                .toList();
        List<GuideChannelResponse> channels = report.guideChannels().values().stream()
                .map(channel -> new GuideChannelResponse(channel.getId(), channel.getDisplayNames(), channel.getIconUrl()))
                .toList();
        List<GuideProgramResponse> programs = report.guidePrograms().stream()
                .map(program -> new GuideProgramResponse(program.getChannelId(), program.getStart(), program.getStop(),
                        program.getTitle(), program.hasDescription(), program.hasSeriesId(), program.hasEpisodeNum(),
                        program.isMovie()))
                .toList();

        return ResponseEntity.ok(new AnalysisResponse(
                render(report.playlistDiagnostics()),
                render(report.guideDiagnostics()),
                render(report.compatibilityIssues()),
                report.advisories(),
                toResponses(report.playlistDiagnostics()),
                toResponses(report.guideDiagnostics()),
                toResponses(report.compatibilityIssues()),
                entries,
                channels,
                programs,
                report.correctedPlaylist(),
                report.fixesApplied(),
                report.fixesJson(),
                report.fixedPlaylistId()
        ));
    }

    @PostMapping("/playlist/fixes/apply")
    public ResponseEntity<String> applyFixes(@Valid @RequestBody FixReplayRequest request) {
        String corrected = analysisService.replayFixes(request.originalContent(), request.fixes());
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(corrected);
    }

    @GetMapping("/fixed-playlists/{id}")
    public ResponseEntity<byte[]> downloadFixedPlaylist(@PathVariable String id) {
        byte[] content = analysisService.getFixedPlaylist(id);
        return ResponseEntity.ok()
                .contentType(M3U_MEDIA_TYPE)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(FIXED_PLAYLIST_FILENAME).build().toString())
                .body(content);
    }

    private static List<String> render(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::render).toList();
    }

    private static List<DiagnosticResponse> toResponses(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(DiagnosticResponse::from).toList();
    }
}
