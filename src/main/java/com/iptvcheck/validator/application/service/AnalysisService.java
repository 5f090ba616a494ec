package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.application.config.CheckerSettings;
import com.iptvcheck.validator.application.port.FixedPlaylistPort;
import com.iptvcheck.validator.application.service.CompatibilityCheckService.CompatibilityResult;
import com.iptvcheck.validator.application.service.GuideCheckService.GuideCheckResult;
import com.iptvcheck.validator.application.service.PlaylistCheckService.PlaylistCheckResult;
import com.iptvcheck.validator.core.exception.MissingContentException;
import com.iptvcheck.validator.core.exception.ResourceNotFoundException;
import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.FixOperation;
import com.iptvcheck.validator.core.model.GuideChannel;
import com.iptvcheck.validator.core.model.GuideProgram;
import com.iptvcheck.validator.core.model.PlaylistEntry;
import com.iptvcheck.validator.core.model.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Service running a complete playlist and guide analysis for one request.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final PlaylistCheckService playlistCheckService;
    private final PlaylistFixService playlistFixService;
    private final GuideCheckService guideCheckService;
    private final CompatibilityCheckService compatibilityCheckService;
    private final FixOperationCodec fixOperationCodec;
    private final FixedPlaylistPort fixedPlaylistPort;
    private final CheckerSettings settings;

    public AnalysisService(
            PlaylistCheckService playlistCheckService,
            PlaylistFixService playlistFixService,
            GuideCheckService guideCheckService,
            CompatibilityCheckService compatibilityCheckService,
            FixOperationCodec fixOperationCodec,
            FixedPlaylistPort fixedPlaylistPort,
            CheckerSettings settings
    ) {
        this.playlistCheckService = playlistCheckService;
        this.playlistFixService = playlistFixService;
        this.guideCheckService = guideCheckService;
        this.compatibilityCheckService = compatibilityCheckService;
        this.fixOperationCodec = fixOperationCodec;
        this.fixedPlaylistPort = fixedPlaylistPort;
        this.settings = settings;
    }

    /**
     * Result record containing the complete outcome of an analysis.
     *
     * @param correctedPlaylist corrected playlist text, the original text when no fix was staged,
     *                          or null when no playlist was given
     * @param fixedPlaylistId   id of the stored corrected playlist, or null when nothing was fixed
     */
    public record AnalysisReport(
            List<Diagnostic> playlistDiagnostics,
            List<PlaylistEntry> entries,
            List<FixOperation> fixes,
            List<Diagnostic> guideDiagnostics,
            Map<String, GuideChannel> guideChannels,
            List<GuideProgram> guidePrograms,
            List<Diagnostic> compatibilityIssues,
            List<String> advisories,
            String correctedPlaylist,
            int fixesApplied,
            String fixesJson,
            String fixedPlaylistId
    ) {}

    /**
     * Resolves a requested mode, falling back to the configured default when none is given.
     */
    public ValidationMode resolveMode(String requested) {
        if (requested == null || requested.isBlank()) {
            return settings.getDefaultMode();
        }
        return ValidationMode.fromString(requested);
    }

    /**
     * Analyzes a playlist and/or a guide. Either may be absent, but not both.
     *
     * @param playlistContent raw M3U text, may be null or blank
     * @param guideContent    raw XMLTV text, may be null or blank
     * @param mode            playlist rule strictness
     * @return the analysis report
     */
    public AnalysisReport analyze(String playlistContent, String guideContent, ValidationMode mode) {
        boolean hasPlaylist = playlistContent != null && !playlistContent.isBlank();
        boolean hasGuide = guideContent != null && !guideContent.isBlank();
        if (!hasPlaylist && !hasGuide) {
            throw new MissingContentException("No playlist or guide content provided");
        }

        PlaylistCheckResult playlist = hasPlaylist
                ? playlistCheckService.check(playlistContent, mode)
                : new PlaylistCheckResult(List.of(), List.of(), List.of());

        String correctedPlaylist = null;
        String fixedPlaylistId = null;
        if (hasPlaylist) {
            correctedPlaylist = playlistContent;
            if (!playlist.fixes().isEmpty()) {
                correctedPlaylist = playlistFixService.apply(playlistContent, playlist.fixes());
                fixedPlaylistId = fixedPlaylistPort.put(correctedPlaylist.getBytes(StandardCharsets.UTF_8));
            }
        }

        GuideCheckResult guide = hasGuide
                ? guideCheckService.check(guideContent)
                : new GuideCheckResult(List.of(), Map.of(), List.of());

        CompatibilityResult compatibility = compatibilityCheckService.check(
                hasPlaylist ? playlist.entries() : null, hasGuide ? guide.channels() : null);

        log.info("Analysis finished: mode={}, entries={}, playlistFindings={}, fixes={}, guideChannels={}, "
                        + "guidePrograms={}, guideFindings={}, compatibilityFindings={}",
                mode, playlist.entries().size(), playlist.diagnostics().size(), playlist.fixes().size(),
                guide.channels().size(), guide.programs().size(), guide.diagnostics().size(),
                compatibility.issues().size());

        return new AnalysisReport(
                playlist.diagnostics(),
                playlist.entries(),
                playlist.fixes(),
                guide.diagnostics(),
                guide.channels(),
                guide.programs(),
                compatibility.issues(),
                compatibility.advisories(),
                correctedPlaylist,
                playlist.fixes().size(),
                fixOperationCodec.toJson(playlist.fixes()),
                fixedPlaylistId
        );
    }

    /**
     * Re-applies a serialized fix list to the original playlist, as done at download time.
     */
    public String replayFixes(String originalContent, String fixesJson) {
        if (originalContent == null || originalContent.isBlank()) {
            throw new MissingContentException("No original playlist content provided");
        }
        List<FixOperation> fixes = fixOperationCodec.fromJson(fixesJson);
        return playlistFixService.apply(originalContent, fixes);
    }

    /**
     * Loads a corrected playlist stored by {@link #analyze}.
     *
     * @throws ResourceNotFoundException when no playlist is stored under the id
     */
    public byte[] getFixedPlaylist(String id) {
        return fixedPlaylistPort.get(id)
                .orElseThrow(() -> new ResourceNotFoundException("Fixed playlist not found: " + id));
    }
}
