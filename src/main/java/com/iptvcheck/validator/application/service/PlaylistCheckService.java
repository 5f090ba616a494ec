package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.application.config.CheckerSettings;
import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.Diagnostic.Severity;
import com.iptvcheck.validator.core.model.ExtinfAttributes;
import com.iptvcheck.validator.core.model.FixOperation;
import com.iptvcheck.validator.core.model.PlaylistEntry;
import com.iptvcheck.validator.core.model.RebuildAttributesFix;
import com.iptvcheck.validator.core.model.ReorderStreamUrlFix;
import com.iptvcheck.validator.core.model.ValidationMode;
import com.iptvcheck.validator.core.text.ChannelIdSanitizer;
import com.iptvcheck.validator.core.text.DisplayNameResolver;
import com.iptvcheck.validator.core.text.ExtinfAttributeParser;
import com.iptvcheck.validator.core.text.TvgNameQuality;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses extended M3U playlists, reports problems and stages fixes for the ones that can be
 * repaired mechanically. Content problems never raise exceptions; they become diagnostics.
 */
@Service
public class PlaylistCheckService {

    static final String HEADER_PREFIX = "#EXTINF:";
    static final String PLAYLIST_START = "#EXTM3U";
    static final String VLC_OPTION_PREFIX = "#EXTVLCOPT:";

    private static final Pattern HEADER = Pattern.compile("#EXTINF:(-?\\d+)\\s*([^,]*),(.*)");

    private final CheckerSettings settings;

    public PlaylistCheckService(CheckerSettings settings) {
        this.settings = settings;
    }

    /**
     * Result record containing everything found in one playlist.
     */
    public record PlaylistCheckResult(
            List<Diagnostic> diagnostics,
            List<PlaylistEntry> entries,
            List<FixOperation> fixes
    ) {}

    /**
     * Checks a playlist.
     *
     * @param content raw playlist text; null is treated as empty
     * @param mode    rule strictness
     * @return diagnostics in discovery order, entries in file order and the staged fixes
     */
    public PlaylistCheckResult check(String content, ValidationMode mode) {
        Scan scan = new Scan(content == null ? List.of() : content.lines().toList(), mode);

        int i = 0;
        while (i < scan.lines.size()) {
            String line = scan.lines.get(i).strip();

            if (line.isEmpty()) {
                // a blank line after a header is consumed by that header's URL search
                i++;
            } else if (line.startsWith(HEADER_PREFIX)) {
                i = checkEntry(scan, i, line);
            } else if (line.startsWith(VLC_OPTION_PREFIX) || line.startsWith(PLAYLIST_START)) {
                i++;
            } else {
                scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                        "Unexpected line (might be ignored) (Line " + (i + 1) + "): " + line, i + 1));
                i++;
            }
        }

        if (scan.headerCount > settings.getMaxChannels()) {
            scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                    "Detected " + scan.headerCount + " channels. Channels DVR might experience performance issues "
                            + "or limits with more than ~" + settings.getMaxChannels() + " channels per M3U playlist."));
        }

        return new PlaylistCheckResult(
                List.copyOf(scan.diagnostics),
                List.copyOf(scan.entries),
                List.copyOf(scan.fixes)
        );
    }

    /**
     * Checks the entry whose header is at {@code index}.
     *
     * @return the index of the next line to examine
     */
    private int checkEntry(Scan scan, int index, String line) {
        int lineNum = index + 1;
        scan.headerCount++;

        Matcher matcher = HEADER.matcher(line);
        if (!matcher.find()) {
            scan.diagnostics.add(Diagnostic.playlist(Severity.ERROR,
                    "Malformed EXTINF line (Line " + lineNum + "): " + line
                            + ". Expected '#EXTINF:<duration> [attributes],<channel name>'", lineNum));
            return index + 1;
        }

        String duration = matcher.group(1);
        ExtinfAttributes attributes = ExtinfAttributeParser.parse(matcher.group(2).strip());
        String rawName = matcher.group(3).strip();

        if (rawName.isEmpty()) {
            scan.diagnostics.add(Diagnostic.playlist(Severity.ERROR,
                    "Channel name missing in EXTINF line (Line " + lineNum + "): " + line, lineNum));
        }

        String displayName = DisplayNameResolver.resolve(rawName, attributes);
        ExtinfAttributes effective = stageAttributeFixes(scan, lineNum, rawName, displayName, attributes);
        if (!effective.equals(attributes)) {
            scan.fixes.add(new RebuildAttributesFix(lineNum, duration, rawName, effective));
        }

        String tvgId = effective.getTrimmed(ExtinfAttributes.TVG_ID);
        if (!tvgId.isEmpty()) {
            List<Integer> previous = scan.linesByTvgId.computeIfAbsent(tvgId, key -> new ArrayList<>());
            if (!previous.isEmpty()) {
                scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                        "Duplicate 'tvg-id' '" + tvgId + "' found for channel '" + rawName + "' (Line " + lineNum
                                + "). Previous at line(s): " + joinLines(previous)
                                + ". Channels DVR may only import one instance.", lineNum));
            }
            previous.add(lineNum);
        }
        if (!rawName.isEmpty()) {
            List<Integer> previous = scan.linesByName.computeIfAbsent(rawName, key -> new ArrayList<>());
            if (!previous.isEmpty()) {
                scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                        "Duplicate channel name '" + rawName + "' found (Line " + lineNum + "). Previous at line(s): "
                                + joinLines(previous) + ". This might cause confusion.", lineNum));
            }
            previous.add(lineNum);
        }

        int urlIndex = findStreamUrl(scan.lines, index);
        String streamUrl = "";
        int next;
        if (urlIndex >= 0) {
            streamUrl = scan.lines.get(urlIndex).strip();
            if (urlIndex != index + 1) {
                scan.fixes.add(new ReorderStreamUrlFix(lineNum, urlIndex + 1, streamUrl, rawName));
                scan.diagnostics.add(Diagnostic.playlist(Severity.ERROR,
                        "Stream URL for channel '" + rawName + "' (Line " + lineNum
                                + ") was not immediately after EXTINF line. Found at Line " + (urlIndex + 1)
                                + ". Suggesting fix: Reorder URL.", lineNum));
            }
            next = urlIndex + 1;
        } else {
            scan.diagnostics.add(Diagnostic.playlist(Severity.ERROR,
                    "Missing stream URL after EXTINF line for channel '" + rawName + "' (Line " + lineNum
                            + "). Each #EXTINF must be immediately followed by a stream URL.", lineNum));
            next = index + 1;
        }

        if (scan.mode == ValidationMode.ADVANCED && !streamUrl.isEmpty() && !isPreferredContainer(streamUrl)) {
            scan.diagnostics.add(Diagnostic.playlist(Severity.SUGGESTION,
                    "Stream URL for '" + rawName + "' (Line " + lineNum + ") might not be HLS (.m3u8) or MPEG-TS (.ts). "
                            + "Channels DVR generally prefers HLS or raw MPEG-TS streams.", lineNum));
        }

        scan.entries.add(new PlaylistEntry(
                rawName,
                effective.getTrimmed(ExtinfAttributes.TVG_ID),
                effective.get(ExtinfAttributes.TVG_NAME),
                effective.getTrimmed(ExtinfAttributes.TVG_LOGO),
                effective.get(ExtinfAttributes.GROUP_TITLE),
                streamUrl
        ));
        return next;
    }

    /**
     * Runs the attribute rules for the current mode and returns the attributes with every staged change applied.
     */
    private ExtinfAttributes stageAttributeFixes(Scan scan, int lineNum, String rawName, String displayName,
                                                 ExtinfAttributes attributes) {
        ExtinfAttributes effective = attributes;

        if (attributes.getTrimmed(ExtinfAttributes.TVG_ID).isEmpty()) {
            String suggestedId = ChannelIdSanitizer.sanitize(displayName);
            if (!suggestedId.isEmpty()) {
                effective = effective.with(ExtinfAttributes.TVG_ID, suggestedId);
                scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                        "Channel '" + rawName + "' (Line " + lineNum + ") is missing 'tvg-id'. This is crucial for EPG "
                                + "matching in Channels DVR. Suggesting fix: Add tvg-id='" + suggestedId + "'.", lineNum));
            } else {
                scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                        "Channel '" + rawName + "' (Line " + lineNum + ") is missing 'tvg-id'. "
                                + "(Cannot auto-suggest a fix for this name).", lineNum));
            }
        }

        if (scan.mode != ValidationMode.ADVANCED) {
            return effective;
        }

        String tvgName = attributes.getTrimmed(ExtinfAttributes.TVG_NAME);
        String suggestedName = DisplayNameResolver.toAttributeValue(displayName);
        if (tvgName.isEmpty()) {
            effective = effective.with(ExtinfAttributes.TVG_NAME, suggestedName);
            scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                    "Channel '" + rawName + "' (Line " + lineNum + ") is missing 'tvg-name'. Channels DVR often uses "
                            + "this for display. Suggesting fix: Add tvg-name='" + suggestedName + "'.", lineNum));
        } else if (!tvgName.equals(suggestedName)
                && !DisplayNameResolver.UNKNOWN_CHANNEL.equals(suggestedName)
                && TvgNameQuality.isLowQuality(tvgName)) {
            effective = effective.with(ExtinfAttributes.TVG_NAME, suggestedName);
            scan.diagnostics.add(Diagnostic.playlist(Severity.WARNING,
                    "Channel '" + rawName + "' (Line " + lineNum + ") has an unclean 'tvg-name' attribute ('" + tvgName
                            + "'). Suggesting fix: Change tvg-name to '" + suggestedName + "'.", lineNum));
        }

        if (attributes.getTrimmed(ExtinfAttributes.GROUP_TITLE).isEmpty()) {
            String groupTitle = settings.getDefaultGroupTitle();
            effective = effective.with(ExtinfAttributes.GROUP_TITLE, groupTitle);
            scan.diagnostics.add(Diagnostic.playlist(Severity.SUGGESTION,
                    "Channel '" + rawName + "' (Line " + lineNum + ") is missing 'group-title'. Adding one helps "
                            + "organize channels in Channels DVR. Suggesting fix: Add group-title='" + groupTitle + "'.",
                    lineNum));
        }

        return effective;
    }

    /**
     * Looks for the stream URL of the header at {@code headerIndex}. Blank and comment lines are skipped;
     * another header or a playlist start marker ends the search.
     *
     * @return the index of the URL line, or -1 when the entry has none
     */
    static int findStreamUrl(List<String> lines, int headerIndex) {
        for (int j = headerIndex + 1; j < lines.size(); j++) {
            String candidate = lines.get(j).strip();
            if (candidate.isEmpty()) {
                continue;
            }
            if (candidate.startsWith(HEADER_PREFIX) || candidate.startsWith(PLAYLIST_START)) {
                return -1;
            }
            if (!candidate.startsWith("#")) {
                return j;
            }
        }
        return -1;
    }

    static boolean isPreferredContainer(String streamUrl) {
        String url = streamUrl.toLowerCase(Locale.ROOT);
        return url.endsWith(".m3u8") || url.contains(".ts") || url.contains("/hls/");
    }

    private static String joinLines(List<Integer> lineNumbers) {
        return lineNumbers.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    /**
     * Working state of a single {@link #check} call.
     */
    private static final class Scan {
        private final List<String> lines;
        private final ValidationMode mode;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final List<PlaylistEntry> entries = new ArrayList<>();
        private final List<FixOperation> fixes = new ArrayList<>();
        private final Map<String, List<Integer>> linesByTvgId = new HashMap<>();
        private final Map<String, List<Integer>> linesByName = new HashMap<>();
        private int headerCount;

        private Scan(List<String> lines, ValidationMode mode) {
            this.lines = lines;
            this.mode = mode == null ? ValidationMode.ADVANCED : mode;
        }
    }
}
