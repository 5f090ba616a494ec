package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.Diagnostic.Severity;
import com.iptvcheck.validator.core.model.GuideChannel;
import com.iptvcheck.validator.core.model.PlaylistEntry;
import com.iptvcheck.validator.core.text.GracenoteIdClassifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches playlist {@code tvg-id}s against guide channel ids and collects general Channels DVR advice.
 */
@Service
public class CompatibilityCheckService {

    static final List<String> GENERAL_ADVICE = List.of(
            "For optimal guide data, ensure 'tvg-id' in M3U *exactly* matches 'id' in EPG (case-sensitive).",
            "Missing or inconsistent 'tvg-id' attributes are the most common reason for guide data not showing up.",
            "Duplicate 'tvg-id' values in M3U can cause unpredictable channel importing in Channels DVR.",
            "Ensure your EPG file includes essential program details like <title>, <desc>, series-id (for TV shows), "
                    + "and episode-num for best DVR functionality.",
            "Overlapping program times in EPG for a single channel can lead to incorrect guide display or recording issues.",
            "Channels DVR prefers HLS (.m3u8) or raw MPEG-TS (.ts) streams. Other formats might have limited or no support.",
            "Consider adding a 'group-title' to your M3U channels to organize them into categories in Channels DVR's UI.",
            "Remember: Channels DVR *can* display guide data without an external EPG file if your M3U channels use "
                    + "tvg-ids that map to known Gracenote IDs. Otherwise, an external EPG source is required."
    );

    /**
     * Result record separating concrete findings from general advice.
     */
    public record CompatibilityResult(
            List<Diagnostic> issues,
            List<String> advisories
    ) {}

    /**
     * Compares playlist entries with guide channels. A {@code null} argument means that side was not
     * supplied at all; an empty one means it was supplied but yielded nothing, which still gets the
     * full cross-check.
     *
     * @param entries  entries from the playlist check in file order, or {@code null} without a playlist
     * @param channels guide channels by id in declaration order, or {@code null} without a guide
     * @return unmatched ids on either side, notes about missing inputs, and the general advice list
     */
    public CompatibilityResult check(List<PlaylistEntry> entries, Map<String, GuideChannel> channels) {
        List<Diagnostic> issues = new ArrayList<>();

        if (entries != null && channels == null) {
            if (!entries.isEmpty()) {
                issues.add(noGuideNote(entries));
            }
        } else if (entries == null && channels != null) {
            if (!channels.isEmpty()) {
                issues.add(Diagnostic.compatibility(Severity.NOTE, "No M3U channels were provided. EPG data alone is not "
                        + "sufficient for Channels DVR; it needs to be linked to channels in a playlist (via tvg-id)."));
            }
        } else if (entries != null) {
            Set<String> playlistIds = entries.stream()
                    .filter(PlaylistEntry::hasTvgId)
                    .map(PlaylistEntry::getTvgId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));

            // entries without tvg-id were already reported by the playlist check
            for (PlaylistEntry entry : entries) {
                if (entry.hasTvgId() && !channels.containsKey(entry.getTvgId())) {
                    issues.add(Diagnostic.compatibility(Severity.WARNING, "M3U channel '" + entry.getName()
                            + "' (tvg-id: '" + entry.getTvgId() + "') has no matching EPG data found by 'tvg-id'. "
                            + "This channel might not show guide data in Channels DVR."));
                }
            }

            for (GuideChannel channel : channels.values()) {
                if (!playlistIds.contains(channel.getId())) {
                    issues.add(Diagnostic.compatibility(Severity.WARNING, "EPG channel '"
                            + describeDisplayNames(channel.getDisplayNames()) + "' (id: '" + channel.getId()
                            + "') has no matching M3U channel via 'tvg-id'. This EPG data will not be used by Channels DVR."));
                }
            }
        }

        return new CompatibilityResult(List.copyOf(issues), GENERAL_ADVICE);
    }

    private Diagnostic noGuideNote(List<PlaylistEntry> playlist) {
        boolean gracenote = playlist.stream()
                .map(PlaylistEntry::getTvgId)
                .anyMatch(GracenoteIdClassifier::looksLikeGracenoteId);
        if (gracenote) {
            return Diagnostic.compatibility(Severity.NOTE, "No EPG data was provided. Some tvg-ids look like Gracenote IDs, "
                    + "so Channels DVR may still find guide data for those channels without an external EPG file.");
        }
        return Diagnostic.compatibility(Severity.NOTE, "No EPG data was provided. None of the tvg-ids look like Gracenote IDs, "
                + "so an external EPG source is required for guide data in Channels DVR.");
    }

    private static String describeDisplayNames(Collection<String> displayNames) {
        return displayNames.isEmpty() ? "N/A" : String.join(", ", displayNames);
    }
}
