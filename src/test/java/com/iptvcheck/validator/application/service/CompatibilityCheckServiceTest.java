package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.application.service.CompatibilityCheckService.CompatibilityResult;
import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.Diagnostic.Severity;
import com.iptvcheck.validator.core.model.GuideChannel;
import com.iptvcheck.validator.core.model.PlaylistEntry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompatibilityCheckServiceTest {

    private final CompatibilityCheckService service = new CompatibilityCheckService();

    private static PlaylistEntry entry(String name, String tvgId) {
        return new PlaylistEntry(name, tvgId, name, "", "Group", "http://example.com/" + name + ".m3u8");
    }

    private static Map<String, GuideChannel> channels(GuideChannel... channels) {
        Map<String, GuideChannel> map = new LinkedHashMap<>();
        for (GuideChannel channel : channels) {
            map.put(channel.getId(), channel);
        }
        return map;
    }

    @Test
    void reportsUnmatchedIdsOnBothSides() {
        CompatibilityResult result = service.check(
                List.of(entry("Alpha", "a"), entry("Beta", "b")),
                channels(new GuideChannel("a", List.of("Alpha"), null), new GuideChannel("c", List.of("Gamma", "C"), null)));

        assertThat(result.issues()).extracting(Diagnostic::message).containsExactly(
                "M3U channel 'Beta' (tvg-id: 'b') has no matching EPG data found by 'tvg-id'. "
                        + "This channel might not show guide data in Channels DVR.",
                "EPG channel 'Gamma, C' (id: 'c') has no matching M3U channel via 'tvg-id'. "
                        + "This EPG data will not be used by Channels DVR.");
        assertThat(result.issues()).allMatch(d -> d.severity() == Severity.WARNING);
        assertThat(result.advisories()).hasSize(8);
    }

    @Test
    void skipsEntriesWithoutTvgId() {
        CompatibilityResult result = service.check(
                List.of(entry("Alpha", "a"), entry("Nameless", "")),
                channels(new GuideChannel("a", List.of("Alpha"), null)));

        assertThat(result.issues()).isEmpty();
    }

    @Test
    void describesChannelsWithoutDisplayNames() {
        CompatibilityResult result = service.check(
                List.of(entry("Alpha", "a")),
                channels(new GuideChannel("a", List.of(), null), new GuideChannel("z", List.of(), null)));

        assertThat(result.issues()).singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("EPG channel 'N/A' (id: 'z')"));
    }

    @Test
    void notesGracenoteIdsWhenNoGuideIsGiven() {
        CompatibilityResult result = service.check(List.of(entry("Alpha", "a"), entry("Beta", "EP012345678")), null);

        assertThat(result.issues()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.NOTE);
            assertThat(d.message()).contains("look like Gracenote IDs, so Channels DVR may still find guide data");
        });
    }

    @Test
    void notesExternalGuideRequirement() {
        CompatibilityResult result = service.check(List.of(entry("Alpha", "alpha")), null);

        assertThat(result.issues()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("an external EPG source is required"));
    }

    @Test
    void notesGuideWithoutPlaylist() {
        CompatibilityResult result = service.check(null, channels(new GuideChannel("a", List.of("Alpha"), null)));

        assertThat(result.issues()).singleElement().satisfies(d -> {
            assertThat(d.render()).startsWith("Compatibility Note: No M3U channels were provided.");
        });
    }

    @Test
    void suppliedGuideWithoutChannelsIsStillCrossChecked() {
        CompatibilityResult result = service.check(List.of(entry("Alpha", "a"), entry("Nameless", "")), Map.of());

        assertThat(result.issues()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.message()).startsWith("M3U channel 'Alpha' (tvg-id: 'a') has no matching EPG data");
        });
    }

    @Test
    void suppliedPlaylistWithoutEntriesIsStillCrossChecked() {
        CompatibilityResult result = service.check(List.of(), channels(new GuideChannel("a", List.of("Alpha"), null)));

        assertThat(result.issues()).singleElement()
                .satisfies(d -> assertThat(d.message()).startsWith("EPG channel 'Alpha' (id: 'a') has no matching M3U channel"));
    }

    @Test
    void emptyPlaylistWithoutGuideHasNoNote() {
        assertThat(service.check(List.of(), null).issues()).isEmpty();
    }

    @Test
    void returnsAdviceEvenWithoutInput() {
        CompatibilityResult result = service.check(null, null);

        assertThat(result.issues()).isEmpty();
        assertThat(result.advisories()).isEqualTo(CompatibilityCheckService.GENERAL_ADVICE);
    }
}
