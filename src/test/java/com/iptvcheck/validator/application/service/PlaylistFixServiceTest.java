package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.application.config.CheckerSettings;
import com.iptvcheck.validator.application.service.PlaylistCheckService.PlaylistCheckResult;
import com.iptvcheck.validator.core.model.ExtinfAttributes;
import com.iptvcheck.validator.core.model.FixOperation;
import com.iptvcheck.validator.core.model.PlaylistEntry;
import com.iptvcheck.validator.core.model.RebuildAttributesFix;
import com.iptvcheck.validator.core.model.ReorderStreamUrlFix;
import com.iptvcheck.validator.core.model.ValidationMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlaylistFixServiceTest {

    private PlaylistCheckService checkService;
    private PlaylistFixService fixService;

    @BeforeEach
    void setUp() {
        checkService = new PlaylistCheckService(CheckerSettings.defaults());
        fixService = new PlaylistFixService();
    }

    @Nested
    @DisplayName("Attribute rebuilds")
    class RebuildTests {

        @Test
        @DisplayName("Round trip adds the suggested attributes and keeps duration and name")
        void roundTrip() {
            String content = "#EXTINF:-1,My Channel\nhttp://x/y.m3u8\n";
            PlaylistCheckResult result = checkService.check(content, ValidationMode.ADVANCED);

            String fixed = fixService.apply(content, result.fixes());

            assertThat(fixed).isEqualTo(
                    "#EXTINF:-1 group-title=\"Unsorted\" tvg-id=\"my_channel\" tvg-name=\"My Channel\",My Channel\n"
                            + "http://x/y.m3u8\n");
        }

        @Test
        @DisplayName("Windows line endings are kept on rebuilt lines")
        void keepsCrLf() {
            RebuildAttributesFix fix = new RebuildAttributesFix(1, "-1", "A", ExtinfAttributes.empty().with("tvg-id", "a"));

            String fixed = fixService.apply("#EXTINF:-1,A\r\nhttp://a.m3u8\r\n", List.of(fix));

            assertThat(fixed).isEqualTo("#EXTINF:-1 tvg-id=\"a\",A\r\nhttp://a.m3u8\r\n");
        }

        @Test
        @DisplayName("A rebuilt last line without terminator gets a newline")
        void lastLineWithoutTerminator() {
            RebuildAttributesFix fix = new RebuildAttributesFix(1, "0", "A", ExtinfAttributes.empty().with("tvg-id", "a"));

            assertThat(fixService.apply("#EXTINF:0,A", List.of(fix))).isEqualTo("#EXTINF:0 tvg-id=\"a\",A\n");
        }

        @Test
        @DisplayName("Fixes pointing outside the text are skipped")
        void outOfRangeSkipped() {
            String content = "#EXTINF:-1,A\nhttp://a.m3u8\n";
            RebuildAttributesFix fix = new RebuildAttributesFix(10, "-1", "A", ExtinfAttributes.empty().with("tvg-id", "a"));

            assertThat(fixService.apply(content, List.of(fix))).isEqualTo(content);
        }

        @Test
        @DisplayName("No fixes return the text unchanged")
        void noFixes() {
            String content = "#EXTM3U\r\n#EXTINF:-1,A\r\n";

            assertThat(fixService.apply(content, List.of())).isEqualTo(content);
        }
    }

    @Nested
    @DisplayName("Stream URL moves")
    class ReorderTests {

        @Test
        @DisplayName("URL is moved directly below its header")
        void movesUrl() {
            String content = "#EXTM3U\n#EXTINF:-1 tvg-id=\"a\",A\n\nhttp://a.m3u8\n";
            List<FixOperation> fixes = checkService.check(content, ValidationMode.BASIC).fixes();

            String fixed = fixService.apply(content, fixes);

            assertThat(fixed).isEqualTo("#EXTM3U\n#EXTINF:-1 tvg-id=\"a\",A\nhttp://a.m3u8\n\n");
        }

        @Test
        @DisplayName("Applying a move to already ordered text changes nothing")
        void idempotentOnOrderedText() {
            String content = "#EXTM3U\n#EXTINF:-1 tvg-id=\"a\",A\n\nhttp://a.m3u8\n";
            List<FixOperation> fixes = checkService.check(content, ValidationMode.BASIC).fixes();
            String fixed = fixService.apply(content, fixes);

            assertThat(fixService.apply(fixed, fixes)).isEqualTo(fixed);
        }

        @Test
        @DisplayName("URL is inserted even when it is no longer at its original line")
        void insertsWhenOriginalMoved() {
            ReorderStreamUrlFix fix = new ReorderStreamUrlFix(1, 3, "http://a", "A");

            String fixed = fixService.apply("#EXTINF:-1,A\n\nother\n", List.of(fix));

            assertThat(fixed).isEqualTo("#EXTINF:-1,A\nhttp://a\n\nother\n");
        }

        @Test
        @DisplayName("Several moves are applied bottom-up without disturbing each other")
        void severalMoves() {
            String content = "#EXTINF:-1 tvg-id=\"a\",A\n\nhttp://a.m3u8\n"
                    + "#EXTINF:-1 tvg-id=\"b\",B\n\nhttp://b.m3u8\n";
            List<FixOperation> fixes = checkService.check(content, ValidationMode.BASIC).fixes();

            String fixed = fixService.apply(content, fixes);

            assertThat(fixed).isEqualTo("#EXTINF:-1 tvg-id=\"a\",A\nhttp://a.m3u8\n\n"
                    + "#EXTINF:-1 tvg-id=\"b\",B\nhttp://b.m3u8\n\n");
            assertThat(checkService.check(fixed, ValidationMode.BASIC).diagnostics()).isEmpty();
        }
    }

    @Test
    @DisplayName("Re-checking a fixed playlist finds nothing left to fix")
    void fixedPlaylistIsClean() {
        String content = "#EXTM3U\n"
                + "#EXTINF:-1,News One\nhttp://n1.m3u8\n"
                + "#EXTINF:-1 group-title=\"Sports\",Sports Two\n\nhttp://s2.m3u8\n";
        PlaylistCheckResult first = checkService.check(content, ValidationMode.ADVANCED);
        assertThat(first.fixes()).hasSize(3);

        PlaylistCheckResult second = checkService.check(fixService.apply(content, first.fixes()), ValidationMode.ADVANCED);

        assertThat(second.fixes()).isEmpty();
        assertThat(second.diagnostics()).isEmpty();
        assertThat(second.entries()).extracting(PlaylistEntry::getTvgId).containsExactly("news_one", "sports_two");
    }

    @Test
    @DisplayName("Suggested names with commas are stored without them and settle after one fix")
    void commaInSuggestedNameSettles() {
        String content = "#EXTM3U\n#EXTINF:-1,\"Foo, Bar\",Desc\nhttp://x/y.m3u8\n";
        PlaylistCheckResult first = checkService.check(content, ValidationMode.ADVANCED);
        String fixed = fixService.apply(content, first.fixes());

        assertThat(fixed).contains("tvg-name=\"Foo Bar\",\"Foo, Bar\",Desc\n");

        PlaylistCheckResult second = checkService.check(fixed, ValidationMode.ADVANCED);

        assertThat(second.fixes()).isEmpty();
        assertThat(second.diagnostics()).isEmpty();
        assertThat(second.entries()).singleElement().satisfies(entry -> {
            assertThat(entry.getName()).isEqualTo("\"Foo, Bar\",Desc");
            assertThat(entry.getTvgName()).isEqualTo("Foo Bar");
            assertThat(entry.getTvgId()).isEqualTo("foo_bar");
        });
    }

    @Test
    void splitsOnAllLineTerminators() {
        assertThat(PlaylistFixService.splitKeepingTerminators("a\nb\r\nc\rd"))
                .containsExactly("a\n", "b\r\n", "c\r", "d");
    }
}
