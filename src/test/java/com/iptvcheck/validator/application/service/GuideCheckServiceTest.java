package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.application.service.GuideCheckService.GuideCheckResult;
import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.Diagnostic.Severity;
import com.iptvcheck.validator.core.model.GuideChannel;
import com.iptvcheck.validator.core.model.GuideProgram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class GuideCheckServiceTest {

    private static final String CHANNEL_A = "<channel id=\"a\"><display-name>A One</display-name>"
            + "<icon src=\"http://i/a.png\"/></channel>";

    private GuideCheckService service;

    @BeforeEach
    void setUp() {
        service = new GuideCheckService();
    }

    private static String tv(String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<tv>" + body + "</tv>";
    }

    private static String program(String channel, String start, String stop, String title) {
        return "<programme channel=\"" + channel + "\" start=\"" + start + "\" stop=\"" + stop + "\" series-id=\"s1\">"
                + "<title>" + title + "</title><desc>About " + title + "</desc><episode-num>1</episode-num></programme>";
    }

    // =========================================================================
    // Channels
    // =========================================================================

    @Nested
    @DisplayName("Channels")
    class ChannelTests {

        @Test
        @DisplayName("A complete guide produces no diagnostics")
        void completeGuide() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + program("a", "20240101100000 +0000", "20240101110000 +0000", "Show")));

            assertThat(result.diagnostics()).isEmpty();
            assertThat(result.channels()).containsOnlyKeys("a");
            GuideChannel channel = result.channels().get("a");
            assertThat(channel.getDisplayNames()).containsExactly("A One");
            assertThat(channel.getIconUrl()).isEqualTo("http://i/a.png");
            assertThat(result.programs()).singleElement().satisfies(p -> {
                assertThat(p.getTitle()).isEqualTo("Show");
                assertThat(p.getStartTime()).isEqualTo(LocalDateTime.of(2024, 1, 1, 10, 0));
            });
        }

        @Test
        @DisplayName("A channel without display-name is a warning and is still recorded")
        void missingDisplayName() {
            GuideCheckResult result = service.check(tv("<channel id=\"a\"/>"));

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.WARNING);
                assertThat(d.message()).startsWith("Channel 'a' missing 'display-name'.");
            });
            assertThat(result.channels().get("a").getDisplayNames()).isEmpty();
            assertThat(result.channels().get("a").getIconUrl()).isNull();
        }

        @Test
        @DisplayName("Channels without id are reported and skipped")
        void missingId() {
            GuideCheckResult result = service.check(tv("<channel><display-name>X</display-name></channel>"));

            assertThat(result.diagnostics()).extracting(Diagnostic::message)
                    .containsExactly("Channel element missing 'id' attribute.");
            assertThat(result.channels()).isEmpty();
        }

        @Test
        @DisplayName("A duplicate channel id is an error and the later definition wins")
        void duplicateId() {
            GuideCheckResult result = service.check(tv("<channel id=\"a\"><display-name>First</display-name></channel>"
                    + "<channel id=\"a\"><display-name>Second</display-name></channel>"));

            assertThat(result.diagnostics()).singleElement()
                    .satisfies(d -> assertThat(d.message()).startsWith("Duplicate 'channel id' 'a'"));
            assertThat(result.channels().get("a").getDisplayNames()).containsExactly("Second");
        }

        @Test
        @DisplayName("A root other than tv is an error but the document is still read")
        void wrongRoot() {
            GuideCheckResult result = service.check("<guide><channel id=\"a\"><display-name>A</display-name></channel></guide>");

            assertThat(result.diagnostics()).extracting(Diagnostic::message)
                    .containsExactly("Root element is not 'tv'. Expected '<tv>' tag.");
            assertThat(result.channels()).containsOnlyKeys("a");
        }
    }

    // =========================================================================
    // Document errors
    // =========================================================================

    @Nested
    @DisplayName("Document errors")
    class DocumentErrorTests {

        @Test
        @DisplayName("Malformed XML yields a single syntax error and no data")
        void malformedXml() {
            GuideCheckResult result = service.check("<tv><channel id='a'></tv>");

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.ERROR);
                assertThat(d.message()).startsWith("XML Syntax Error: The EPG file is not well-formed XML:");
            });
            assertThat(result.channels()).isEmpty();
            assertThat(result.programs()).isEmpty();
        }

        @Test
        @DisplayName("A leading byte order mark is accepted")
        void byteOrderMark() {
            GuideCheckResult result = service.check("\uFEFF" + tv(CHANNEL_A));

            assertThat(result.diagnostics()).isEmpty();
            assertThat(result.channels()).containsOnlyKeys("a");
        }
    }

    // =========================================================================
    // Programs
    // =========================================================================

    @Nested
    @DisplayName("Programs")
    class ProgramTests {

        @Test
        @DisplayName("Invalid timestamps are consolidated into one error per program")
        void invalidTimes() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + program("a", "2024-01-01", "20240101110000 +0000", "Show")));

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.ERROR);
                assertThat(d.message()).startsWith("Channel 'a' Program ('Show' from 2024-01-01 to 20240101110000 +0000):");
                assertThat(d.message()).contains("Invalid 'start' time format: '2024-01-01'");
            });
            assertThat(result.programs()).singleElement().satisfies(p -> assertThat(p.hasValidTimes()).isFalse());
        }

        @Test
        @DisplayName("A start at or after the stop is an error")
        void startAfterStop() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + program("a", "20240101110000 +0000", "20240101110000 +0000", "Show")));

            assertThat(result.diagnostics()).singleElement()
                    .satisfies(d -> assertThat(d.message()).contains("is equal to or after stop time"));
        }

        @Test
        @DisplayName("Missing optional details are a single suggestion")
        void suggestionsOnly() {
            GuideCheckResult result = service.check(tv(CHANNEL_A + "<programme channel=\"a\" "
                    + "start=\"20240101100000 +0000\" stop=\"20240101110000 +0000\"><title>Bare</title></programme>"));

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.SUGGESTION);
                assertThat(d.message()).contains("Missing 'desc'", "Missing 'series-id'", "Missing 'episode-num'");
            });
        }

        @Test
        @DisplayName("Movies do not need series or episode data")
        void moviesExempt() {
            GuideCheckResult result = service.check(tv(CHANNEL_A + "<programme channel=\"a\" "
                    + "start=\"20240101100000 +0000\" stop=\"20240101120000 +0000\"><title>Film</title>"
                    + "<desc>A film</desc><category>Movie</category></programme>"));

            assertThat(result.diagnostics()).isEmpty();
            assertThat(result.programs().get(0).isMovie()).isTrue();
        }

        @Test
        @DisplayName("Missing title is an error and the program is labelled as unknown")
        void missingTitle() {
            GuideCheckResult result = service.check(tv(CHANNEL_A + "<programme channel=\"a\" series-id=\"s\" "
                    + "start=\"20240101100000 +0000\" stop=\"20240101110000 +0000\">"
                    + "<desc>D</desc><episode-num>1</episode-num></programme>"));

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.ERROR);
                assertThat(d.message()).contains("'" + GuideProgram.UNKNOWN_TITLE + "'", "Missing 'title'");
            });
        }

        @Test
        @DisplayName("Programs for undeclared channels are errors and are not kept")
        void unknownChannel() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + program("zzz", "20240101100000 +0000", "20240101110000 +0000", "Lost")));

            assertThat(result.diagnostics()).extracting(Diagnostic::message).containsExactly(
                    "Program references unknown channel ID 'zzz'. Channel not found in <channel> definitions.");
            assertThat(result.programs()).isEmpty();
        }

        @Test
        @DisplayName("Programs are grouped by channel in declaration order")
        void groupedByChannel() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + "<channel id=\"b\"><display-name>B</display-name></channel>"
                    + program("b", "20240101100000 +0000", "20240101110000 +0000", "B1")
                    + program("a", "20240101100000 +0000", "20240101110000 +0000", "A1")
                    + program("b", "20240101110000 +0000", "20240101120000 +0000", "B2")));

            assertThat(result.programs()).extracting(GuideProgram::getTitle).containsExactly("A1", "B1", "B2");
        }
    }

    // =========================================================================
    // Overlaps
    // =========================================================================

    @Nested
    @DisplayName("Overlaps")
    class OverlapTests {

        @Test
        @DisplayName("Overlapping programs are reported in start order")
        void overlapReported() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + program("a", "20240101103000 +0000", "20240101113000 +0000", "Second")
                    + program("a", "20240101100000 +0000", "20240101110000 +0000", "First")));

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.WARNING);
                assertThat(d.message()).startsWith("Overlapping programs for channel 'a': 'First'");
                assertThat(d.message()).contains("overlaps with 'Second'");
            });
        }

        @Test
        @DisplayName("Programs with equal starts keep document order and still overlap")
        void equalStartsKeepDocumentOrder() {
            GuideCheckResult longFirst = service.check(tv(CHANNEL_A
                    + program("a", "20240101100000 +0000", "20240101120000 +0000", "Long")
                    + program("a", "20240101100000 +0000", "20240101110000 +0000", "Short")));
            GuideCheckResult shortFirst = service.check(tv(CHANNEL_A
                    + program("a", "20240101100000 +0000", "20240101110000 +0000", "Short")
                    + program("a", "20240101100000 +0000", "20240101120000 +0000", "Long")));

            assertThat(longFirst.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.severity()).isEqualTo(Severity.WARNING);
                assertThat(d.message()).startsWith("Overlapping programs for channel 'a': 'Long'");
                assertThat(d.message()).contains("overlaps with 'Short'");
            });
            assertThat(shortFirst.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.message()).startsWith("Overlapping programs for channel 'a': 'Short'");
                assertThat(d.message()).contains("overlaps with 'Long'");
            });
            assertThat(longFirst.programs()).extracting(GuideProgram::getTitle).containsExactly("Long", "Short");
        }

        @Test
        @DisplayName("Back-to-back programs do not overlap")
        void adjacentPrograms() {
            GuideCheckResult result = service.check(tv(CHANNEL_A
                    + program("a", "20240101100000 +0000", "20240101110000 +0000", "First")
                    + program("a", "20240101110000 +0000", "20240101120000 +0000", "Second")));

            assertThat(result.diagnostics()).isEmpty();
        }
    }

    @Nested
    @DisplayName("XMLTV timestamps")
    class TimestampTests {

        @Test
        void parsesWithAndWithoutOffset() {
            assertThat(GuideCheckService.parseXmltvTime("20240101120000 +0100")).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 0));
            assertThat(GuideCheckService.parseXmltvTime("20240101120000")).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 0));
        }

        @Test
        void rejectsInvalidValues() {
            assertThat(GuideCheckService.parseXmltvTime("20240230120000")).isNull();
            assertThat(GuideCheckService.parseXmltvTime("2024")).isNull();
            assertThat(GuideCheckService.parseXmltvTime("")).isNull();
        }
    }
}
