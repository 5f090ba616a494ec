package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.core.model.Diagnostic;
import com.iptvcheck.validator.core.model.Diagnostic.Severity;
import com.iptvcheck.validator.core.model.GuideChannel;
import com.iptvcheck.validator.core.model.GuideProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses XMLTV guides and reports structural and timing problems.
 * Only a document that is not well-formed XML aborts the check; everything else becomes a diagnostic.
 */
@Service
public class GuideCheckService {

    private static final Logger log = LoggerFactory.getLogger(GuideCheckService.class);

    private static final Pattern XMLTV_TIME = Pattern.compile("(\\d{14})\\s*([+-]\\d{4})?");
    private static final DateTimeFormatter XMLTV_TIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuuMMddHHmmss").withResolverStyle(ResolverStyle.STRICT);

    /**
     * Result record containing the findings and entities of one guide.
     *
     * @param channels channels by id, in declaration order
     * @param programs programs of registered channels, grouped by channel in declaration order
     */
    public record GuideCheckResult(
            List<Diagnostic> diagnostics,
            Map<String, GuideChannel> channels,
            List<GuideProgram> programs
    ) {
        public static GuideCheckResult failed(Diagnostic diagnostic) {
            return new GuideCheckResult(List.of(diagnostic), Map.of(), List.of());
        }
    }

    private record Finding(boolean suggestion, String text) {}

    /**
     * Checks a guide document.
     *
     * @param content raw XMLTV text
     * @return diagnostics in discovery order, channels and programs; empty entities when the XML is malformed
     */
    public GuideCheckResult check(String content) {
        Document document;
        try {
            document = parse(content == null ? "" : content);
        } catch (SAXException e) {
            return GuideCheckResult.failed(Diagnostic.guide(Severity.ERROR,
                    "XML Syntax Error: The EPG file is not well-formed XML: " + e.getMessage()));
        } catch (ParserConfigurationException | IOException e) {
            log.error("Could not run the XML parser", e);
            return GuideCheckResult.failed(Diagnostic.guide(Severity.ERROR,
                    "General Error: An unexpected error occurred during EPG parsing: " + e.getMessage()));
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Element root = document.getDocumentElement();
        if (!"tv".equals(root.getTagName())) {
            diagnostics.add(Diagnostic.guide(Severity.ERROR, "Root element is not 'tv'. Expected '<tv>' tag."));
        }

        Map<String, GuideChannel> channels = new LinkedHashMap<>();
        for (Element element : childElements(root, "channel")) {
            GuideChannel channel = readChannel(element, channels, diagnostics);
            if (channel != null) {
                channels.put(channel.getId(), channel);
            }
        }

        Map<String, List<GuideProgram>> programsByChannel = new LinkedHashMap<>();
        channels.keySet().forEach(id -> programsByChannel.put(id, new ArrayList<>()));
        for (Element element : childElements(root, "programme")) {
            GuideProgram program = readProgram(element, diagnostics);
            List<GuideProgram> channelPrograms = programsByChannel.get(program.getChannelId());
            if (channelPrograms != null) {
                channelPrograms.add(program);
            } else if (program.getChannelId() != null) {
                diagnostics.add(Diagnostic.guide(Severity.ERROR, "Program references unknown channel ID '"
                        + program.getChannelId() + "'. Channel not found in <channel> definitions."));
            }
        }

        programsByChannel.forEach((channelId, programs) -> reportOverlaps(channelId, programs, diagnostics));

        List<GuideProgram> allPrograms = programsByChannel.values().stream()
                .flatMap(List::stream)
                .toList();
        return new GuideCheckResult(
                List.copyOf(diagnostics),
                Collections.unmodifiableMap(channels),
                allPrograms
        );
    }

    private GuideChannel readChannel(Element element, Map<String, GuideChannel> channels, List<Diagnostic> diagnostics) {
        String id = element.getAttribute("id");
        if (id.isEmpty()) {
            diagnostics.add(Diagnostic.guide(Severity.ERROR, "Channel element missing 'id' attribute."));
            return null;
        }
        if (channels.containsKey(id)) {
            diagnostics.add(Diagnostic.guide(Severity.ERROR, "Duplicate 'channel id' '" + id
                    + "' found in EPG file. Each channel must have a unique ID."));
        }

        List<Element> displayNameElements = childElements(element, "display-name");
        if (displayNameElements.isEmpty()) {
            diagnostics.add(Diagnostic.guide(Severity.WARNING, "Channel '" + id
                    + "' missing 'display-name'. This is what Channels DVR displays as the channel name."));
        }
        List<String> displayNames = displayNameElements.stream()
                .map(GuideCheckService::text)
                .filter(name -> !name.isEmpty())
                .toList();

        List<Element> icons = childElements(element, "icon");
        String iconUrl = icons.isEmpty() || !icons.get(0).hasAttribute("src") ? null : icons.get(0).getAttribute("src");

        return new GuideChannel(id, displayNames, iconUrl);
    }

    private GuideProgram readProgram(Element element, List<Diagnostic> diagnostics) {
        String channelId = attributeOrNull(element, "channel");
        String start = attributeOrNull(element, "start");
        String stop = attributeOrNull(element, "stop");

        List<Element> titles = childElements(element, "title");
        String title = titles.isEmpty() || text(titles.get(0)).isEmpty() ? GuideProgram.UNKNOWN_TITLE : text(titles.get(0));

        List<Finding> findings = new ArrayList<>();
        if (channelId == null) {
            findings.add(new Finding(false, "Program element missing 'channel' attribute."));
        }

        LocalDateTime startTime = null;
        if (start == null) {
            findings.add(new Finding(false, "Missing 'start' time."));
        } else {
            startTime = parseXmltvTime(start);
            if (startTime == null) {
                findings.add(new Finding(false, "Invalid 'start' time format: '" + start + "'. Expected YYYYMMDDHHMMSS +/-ZZZZ."));
            }
        }

        LocalDateTime stopTime = null;
        if (stop == null) {
            findings.add(new Finding(false, "Missing 'stop' time."));
        } else {
            stopTime = parseXmltvTime(stop);
            if (stopTime == null) {
                findings.add(new Finding(false, "Invalid 'stop' time format: '" + stop + "'. Expected YYYYMMDDHHMMSS +/-ZZZZ."));
            }
        }

        if (startTime != null && stopTime != null && !startTime.isBefore(stopTime)) {
            findings.add(new Finding(false, "Start time (" + start + ") is equal to or after stop time (" + stop + ")."));
        }

        if (!anyText(titles)) {
            findings.add(new Finding(false, "Missing 'title'. Essential for guide display."));
        }

        boolean hasDescription = anyText(childElements(element, "desc"));
        if (!hasDescription) {
            findings.add(new Finding(true, "Suggestion: Missing 'desc' (description). Adds rich info to guide."));
        }

        boolean movie = childElements(element, "category").stream()
                .anyMatch(category -> "movie".equalsIgnoreCase(text(category)));

        boolean hasSeriesId = attributeOrNull(element, "series-id") != null;
        if (!hasSeriesId && !movie) {
            findings.add(new Finding(true, "Suggestion: Missing 'series-id'. Crucial for grouping TV show recordings."));
        }

        boolean hasEpisodeNum = anyText(childElements(element, "episode-num"));
        if (!hasEpisodeNum && !movie) {
            findings.add(new Finding(true, "Suggestion: Missing 'episode-num'. Helps uniquely identify episodes."));
        }

        if (!findings.isEmpty()) {
            boolean onlySuggestions = findings.stream().allMatch(Finding::suggestion);
            String message = "Channel '" + channelId + "' Program ('" + title + "' from "
                    + (start == null ? "N/A" : start) + " to " + (stop == null ? "N/A" : stop) + "): "
                    + findings.stream().map(Finding::text).collect(Collectors.joining("; "));
            diagnostics.add(Diagnostic.guide(onlySuggestions ? Severity.SUGGESTION : Severity.ERROR, message));
        }

        return new GuideProgram(channelId, start, stop, startTime, stopTime, title,
                hasDescription, hasSeriesId, hasEpisodeNum, movie);
    }

    /**
     * Reports adjacent programs of one channel whose intervals overlap. Programs with equal start
     * times keep their document order.
     */
    private void reportOverlaps(String channelId, List<GuideProgram> programs, List<Diagnostic> diagnostics) {
        List<GuideProgram> timed = programs.stream()
                .filter(GuideProgram::hasValidTimes)
                .sorted(Comparator.comparing(GuideProgram::getStartTime))
                .toList();

        for (int i = 0; i < timed.size() - 1; i++) {
            GuideProgram current = timed.get(i);
            GuideProgram next = timed.get(i + 1);
            if (current.getStopTime().isAfter(next.getStartTime())) {
                diagnostics.add(Diagnostic.guide(Severity.WARNING, "Overlapping programs for channel '" + channelId + "': '"
                        + current.getTitle() + "' (" + current.describeTimeRange() + ") overlaps with '"
                        + next.getTitle() + "' (" + next.describeTimeRange() + "). "
                        + "Channels DVR might misinterpret guide data here."));
            }
        }
    }

    /**
     * Parses an XMLTV timestamp ({@code YYYYMMDDHHMMSS} with an optional {@code +/-ZZZZ} offset).
     * The offset is ignored.
     *
     * @return the local date-time, or null when the text is not a valid timestamp
     */
    static LocalDateTime parseXmltvTime(String value) {
        Matcher matcher = XMLTV_TIME.matcher(value);
        if (!matcher.lookingAt()) {
            return null;
        }
        try {
            return LocalDateTime.parse(matcher.group(1), XMLTV_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Document parse(String content) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        // XMLTV files often declare a DOCTYPE; keep it legal but never fetch or expand anything external
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                log.debug("XML parser warning: {}", exception.getMessage());
            }

            @Override
            public void error(SAXParseException exception) throws SAXException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXException {
                throw exception;
            }
        });

        String xml = content.startsWith("\uFEFF") ? content.substring(1) : content;
        return builder.parse(new InputSource(new StringReader(xml)));
    }

    private static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static String attributeOrNull(Element element, String name) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static String text(Element element) {
        String content = element.getTextContent();
        return content == null ? "" : content.strip();
    }

    private static boolean anyText(List<Element> elements) {
        return elements.stream().anyMatch(element -> !text(element).isEmpty());
    }
}
