package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.core.model.FixOperation;
import com.iptvcheck.validator.core.model.RebuildAttributesFix;
import com.iptvcheck.validator.core.model.ReorderStreamUrlFix;
import com.iptvcheck.validator.core.text.ExtinfAttributeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Replays staged fix operations against the original playlist text.
 * <p>
 * Fixes carry line numbers of the original text. They are applied from the bottom of the
 * file upwards so that inserting or removing a line never shifts a line a later fix still needs.
 */
@Service
public class PlaylistFixService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistFixService.class);

    private static final String NEWLINE = "\n";

    /**
     * Applies the fixes and returns the corrected text. Fixes that no longer fit the text are skipped.
     *
     * @param content original playlist text
     * @param fixes   fixes produced for that text, in any order
     * @return the corrected playlist text
     */
    public String apply(String content, Collection<? extends FixOperation> fixes) {
        if (content == null) {
            content = "";
        }
        if (fixes == null || fixes.isEmpty()) {
            return content;
        }

        List<String> lines = splitKeepingTerminators(content);
        List<FixOperation> ordered = new ArrayList<>(fixes);
        // stable: fixes on the same line keep their staging order
        ordered.sort(Comparator.comparingInt(FixOperation::getLineNum).reversed());

        for (FixOperation fix : ordered) {
            int headerIndex = fix.getLineNum() - 1;
            if (headerIndex < 0 || headerIndex >= lines.size()) {
                log.warn("Skipping fix at invalid line {} (playlist has {} lines): {}", fix.getLineNum(), lines.size(), fix);
                continue;
            }
            if (fix instanceof RebuildAttributesFix rebuild) {
                rebuildHeader(lines, headerIndex, rebuild);
            } else if (fix instanceof ReorderStreamUrlFix reorder) {
                moveStreamUrl(lines, headerIndex, reorder);
            } else {
                log.warn("Skipping unsupported fix type {}", fix.getClass().getSimpleName());
            }
        }

        return String.join("", lines);
    }

    private void rebuildHeader(List<String> lines, int headerIndex, RebuildAttributesFix fix) {
        String header = ExtinfAttributeFormatter.formatHeader(
                fix.getDuration(), fix.getFinalAttributes(), fix.getChannelName());
        String terminator = terminatorOf(lines.get(headerIndex));
        lines.set(headerIndex, header + (terminator.isEmpty() ? NEWLINE : terminator));
    }

    private void moveStreamUrl(List<String> lines, int headerIndex, ReorderStreamUrlFix fix) {
        String url = fix.getStreamUrl().strip();

        String nextLine = headerIndex + 1 < lines.size() ? lines.get(headerIndex + 1).strip() : "";
        if (nextLine.equals(url)) {
            return;
        }

        int originalIndex = fix.getOriginalStreamLineNum() - 1;
        if (originalIndex > headerIndex && originalIndex < lines.size() && lines.get(originalIndex).strip().equals(url)) {
            lines.remove(originalIndex);
        } else {
            log.warn("Stream URL for channel '{}' not found at expected original line {}; inserting only",
                    fix.getChannelName(), fix.getOriginalStreamLineNum());
        }

        lines.add(headerIndex + 1, url + NEWLINE);
    }

    /**
     * Splits text into lines, each keeping its own {@code \n}, {@code \r\n} or {@code \r} terminator.
     * The last line has no terminator when the text does not end with one.
     */
    static List<String> splitKeepingTerminators(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int length = content.length();
        for (int i = 0; i < length; i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                lines.add(content.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < length && content.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(content.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < length) {
            lines.add(content.substring(start));
        }
        return lines;
    }

    private static String terminatorOf(String line) {
        if (line.endsWith("\r\n")) {
            return "\r\n";
        }
        if (line.endsWith("\n") || line.endsWith("\r")) {
            return line.substring(line.length() - 1);
        }
        return "";
    }
}
