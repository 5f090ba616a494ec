package com.iptvcheck.validator.core.text;

import com.iptvcheck.validator.core.model.ExtinfAttributes;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Serializes attributes back into the {@code #EXTINF} form.
 * Keys are written in sorted order so rebuilt lines are stable; blank values are dropped.
 */
public final class ExtinfAttributeFormatter {

    private ExtinfAttributeFormatter() {
    }

    public static String format(ExtinfAttributes attributes) {
        StringJoiner joiner = new StringJoiner(" ");
        for (Map.Entry<String, String> entry : attributes.toSortedMap().entrySet()) {
            String value = entry.getValue();
            if (value != null && !value.isBlank()) {
                joiner.add(entry.getKey() + "=\"" + value + "\"");
            }
        }
        return joiner.toString();
    }

    /**
     * Builds a complete header line without a line terminator.
     */
    public static String formatHeader(String duration, ExtinfAttributes attributes, String channelName) {
        String formatted = format(attributes);
        StringBuilder sb = new StringBuilder("#EXTINF:").append(duration);
        if (!formatted.isEmpty()) {
            sb.append(' ').append(formatted);
        }
        return sb.append(',').append(channelName).toString();
    }
}
