package com.iptvcheck.validator.core.text;

import com.iptvcheck.validator.core.model.ExtinfAttributes;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code key="value"} tokens between the duration and the name of an {@code #EXTINF} line.
 * Values may contain spaces but no double quotes.
 */
public final class ExtinfAttributeParser {

    private static final Pattern ATTRIBUTE = Pattern.compile("(\\S+)=\"([^\"]*)\"");

    private ExtinfAttributeParser() {
    }

    public static ExtinfAttributes parse(String attributesText) {
        if (attributesText == null || attributesText.isBlank()) {
            return ExtinfAttributes.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        Matcher matcher = ATTRIBUTE.matcher(attributesText);
        while (matcher.find()) {
            values.put(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
        }
        return ExtinfAttributes.of(values);
    }
}
