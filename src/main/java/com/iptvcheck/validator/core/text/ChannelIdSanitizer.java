package com.iptvcheck.validator.core.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a {@code tvg-id} candidate from a channel display name.
 * <p>
 * Format: lowercase word characters separated by single underscores, e.g.
 * {@code "My Channel - East"} becomes {@code "my_channel_east"}.
 */
public final class ChannelIdSanitizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATOR_RUN = Pattern.compile("[\\s-]+", Pattern.UNICODE_CHARACTER_CLASS);

    private ChannelIdSanitizer() {
    }

    /**
     * @param name display name, may be null
     * @return the sanitized id, or an empty string when nothing usable remains
     */
    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        String kept = DISALLOWED.matcher(name).replaceAll("").strip();
        return SEPARATOR_RUN.matcher(kept).replaceAll("_").toLowerCase(Locale.ROOT);
    }
}
