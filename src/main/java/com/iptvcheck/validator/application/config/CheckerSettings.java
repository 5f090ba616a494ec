package com.iptvcheck.validator.application.config;

import com.iptvcheck.validator.core.model.ValidationMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunables for the playlist checks, bound from {@code iptv-check.*} properties.
 */
@Component
public class CheckerSettings {

    public static final int DEFAULT_MAX_CHANNELS = 750;
    public static final String DEFAULT_GROUP_TITLE = "Unsorted";

    private final int maxChannels;
    private final String defaultGroupTitle;
    private final ValidationMode defaultMode;

    public CheckerSettings(
            @Value("${iptv-check.max-channels:750}") int maxChannels,
            @Value("${iptv-check.default-group-title:Unsorted}") String defaultGroupTitle,
            @Value("${iptv-check.default-mode:advanced}") String defaultMode
    ) {
        if (maxChannels < 1) {
            throw new IllegalStateException("iptv-check.max-channels must be positive, got " + maxChannels);
        }
        if (defaultGroupTitle == null || defaultGroupTitle.isBlank()) {
            throw new IllegalStateException("iptv-check.default-group-title must not be blank");
        }
        this.maxChannels = maxChannels;
        this.defaultGroupTitle = defaultGroupTitle.strip();
        this.defaultMode = ValidationMode.fromString(defaultMode);
    }

    /**
     * Settings matching the documented Channels DVR limits, for use outside a Spring context.
     */
    public static CheckerSettings defaults() {
        return new CheckerSettings(DEFAULT_MAX_CHANNELS, DEFAULT_GROUP_TITLE, "advanced");
    }

    /**
     * Number of channels above which Channels DVR is known to struggle with a single playlist.
     */
    public int getMaxChannels() {
        return maxChannels;
    }

    public String getDefaultGroupTitle() {
        return defaultGroupTitle;
    }

    public ValidationMode getDefaultMode() {
        return defaultMode;
    }
}
