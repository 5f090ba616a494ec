package com.iptvcheck.validator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Domain entity representing a {@code <channel>} element of an XMLTV guide.
 */
public class GuideChannel {

    private final String id;
    private final List<String> displayNames;
    private final String iconUrl;

    public GuideChannel(String id, List<String> displayNames, String iconUrl) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.displayNames = List.copyOf(Objects.requireNonNull(displayNames, "displayNames must not be null"));
        this.iconUrl = iconUrl;
    }

    public String getId() {
        return id;
    }

    public List<String> getDisplayNames() {
        return displayNames;
    }

    /**
     * @return the {@code src} of the channel icon, or null when the channel has none
     */
    public String getIconUrl() {
        return iconUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GuideChannel that = (GuideChannel) o;
        return id.equals(that.id) && displayNames.equals(that.displayNames) && Objects.equals(iconUrl, that.iconUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayNames, iconUrl);
    }
}
