package com.iptvcheck.validator.core.model;

import java.util.Objects;

/**
 * Domain entity representing one playable channel recognized in an M3U playlist.
 * Attribute values are the effective ones, i.e. after any suggested fix was staged.
 * Pure domain object with no framework dependencies.
 */
public class PlaylistEntry {

    private final String name;
    private final String tvgId;
    private final String tvgName;
    private final String tvgLogo;
    private final String groupTitle;
    private final String streamUrl;

    public PlaylistEntry(String name, String tvgId, String tvgName, String tvgLogo, String groupTitle, String streamUrl) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.tvgId = Objects.requireNonNull(tvgId, "tvgId must not be null");
        this.tvgName = Objects.requireNonNull(tvgName, "tvgName must not be null");
        this.tvgLogo = Objects.requireNonNull(tvgLogo, "tvgLogo must not be null");
        this.groupTitle = Objects.requireNonNull(groupTitle, "groupTitle must not be null");
        this.streamUrl = Objects.requireNonNull(streamUrl, "streamUrl must not be null");
    }

    public String getName() {
        return name;
    }

    public String getTvgId() {
        return tvgId;
    }

    public String getTvgName() {
        return tvgName;
    }

    public String getTvgLogo() {
        return tvgLogo;
    }

    public String getGroupTitle() {
        return groupTitle;
    }

    public String getStreamUrl() {
        return streamUrl;
    }

    public boolean hasTvgId() {
        return !tvgId.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlaylistEntry that = (PlaylistEntry) o;
        return name.equals(that.name)
                && tvgId.equals(that.tvgId)
                && tvgName.equals(that.tvgName)
                && tvgLogo.equals(that.tvgLogo)
                && groupTitle.equals(that.groupTitle)
                && streamUrl.equals(that.streamUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tvgId, tvgName, tvgLogo, groupTitle, streamUrl);
    }

    @Override
    public String toString() {
        return "PlaylistEntry{name='" + name + "', tvgId='" + tvgId + "', streamUrl='" + streamUrl + "'}";
    }
}
