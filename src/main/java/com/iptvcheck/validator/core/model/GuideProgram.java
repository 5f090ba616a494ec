package com.iptvcheck.validator.core.model;

import java.time.LocalDateTime;

/**
 * Domain entity representing a {@code <programme>} element of an XMLTV guide.
 * Times are null when the corresponding attribute was missing or unparsable.
 */
public class GuideProgram {

    public static final String UNKNOWN_TITLE = "Unknown Title";

    private final String channelId;
    private final String start;
    private final String stop;
    private final LocalDateTime startTime;
    private final LocalDateTime stopTime;
    private final String title;
    private final boolean hasDescription;
    private final boolean hasSeriesId;
    private final boolean hasEpisodeNum;
    private final boolean movie;

    public GuideProgram(String channelId, String start, String stop, LocalDateTime startTime, LocalDateTime stopTime,
                        String title, boolean hasDescription, boolean hasSeriesId, boolean hasEpisodeNum, boolean movie) {
        this.channelId = channelId;
        this.start = start;
        this.stop = stop;
        this.startTime = startTime;
        this.stopTime = stopTime;
        this.title = title == null ? UNKNOWN_TITLE : title;
        this.hasDescription = hasDescription;
        this.hasSeriesId = hasSeriesId;
        this.hasEpisodeNum = hasEpisodeNum;
        this.movie = movie;
    }

    public String getChannelId() {
        return channelId;
    }

    /**
     * @return the raw {@code start} attribute, or null
     */
    public String getStart() {
        return start;
    }

    /**
     * @return the raw {@code stop} attribute, or null
     */
    public String getStop() {
        return stop;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getStopTime() {
        return stopTime;
    }

    public String getTitle() {
        return title;
    }

    public boolean hasDescription() {
        return hasDescription;
    }

    public boolean hasSeriesId() {
        return hasSeriesId;
    }

    public boolean hasEpisodeNum() {
        return hasEpisodeNum;
    }

    public boolean isMovie() {
        return movie;
    }

    public boolean hasValidTimes() {
        return startTime != null && stopTime != null;
    }

    /**
     * Formats the raw time range as {@code "start - stop"} for messages.
     */
    public String describeTimeRange() {
        return start + " - " + stop;
    }
}
