package com.iptvcheck.validator.core.model;

import java.util.Objects;

/**
 * Replaces an {@code #EXTINF} header line with one rebuilt from the final attribute set.
 */
public final class RebuildAttributesFix implements FixOperation {

    private final int lineNum;
    private final String duration;
    private final String channelName;
    private final ExtinfAttributes finalAttributes;

    public RebuildAttributesFix(int lineNum, String duration, String channelName, ExtinfAttributes finalAttributes) {
        this.lineNum = lineNum;
        this.duration = Objects.requireNonNull(duration, "duration must not be null");
        this.channelName = Objects.requireNonNull(channelName, "channelName must not be null");
        this.finalAttributes = Objects.requireNonNull(finalAttributes, "finalAttributes must not be null");
    }

    @Override
    public int getLineNum() {
        return lineNum;
    }

    public String getDuration() {
        return duration;
    }

    @Override
    public String getChannelName() {
        return channelName;
    }

    public ExtinfAttributes getFinalAttributes() {
        return finalAttributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RebuildAttributesFix that = (RebuildAttributesFix) o;
        return lineNum == that.lineNum
                && duration.equals(that.duration)
                && channelName.equals(that.channelName)
                && finalAttributes.equals(that.finalAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNum, duration, channelName, finalAttributes);
    }

    @Override
    public String toString() {
        return "RebuildAttributesFix{line=" + lineNum + ", attributes=" + finalAttributes + "}";
    }
}
