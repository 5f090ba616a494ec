package com.iptvcheck.validator.core.model;

import java.util.Objects;

/**
 * Moves a stream URL that was found further down the file so that it directly follows its header.
 */
public final class ReorderStreamUrlFix implements FixOperation {

    private final int lineNum;
    private final int originalStreamLineNum;
    private final String streamUrl;
    private final String channelName;

    public ReorderStreamUrlFix(int lineNum, int originalStreamLineNum, String streamUrl, String channelName) {
        this.lineNum = lineNum;
        this.originalStreamLineNum = originalStreamLineNum;
        this.streamUrl = Objects.requireNonNull(streamUrl, "streamUrl must not be null");
        this.channelName = Objects.requireNonNull(channelName, "channelName must not be null");
    }

    @Override
    public int getLineNum() {
        return lineNum;
    }

    public int getOriginalStreamLineNum() {
        return originalStreamLineNum;
    }

    public String getStreamUrl() {
        return streamUrl;
    }

    @Override
    public String getChannelName() {
        return channelName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReorderStreamUrlFix that = (ReorderStreamUrlFix) o;
        return lineNum == that.lineNum
                && originalStreamLineNum == that.originalStreamLineNum
                && streamUrl.equals(that.streamUrl)
                && channelName.equals(that.channelName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNum, originalStreamLineNum, streamUrl, channelName);
    }

    @Override
    public String toString() {
        return "ReorderStreamUrlFix{line=" + lineNum + ", from=" + originalStreamLineNum + ", url='" + streamUrl + "'}";
    }
}
