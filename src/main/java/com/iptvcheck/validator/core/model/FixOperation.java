package com.iptvcheck.validator.core.model;

/**
 * A corrective edit to a playlist, addressed by the 1-indexed line number of the
 * original (unmodified) playlist text.
 */
public interface FixOperation {

    /**
     * @return the 1-indexed line of the {@code #EXTINF} header this fix belongs to
     */
    int getLineNum();

    /**
     * @return the raw channel name of the entry, used for messages and logs
     */
    String getChannelName();
}
