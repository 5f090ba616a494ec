package com.iptvcheck.validator.core.text;

import java.util.regex.Pattern;

/**
 * Heuristic check for ids that look like Gracenote station or program ids, which
 * Channels DVR can resolve to guide data without an external XMLTV file.
 */
public final class GracenoteIdClassifier {

    private static final Pattern GRACENOTE_ID = Pattern.compile("^(EP|MV|SH|GR)\\d{8,}(\\.[FS]\\.EP)?$|^\\d{8,}$");

    private GracenoteIdClassifier() {
    }

    public static boolean looksLikeGracenoteId(String tvgId) {
        if (tvgId == null || tvgId.isEmpty()) {
            return false;
        }
        return GRACENOTE_ID.matcher(tvgId).matches();
    }
}
