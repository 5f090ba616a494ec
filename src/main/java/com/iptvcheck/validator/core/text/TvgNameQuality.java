package com.iptvcheck.validator.core.text;

import java.util.regex.Pattern;

/**
 * Flags {@code tvg-name} values that are unlikely to be a clean channel name:
 * numeric ids, overlong text, stray quotes or commas, and trailing descriptions.
 */
public final class TvgNameQuality {

    static final int MAX_NAME_LENGTH = 50;

    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final Pattern DOUBLE_DASH_DESCRIPTION = Pattern.compile("\\s+--\\s+.*$");
    private static final Pattern COLON_DESCRIPTION = Pattern.compile("\\s*:\\s+.*$");
    private static final Pattern TRAILING_PARENTHESES = Pattern.compile("\\s*\\([^)]*\\)$");

    private TvgNameQuality() {
    }

    public static boolean isLowQuality(String tvgName) {
        if (tvgName == null) {
            return false;
        }
        return NUMERIC.matcher(tvgName).matches()
                || tvgName.length() > MAX_NAME_LENGTH
                || tvgName.contains(",")
                || tvgName.contains("\"")
                || tvgName.contains("'")
                || DOUBLE_DASH_DESCRIPTION.matcher(tvgName).find()
                || COLON_DESCRIPTION.matcher(tvgName).find()
                || TRAILING_PARENTHESES.matcher(tvgName).find();
    }
}
