package com.iptvcheck.validator.core.text;

import com.iptvcheck.validator.core.model.ExtinfAttributes;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks a short, clean display name for a playlist entry.
 * <p>
 * Candidates are tried in order:
 * <ol>
 *     <li>the {@code tvc-guide-title} attribute</li>
 *     <li>a quoted segment at the start of the raw name</li>
 *     <li>the raw name up to its first comma, when that is short</li>
 *     <li>an aggressive cleanup of the whole raw name</li>
 * </ol>
 * Each step is exposed separately so it can be tested on its own.
 * <p>
 * Step 3 takes the whole raw name when it has no comma and is 3 to 50 characters long. The
 * cleanup of step 4 (description, bracket and qualifier stripping) therefore only runs when
 * that segment is shorter or longer: {@code ESPN - Sports news} is kept whole and later
 * becomes the id {@code espn_sports_news}.
 * <p>
 * A resolved name may still contain commas or double quotes; use {@link #toAttributeValue}
 * before writing it into an {@code #EXTINF} attribute.
 */
public final class DisplayNameResolver {

    public static final String UNKNOWN_CHANNEL = "Unknown Channel";

    static final int MAX_QUOTED_LENGTH = 60;
    static final int MIN_SEGMENT_LENGTH = 3;
    static final int MAX_NAME_LENGTH = 50;
    static final int TRUNCATED_LENGTH = 47;

    private static final Pattern LEADING_QUOTED = Pattern.compile("[\"']([^\"']+)[\"']");
    private static final Pattern QUOTES = Pattern.compile("[\"']");
    private static final Pattern DOUBLE_DASH_SUFFIX = Pattern.compile("\\s+--\\s+.*$");
    private static final Pattern DASH_SUFFIX = Pattern.compile("\\s+-\\s+.*$");
    private static final Pattern COLON_SUFFIX = Pattern.compile("\\s*:\\s+.*$");
    private static final Pattern PARENTHESES_SUFFIX = Pattern.compile("\\s*\\(.*\\)$");
    private static final Pattern BRACKETS_SUFFIX = Pattern.compile("\\s*\\[.*\\]$");
    private static final Pattern TRAILING_QUALIFIER = Pattern.compile(
            "\\s+(HD|SD|Live|TV|Channel|Show|Movie|Series|Now)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ATTRIBUTE_BREAKING_CHARS = Pattern.compile("[\",]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern NON_DISPLAY_CHARS = Pattern.compile("[^\\w\\s.,&+\\-:]", Pattern.UNICODE_CHARACTER_CLASS);

    private DisplayNameResolver() {
    }

    /**
     * @param rawName    text after the separator comma of the {@code #EXTINF} line
     * @param attributes parsed attributes of the same line
     * @return a non-empty display name; {@value #UNKNOWN_CHANNEL} when nothing usable is left
     */
    public static String resolve(String rawName, ExtinfAttributes attributes) {
        String candidate = rawName == null ? "" : rawName.strip();
        return guideTitleAttribute(attributes)
                .or(() -> leadingQuotedSegment(candidate))
                .or(() -> firstCommaSegment(candidate))
                .orElseGet(() -> aggressiveCleanup(candidate));
    }

    /**
     * Makes a display name safe to use as a quoted {@code #EXTINF} attribute value. Commas would end
     * the attribute section of the line and double quotes would end the value, so both become spaces.
     *
     * @return the cleaned name; {@value #UNKNOWN_CHANNEL} when nothing is left
     */
    public static String toAttributeValue(String displayName) {
        String value = ATTRIBUTE_BREAKING_CHARS.matcher(displayName == null ? "" : displayName).replaceAll(" ");
        value = WHITESPACE_RUN.matcher(value).replaceAll(" ").strip();
        return value.isEmpty() ? UNKNOWN_CHANNEL : value;
    }

    static Optional<String> guideTitleAttribute(ExtinfAttributes attributes) {
        String title = attributes.getTrimmed(ExtinfAttributes.GUIDE_TITLE);
        return title.isEmpty() ? Optional.empty() : Optional.of(title);
    }

    static Optional<String> leadingQuotedSegment(String rawName) {
        Matcher matcher = LEADING_QUOTED.matcher(rawName);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        String quoted = matcher.group(1).strip();
        if (quoted.isEmpty() || quoted.length() >= MAX_QUOTED_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(quoted);
    }

    static Optional<String> firstCommaSegment(String rawName) {
        int comma = rawName.indexOf(',');
        String segment = (comma >= 0 ? rawName.substring(0, comma) : rawName).strip();
        String unquoted = QUOTES.matcher(segment).replaceAll("").strip();
        if (unquoted.length() < MIN_SEGMENT_LENGTH || unquoted.length() > MAX_NAME_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(unquoted);
    }

    static String aggressiveCleanup(String rawName) {
        String name = stripQuotes(rawName);
        name = stripDescriptionSuffix(name);
        name = stripBracketedSuffix(name);
        name = stripTrailingQualifier(name);
        name = truncate(name);
        name = NON_DISPLAY_CHARS.matcher(name).replaceAll("").strip();
        return name.isEmpty() ? UNKNOWN_CHANNEL : name;
    }

    static String stripQuotes(String name) {
        return QUOTES.matcher(name).replaceAll("").strip();
    }

    static String stripDescriptionSuffix(String name) {
        String result = DOUBLE_DASH_SUFFIX.matcher(name).replaceAll("").strip();
        result = DASH_SUFFIX.matcher(result).replaceAll("").strip();
        return COLON_SUFFIX.matcher(result).replaceAll("").strip();
    }

    static String stripBracketedSuffix(String name) {
        String result = PARENTHESES_SUFFIX.matcher(name).replaceAll("").strip();
        return BRACKETS_SUFFIX.matcher(result).replaceAll("").strip();
    }

    static String stripTrailingQualifier(String name) {
        return TRAILING_QUALIFIER.matcher(name).replaceAll("").strip();
    }

    static String truncate(String name) {
        if (name.length() <= MAX_NAME_LENGTH) {
            return name;
        }
        return name.substring(0, TRUNCATED_LENGTH).strip() + "...";
    }
}
