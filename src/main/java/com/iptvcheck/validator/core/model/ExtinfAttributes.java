package com.iptvcheck.validator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, case-insensitive view of the {@code key="value"} attributes of an {@code #EXTINF} line.
 * Keys are kept lowercase in insertion order. A missing key reads as the empty string.
 */
public final class ExtinfAttributes {

    public static final String TVG_ID = "tvg-id";
    public static final String TVG_NAME = "tvg-name";
    public static final String TVG_LOGO = "tvg-logo";
    public static final String GROUP_TITLE = "group-title";
    public static final String GUIDE_TITLE = "tvc-guide-title";

    private static final ExtinfAttributes EMPTY = new ExtinfAttributes(new LinkedHashMap<>());

    private final Map<String, String> values;

    private ExtinfAttributes(LinkedHashMap<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ExtinfAttributes empty() {
        return EMPTY;
    }

    public static ExtinfAttributes of(Map<String, String> source) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(normalizeKey(key), value == null ? "" : value));
        return new ExtinfAttributes(copy);
    }

    /**
     * Returns the raw value for the key, or an empty string when the key is absent.
     */
    public String get(String key) {
        return values.getOrDefault(normalizeKey(key), "");
    }

    /**
     * Returns the value for the key with surrounding whitespace removed.
     */
    public String getTrimmed(String key) {
        return get(key).strip();
    }

    public boolean contains(String key) {
        return values.containsKey(normalizeKey(key));
    }

    /**
     * Returns a copy with the given entry added or replaced. Existing key order is kept.
     */
    public ExtinfAttributes with(String key, String value) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(values);
        copy.put(normalizeKey(key), value == null ? "" : value);
        return new ExtinfAttributes(copy);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public Map<String, String> toSortedMap() {
        return new TreeMap<>(values);
    }

    private static String normalizeKey(String key) {
        return Objects.requireNonNull(key, "key must not be null").toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ExtinfAttributes) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
