package com.iptvcheck.validator.core.model;

import java.util.Objects;

/**
 * A single finding produced while checking a playlist, a guide, or the two against each other.
 *
 * @param severity   how serious the finding is; consumers may filter on it
 * @param source     which analysis produced it
 * @param message    human-readable description, without the severity prefix
 * @param lineNumber 1-indexed playlist line the finding refers to, or null
 */
public record Diagnostic(
        Severity severity,
        Source source,
        String message,
        Integer lineNumber
) {

    public enum Severity {
        ERROR("Error"),
        WARNING("Warning"),
        SUGGESTION("Suggestion"),
        NOTE("Note");

        private final String label;

        Severity(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum Source {
        PLAYLIST("M3U"),
        GUIDE("EPG"),
        COMPATIBILITY("Compatibility");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic playlist(Severity severity, String message, int lineNumber) {
        return new Diagnostic(severity, Source.PLAYLIST, message, lineNumber);
    }

    public static Diagnostic playlist(Severity severity, String message) {
        return new Diagnostic(severity, Source.PLAYLIST, message, null);
    }

    public static Diagnostic guide(Severity severity, String message) {
        return new Diagnostic(severity, Source.GUIDE, message, null);
    }

    public static Diagnostic compatibility(Severity severity, String message) {
        return new Diagnostic(severity, Source.COMPATIBILITY, message, null);
    }

    /**
     * Renders the diagnostic as a plain text line, e.g. {@code "M3U Warning: ..."}.
     */
    public String render() {
        return source.label() + " " + severity.label() + ": " + message;
    }
}
