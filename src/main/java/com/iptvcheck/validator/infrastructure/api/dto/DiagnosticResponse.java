package com.iptvcheck.validator.infrastructure.api.dto;

import com.iptvcheck.validator.core.model.Diagnostic;

/**
 * Response DTO for a single diagnostic.
 */
public record DiagnosticResponse(
        String severity,
        String source,
        String message,
        Integer lineNumber,
        String text
) {
    public static DiagnosticResponse from(Diagnostic diagnostic) {
        return new DiagnosticResponse(
                diagnostic.severity().name(),
                diagnostic.source().name(),
                diagnostic.message(),
                diagnostic.lineNumber(),
                diagnostic.render()
        );
    }
}
