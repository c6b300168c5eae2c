package org.macrohooks.diagnostics;

/**
 * Represents a single diagnostic message produced while expanding macro invocations.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A macro usage the rewrite rules could not handle; a tool problem, not a lint finding. */
        CONFIGURATION
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
