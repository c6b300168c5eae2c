package org.macrohooks.api;

/**
 * A pure data class representing a position in the source code.
 * The rewrite core never interprets it; it is only passed through so that diagnostics
 * stay attributable to the original source.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number (1-based, 0 if unknown).
 * @param columnNumber The column number (1-based, 0 if unknown).
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Position used for nodes whose origin is not known. */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", 0, 0);

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
