package org.macrohooks.api;

/**
 * Thrown when a registered macro is invoked with arguments that do not have the shape its
 * rewrite rule requires. It is scoped to a single invocation and is meant to be reported as a
 * configuration diagnostic, never as an ordinary lint finding.
 */
public class ShapeViolationException extends Exception {

    private final String macroName;
    private final String expected;
    private final String received;
    private final SourceInfo sourceInfo;

    /**
     * @param macroName The macro whose invocation was malformed.
     * @param expected What the rule required.
     * @param received What was found instead.
     * @param sourceInfo The position of the invocation.
     */
    public ShapeViolationException(String macroName, String expected, String received, SourceInfo sourceInfo) {
        super(String.format("%s: expected %s, received %s at %s", macroName, expected, received, sourceInfo));
        this.macroName = macroName;
        this.expected = expected;
        this.received = received;
        this.sourceInfo = sourceInfo;
    }

    public String getMacroName() {
        return macroName;
    }

    public String getExpected() {
        return expected;
    }

    public String getReceived() {
        return received;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
