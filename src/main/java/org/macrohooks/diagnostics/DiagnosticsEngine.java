package org.macrohooks.diagnostics;

import org.macrohooks.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one expansion pass, for the host analyzer to merge into its own report.
 * <p>
 * Instances are not thread-safe; use one per analyzed source unit.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a macro invocation that could not be rewritten.
     *
     * @param message The problem description.
     * @param source  The position of the invocation.
     */
    public void reportConfigurationError(String message, SourceInfo source) {
        SourceInfo at = source != null ? source : SourceInfo.UNKNOWN;
        diagnostics.add(new Diagnostic(Diagnostic.Type.CONFIGURATION, message,
                at.fileName(), at.lineNumber(), at.columnNumber()));
    }

    /**
     * @return {@code true} if at least one configuration diagnostic exists.
     */
    public boolean hasConfigurationErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.CONFIGURATION);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
