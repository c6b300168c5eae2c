package org.macrohooks.host;

import org.macrohooks.api.ShapeViolationException;
import org.macrohooks.ast.Node;
import org.macrohooks.diagnostics.DiagnosticsEngine;
import org.macrohooks.rules.RewriteDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The boundary between the host analyzer and the rewrite rules.
 * It expands every registered macro invocation of a tree, nested ones included, and turns
 * malformed invocations into configuration diagnostics instead of aborting the pass.
 */
public class HookExpansionPass {

    private static final Logger LOG = LoggerFactory.getLogger(HookExpansionPass.class);

    private final RewriteDispatcher dispatcher;
    private final DiagnosticsEngine diagnostics;
    private int expansionCount;

    /**
     * @param dispatcher The dispatcher holding the rewrite rules.
     * @param diagnostics The engine receiving configuration diagnostics.
     */
    public HookExpansionPass(RewriteDispatcher dispatcher, DiagnosticsEngine diagnostics) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Expands all macro invocations in the given tree.
     * @param root The root of the tree.
     * @return The expanded tree; {@code root} itself if nothing was rewritten.
     */
    public Node process(Node root) {
        expansionCount = 0;
        return new TreeWalker(this::expand).transform(root);
    }

    /**
     * @return How many invocations the last {@link #process(Node)} call rewrote.
     */
    public int expansionCount() {
        return expansionCount;
    }

    private Node expand(Node node) {
        try {
            Node replacement = dispatcher.dispatch(node);
            if (replacement != node) {
                expansionCount++;
            }
            return replacement;
        } catch (ShapeViolationException e) {
            LOG.warn("Cannot expand macro invocation: {}", e.getMessage());
            diagnostics.reportConfigurationError(
                    String.format("Invalid %s invocation: expected %s, received %s",
                            e.getMacroName(), e.getExpected(), e.getReceived()),
                    e.getSourceInfo());
            return node;
        }
    }
}
