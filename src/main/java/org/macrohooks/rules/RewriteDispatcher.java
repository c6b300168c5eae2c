package org.macrohooks.rules;

import org.macrohooks.api.ShapeViolationException;
import org.macrohooks.ast.Node;
import org.macrohooks.ast.NodePrinter;
import org.macrohooks.shape.ShapeResult;
import org.macrohooks.shape.ShapeViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Routes invocations to the rule registered for their macro name.
 * Stateless apart from the read-only registry, so one instance can serve concurrent analyses.
 */
public class RewriteDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteDispatcher.class);

    private final RewriteRuleRegistry registry;

    /**
     * @param registry The registry to look rules up in.
     */
    public RewriteDispatcher(RewriteRuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Rewrites a node if it is an invocation of a registered macro.
     *
     * @param node Any node.
     * @return The replacement tree, or {@code node} itself if it is not an invocation of a registered macro.
     * @throws ShapeViolationException if the macro is registered but its arguments have the wrong shape.
     */
    public Node dispatch(Node node) throws ShapeViolationException {
        ShapeResult<Node> result = tryDispatch(node);
        if (!result.isSuccess()) {
            ShapeViolation violation = result.violation();
            // A failure is only possible for an invocation.
            Invocation invocation = Invocation.of(node).orElseThrow();
            throw new ShapeViolationException(invocation.macroName(), violation.expected(),
                    violation.received(), invocation.sourceInfo());
        }
        return result.value();
    }

    /**
     * Exception-free variant of {@link #dispatch(Node)}.
     *
     * @param node Any node.
     * @return The replacement (or {@code node} itself when nothing applies), or the violation.
     */
    public ShapeResult<Node> tryDispatch(Node node) {
        Optional<Invocation> invocation = Invocation.of(node);
        if (invocation.isEmpty()) {
            return ShapeResult.success(node);
        }
        Optional<IRewriteRule> rule = registry.lookup(invocation.get().macroName());
        if (rule.isEmpty()) {
            return ShapeResult.success(node);
        }
        ShapeResult<Node> result = rule.get().rewrite(invocation.get());
        if (result.isSuccess() && LOG.isDebugEnabled()) {
            LOG.debug("Rewrote {} -> {}", NodePrinter.print(node), NodePrinter.print(result.value()));
        }
        return result;
    }
}
