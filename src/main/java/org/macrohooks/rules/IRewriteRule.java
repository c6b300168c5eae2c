package org.macrohooks.rules;

import org.macrohooks.ast.Node;
import org.macrohooks.shape.ShapeResult;

/**
 * The base interface for all rewrite rules.
 * Each rule handles one macro family and turns an invocation into an equivalent tree made of
 * core constructs only. Implementations are stateless and may be shared between threads.
 */
@FunctionalInterface
public interface IRewriteRule {

    /**
     * Rewrites one invocation.
     *
     * @param invocation The invocation to rewrite.
     * @return The replacement tree, or the violation if the arguments do not have the expected shape.
     */
    ShapeResult<Node> rewrite(Invocation invocation);
}
