package org.macrohooks.rules;

import org.macrohooks.api.SourceInfo;
import org.macrohooks.ast.ListNode;
import org.macrohooks.ast.Node;
import org.macrohooks.ast.TokenNode;
import org.macrohooks.synth.FormSynthesizer;

import java.util.List;
import java.util.Optional;

/**
 * A macro call as written in source: a list whose first child is a token naming the macro,
 * followed by the raw, unparsed arguments.
 *
 * @param node The original list node.
 * @param macroName The text of the head token.
 */
public record Invocation(ListNode node, String macroName) {

    /**
     * Recognizes an invocation.
     *
     * @param node Any node.
     * @return The invocation if {@code node} is a list headed by a token, otherwise empty.
     */
    public static Optional<Invocation> of(Node node) {
        if (node instanceof ListNode list
                && !list.children().isEmpty()
                && list.children().get(0) instanceof TokenNode head) {
            return Optional.of(new Invocation(list, head.value()));
        }
        return Optional.empty();
    }

    /**
     * @return The arguments after the macro name.
     */
    public List<Node> arguments() {
        List<Node> children = node.children();
        return children.subList(1, children.size());
    }

    public int argumentCount() {
        return node.children().size() - 1;
    }

    /**
     * @param index Zero-based argument index.
     * @return The argument, or {@code null} if the invocation has fewer arguments.
     */
    public Node argument(int index) {
        return index < argumentCount() ? node.children().get(index + 1) : null;
    }

    /**
     * @param from Zero-based index of the first argument to include.
     * @return The arguments from {@code from} on; empty if there are none.
     */
    public List<Node> argumentsFrom(int from) {
        List<Node> args = arguments();
        return from >= args.size() ? List.of() : args.subList(from, args.size());
    }

    public SourceInfo sourceInfo() {
        return node.sourceInfo();
    }

    /**
     * @return A synthesizer attributing new nodes to this invocation's position.
     */
    public FormSynthesizer synthesizer() {
        return FormSynthesizer.at(node.sourceInfo());
    }
}
