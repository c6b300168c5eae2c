package org.macrohooks.synth;

import org.macrohooks.api.SourceInfo;
import org.macrohooks.ast.CoreForms;
import org.macrohooks.ast.ListNode;
import org.macrohooks.ast.MapNode;
import org.macrohooks.ast.Node;
import org.macrohooks.ast.TokenNode;
import org.macrohooks.ast.VectorNode;
import org.macrohooks.shape.Binding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds replacement trees out of core constructs.
 * <p>
 * Every wrapper and placeholder created here is stamped with the origin position, i.e. the
 * position of the invocation being replaced. Nodes passed in are reused by reference, never copied.
 */
public final class FormSynthesizer {

    private final SourceInfo origin;

    private FormSynthesizer(SourceInfo origin) {
        this.origin = origin;
    }

    /**
     * @param origin The position synthesized nodes are attributed to.
     * @return A synthesizer for that position.
     */
    public static FormSynthesizer at(SourceInfo origin) {
        return new FormSynthesizer(Objects.requireNonNull(origin, "origin"));
    }

    /**
     * Builds <code>(let [s1 e1 s2 e2 ...] body...)</code>.
     *
     * @param bindings The pairs, in binding order.
     * @param body The body forms.
     * @return The binding form.
     */
    public ListNode binding(List<Binding> bindings, List<Node> body) {
        List<Node> flat = new ArrayList<>(bindings.size() * 2);
        for (Binding b : bindings) {
            flat.add(b.symbol());
            flat.add(b.expression());
        }
        return binding(new VectorNode(flat, origin), body);
    }

    /**
     * Builds <code>(let bindings body...)</code> around an already flat binding vector,
     * which is reused as is.
     *
     * @param bindings An even-sized vector of alternating symbols and expressions.
     * @param body The body forms.
     * @return The binding form.
     */
    public ListNode binding(VectorNode bindings, List<Node> body) {
        return form(CoreForms.LET, bindings, body);
    }

    /**
     * Builds <code>(do children...)</code>.
     */
    public ListNode sequence(List<Node> children) {
        List<Node> all = new ArrayList<>(children.size() + 1);
        all.add(token(CoreForms.DO));
        all.addAll(children);
        return new ListNode(all, origin);
    }

    /**
     * Builds <code>(fn params body...)</code>.
     */
    public ListNode functionLiteral(Node params, List<Node> body) {
        return form(CoreForms.FN, params, body);
    }

    /**
     * Builds <code>(do (def name nil) body...)</code>: a declaration stub followed by the body,
     * so references to {@code name} inside the body resolve.
     *
     * @param name The symbol to declare.
     * @param body The forms following the declaration.
     * @return The sequencing block.
     */
    public ListNode declaration(Node name, List<Node> body) {
        List<Node> children = new ArrayList<>(body.size() + 1);
        children.add(new ListNode(List.of(token(CoreForms.DEF), name, nil()), origin));
        children.addAll(body);
        return sequence(children);
    }

    /**
     * @return A fresh nil placeholder token.
     */
    public TokenNode nil() {
        return token(CoreForms.NIL);
    }

    /**
     * @return A fresh anonymous binding symbol.
     */
    public TokenNode anonymous() {
        return token(CoreForms.ANONYMOUS);
    }

    /**
     * @return A fresh empty map, used where an optional options map was omitted.
     */
    public MapNode emptyMap() {
        return new MapNode(List.of(), origin);
    }

    private ListNode form(String head, Node second, List<Node> body) {
        List<Node> all = new ArrayList<>(body.size() + 2);
        all.add(token(head));
        all.add(second);
        all.addAll(body);
        return new ListNode(all, origin);
    }

    private TokenNode token(String value) {
        return new TokenNode(value, origin);
    }
}
