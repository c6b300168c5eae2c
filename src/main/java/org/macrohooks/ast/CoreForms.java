package org.macrohooks.ast;

/**
 * Names of the core constructs and placeholders every host analyzer understands natively.
 */
public final class CoreForms {

    /** Binding form: <code>(let [sym expr ...] body...)</code>. */
    public static final String LET = "let";
    /** Sequencing block: <code>(do ...)</code>. */
    public static final String DO = "do";
    /** Function literal: <code>(fn [params] body...)</code>. */
    public static final String FN = "fn";
    /** Declaration stub: <code>(def name nil)</code>. */
    public static final String DEF = "def";
    /** Stands in for an omitted expression. */
    public static final String NIL = "nil";
    /** Anonymous binding symbol; analyzers do not report it as unused. */
    public static final String ANONYMOUS = "_";

    private CoreForms() {}
}
