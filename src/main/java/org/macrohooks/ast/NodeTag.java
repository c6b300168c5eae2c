package org.macrohooks.ast;

/**
 * The closed set of node kinds the host analyzer builds trees from.
 */
public enum NodeTag {
    /** A symbol, keyword, number or other plain token. */
    TOKEN,
    /** A string literal. */
    STRING,
    /** A parenthesized list, e.g. an invocation. */
    LIST,
    /** A bracketed vector. */
    VECTOR,
    /** A braced map of key/value pairs. */
    MAP
}
