package com.raditha.codetwin.model;

/**
 * Kind of lexical token produced by the source tokenizer.
 * Comments never become tokens, so there is no comment kind.
 */
public enum TokenType {
    /** Reserved word of one of the grammars in scope (if, class, function, etc.) */
    KEYWORD,

    /** Name matching [A-Za-z_][A-Za-z0-9_]* that is not a reserved word */
    IDENTIFIER,

    /** Integer or decimal literal */
    NUMBER,

    /** Single-quoted, double-quoted or backtick literal, kept as one opaque token */
    STRING_LIT,

    /** Operator or punctuation (==, ->, {, ;, etc.) */
    OPERATOR
}
