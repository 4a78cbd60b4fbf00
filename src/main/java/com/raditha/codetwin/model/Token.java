package com.raditha.codetwin.model;

/**
 * A lexical unit extracted from source text.
 * Tokens are consumed immediately by the normalizer and never persisted.
 *
 * @param type kind tag assigned by the tokenizer
 * @param text raw text as it appeared in the source (string literals include
 *             their delimiters)
 */
public record Token(TokenType type, String text) {

    public Token {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text cannot be empty");
        }
    }
}
