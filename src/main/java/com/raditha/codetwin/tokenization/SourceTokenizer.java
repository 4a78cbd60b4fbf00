package com.raditha.codetwin.tokenization;

import com.raditha.codetwin.config.LanguageGrammar;
import com.raditha.codetwin.model.Token;
import com.raditha.codetwin.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts raw source text into typed lexical tokens.
 * <p>
 * The scan runs left to right without backtracking. At each position the
 * alternatives are tried in this order: whitespace, block comment, line
 * comment, triple-quoted string, string literal, number, identifier/keyword,
 * multi-character operator, single-character symbol. Comments are dropped. Characters that
 * fit none of these (such as {@code @} or {@code $}) are skipped.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class SourceTokenizer {

    /**
     * Longest operators first so that matching is greedy.
     */
    static final List<String> MULTI_CHAR_OPERATORS = List.of(
            "===", "!==",
            "==", "!=", "<=", ">=", "&&", "||", "++", "--", "->", "=>", ":=", "::",
            "+=", "-=", "*=", "/=");

    static final String SYMBOLS = "~!%^&*()+={}[]|\\:;<>,.?/-";

    private final Set<String> keywords;
    private final int maxTokens;

    /**
     * @param keywords  combined reserved-word set
     * @param maxTokens tokens allowed per file before giving up on it
     */
    public SourceTokenizer(Set<String> keywords, int maxTokens) {
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("keyword set cannot be empty");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
        this.keywords = Set.copyOf(keywords);
        this.maxTokens = maxTokens;
    }

    /**
     * Tokenize a whole file.
     *
     * @param text    decoded file content
     * @param grammar comment rules for the file's language
     * @return tokens in source order, comments excluded
     * @throws TokenLimitExceededException if the file yields more than the
     *                                     configured number of tokens
     */
    public List<Token> tokenize(String text, LanguageGrammar grammar) {
        List<Token> tokens = new ArrayList<>();
        int length = text.length();
        int pos = 0;

        while (pos < length) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            int afterComment = skipComment(text, pos, grammar);
            if (afterComment > pos) {
                pos = afterComment;
                continue;
            }

            int end;
            TokenType type;
            if ((c == '"' || c == '\'') && startsTripleQuote(text, pos, c)) {
                end = scanTripleQuoted(text, pos, c);
                type = TokenType.STRING_LIT;
            } else if (c == '"' || c == '\'') {
                end = scanQuoted(text, pos, c);
                type = TokenType.STRING_LIT;
            } else if (c == '`') {
                end = scanTemplate(text, pos);
                type = TokenType.STRING_LIT;
            } else if (isDigit(c)) {
                end = scanNumber(text, pos);
                type = TokenType.NUMBER;
            } else if (isIdentifierStart(c)) {
                end = scanIdentifier(text, pos);
                type = keywords.contains(text.substring(pos, end)) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
            } else {
                end = scanOperator(text, pos);
                type = TokenType.OPERATOR;
                if (end == pos) {
                    // not part of the shared grammar
                    pos++;
                    continue;
                }
            }

            if (tokens.size() == maxTokens) {
                throw new TokenLimitExceededException(maxTokens);
            }
            tokens.add(new Token(type, text.substring(pos, end)));
            pos = end;
        }
        return tokens;
    }

    /**
     * Returns the position after a comment starting at {@code pos}, or
     * {@code pos} itself when no comment starts there. Comment forms are
     * checked before operators, so {@code //} never becomes two slashes.
     */
    private static int skipComment(String text, int pos, LanguageGrammar grammar) {
        if (grammar.blockComments() && text.startsWith("/*", pos)) {
            int close = text.indexOf("*/", pos + 2);
            return close < 0 ? text.length() : close + 2;
        }
        for (String marker : grammar.lineCommentMarkers()) {
            if (text.startsWith(marker, pos)) {
                int newline = text.indexOf('\n', pos);
                return newline < 0 ? text.length() : newline;
            }
        }
        return pos;
    }

    /**
     * Single or double quoted literal. Backslash escapes the next character.
     * An unterminated literal ends at the newline or at end of input.
     */
    private static int scanQuoted(String text, int pos, char quote) {
        int i = pos + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n') {
                return i;
            } else {
                i++;
            }
        }
        return text.length();
    }

    private static boolean startsTripleQuote(String text, int pos, char quote) {
        return pos + 2 < text.length() && text.charAt(pos + 1) == quote && text.charAt(pos + 2) == quote;
    }

    /**
     * Triple-quoted literal (Python docstrings, Java text blocks), may span
     * lines. Backslash escapes the next character. An unterminated literal
     * runs to end of input.
     */
    private static int scanTripleQuoted(String text, int pos, char quote) {
        int i = pos + 3;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (startsTripleQuote(text, i, quote)) {
                return i + 3;
            } else {
                i++;
            }
        }
        return text.length();
    }

    /**
     * Backtick template literal, may span lines.
     */
    private static int scanTemplate(String text, int pos) {
        int i = pos + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '`') {
                return i + 1;
            } else {
                i++;
            }
        }
        return text.length();
    }

    /**
     * Integer or decimal: digits, optionally followed by '.' and more digits.
     */
    private static int scanNumber(String text, int pos) {
        int i = pos;
        while (i < text.length() && isDigit(text.charAt(i))) {
            i++;
        }
        if (i + 1 < text.length() && text.charAt(i) == '.' && isDigit(text.charAt(i + 1))) {
            i++;
            while (i < text.length() && isDigit(text.charAt(i))) {
                i++;
            }
        }
        return i;
    }

    private static int scanIdentifier(String text, int pos) {
        int i = pos + 1;
        while (i < text.length() && isIdentifierPart(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int scanOperator(String text, int pos) {
        for (String op : MULTI_CHAR_OPERATORS) {
            if (text.startsWith(op, pos)) {
                return pos + op.length();
            }
        }
        return SYMBOLS.indexOf(text.charAt(pos)) >= 0 ? pos + 1 : pos;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
