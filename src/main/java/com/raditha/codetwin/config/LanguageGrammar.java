package com.raditha.codetwin.config;

import java.util.Comparator;
import java.util.List;

/**
 * Comment delimiters for a family of languages. Everything else in the token
 * grammar (strings, numbers, identifiers, operators) is shared.
 *
 * @param name               short name used in logs
 * @param lineCommentMarkers markers that start a comment running to end of
 *                           line, longest first
 * @param blockComments      whether C-style block comments exist
 */
public record LanguageGrammar(String name, List<String> lineCommentMarkers, boolean blockComments) {

    /** Java, C, C++, C#, Go, JavaScript and TypeScript. */
    public static final LanguageGrammar C_LIKE = new LanguageGrammar("c-like", List.of("//"), true);

    /** Python and Ruby. */
    public static final LanguageGrammar HASH_COMMENT = new LanguageGrammar("hash-comment", List.of("#"), false);

    /** PHP accepts both line comment styles. */
    public static final LanguageGrammar PHP = new LanguageGrammar("php", List.of("//", "#"), true);

    public LanguageGrammar {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("grammar name cannot be blank");
        }
        lineCommentMarkers = lineCommentMarkers == null
                ? List.of()
                : lineCommentMarkers.stream()
                        .filter(m -> m != null && !m.isEmpty())
                        .sorted(Comparator.comparingInt(String::length).reversed())
                        .toList();
    }
}
