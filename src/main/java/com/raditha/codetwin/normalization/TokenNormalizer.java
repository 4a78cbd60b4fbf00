package com.raditha.codetwin.normalization;

import com.raditha.codetwin.model.CanonicalSequence;
import com.raditha.codetwin.model.Token;
import com.raditha.codetwin.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes a token stream into an identifier-blind canonical sequence.
 * <p>
 * Rules, first match wins:
 * <ol>
 * <li>string literal becomes {@code STR}</li>
 * <li>reserved word is kept verbatim</li>
 * <li>numeric literal becomes {@code NUM}</li>
 * <li>identifier becomes {@code ID<n>}, numbered per file by first
 * occurrence</li>
 * <li>anything else (operators, punctuation) is kept verbatim</li>
 * </ol>
 * Two files that differ only by a consistent renaming of identifiers and by
 * literal values therefore produce the same sequence.
 */
public class TokenNormalizer {

    public static final String STRING_PLACEHOLDER = "STR";
    public static final String NUMBER_PLACEHOLDER = "NUM";

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Set<String> keywords;

    public TokenNormalizer(Set<String> keywords) {
        if (keywords == null) {
            throw new IllegalArgumentException("keywords cannot be null");
        }
        this.keywords = Set.copyOf(keywords);
    }

    /**
     * Normalize the tokens of one file with a fresh renaming context.
     */
    public NormalizedFile normalize(List<Token> tokens) {
        NormalizationContext context = new NormalizationContext();
        List<String> canonical = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            canonical.add(normalizeToken(token, context));
        }
        return new NormalizedFile(new CanonicalSequence(canonical), context);
    }

    private String normalizeToken(Token token, NormalizationContext context) {
        String text = token.text();
        if (token.type() == TokenType.STRING_LIT) {
            return STRING_PLACEHOLDER;
        }
        if (keywords.contains(text)) {
            return text;
        }
        if (NUMBER.matcher(text).matches()) {
            return NUMBER_PLACEHOLDER;
        }
        if (IDENTIFIER.matcher(text).matches()) {
            return context.rename(text);
        }
        return text;
    }
}
