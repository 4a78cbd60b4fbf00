package com.raditha.codetwin.config;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps file extensions to the comment grammar used when tokenizing them.
 * The set of registered extensions is also the allow-list used when
 * collecting files.
 */
public final class GrammarRegistry {

    private final Map<String, LanguageGrammar> byExtension;

    private GrammarRegistry(Map<String, LanguageGrammar> byExtension) {
        this.byExtension = Collections.unmodifiableMap(new TreeMap<>(byExtension));
    }

    /**
     * Registry for the languages recognised out of the box.
     */
    public static GrammarRegistry defaults() {
        Map<String, LanguageGrammar> map = new TreeMap<>();
        for (String ext : new String[] { ".java", ".c", ".cpp", ".cs", ".go", ".js", ".ts", ".jsx", ".tsx" }) {
            map.put(ext, LanguageGrammar.C_LIKE);
        }
        map.put(".py", LanguageGrammar.HASH_COMMENT);
        map.put(".rb", LanguageGrammar.HASH_COMMENT);
        map.put(".php", LanguageGrammar.PHP);
        return new GrammarRegistry(map);
    }

    /**
     * Keep only the given extensions. Extensions this registry does not know
     * are added with the C-like grammar.
     *
     * @param extensions extensions with or without the leading dot
     */
    public GrammarRegistry restrictTo(Collection<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("extension list cannot be empty");
        }
        Map<String, LanguageGrammar> map = new TreeMap<>();
        for (String raw : extensions) {
            String ext = normalizeExtension(raw);
            map.put(ext, byExtension.getOrDefault(ext, LanguageGrammar.C_LIKE));
        }
        return new GrammarRegistry(map);
    }

    /**
     * Grammar for a file name or path, if its extension is registered.
     */
    public Optional<LanguageGrammar> grammarFor(String fileName) {
        return extensionOf(fileName).map(byExtension::get);
    }

    public boolean supports(String fileName) {
        return grammarFor(fileName).isPresent();
    }

    public Set<String> extensions() {
        return byExtension.keySet();
    }

    private static Optional<String> extensionOf(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.substring(Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        // dot files such as ".js" have no extension
        if (dot <= 0) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static String normalizeExtension(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("extension cannot be blank");
        }
        String ext = raw.trim().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext : "." + ext;
    }

    @Override
    public String toString() {
        return "GrammarRegistry" + byExtension.keySet();
    }
}
