package com.raditha.codetwin.config;

import java.util.HashSet;
import java.util.Set;

/**
 * Reserved words of the grammars in scope. Keywords are never renamed during
 * normalization so the canonical form keeps the control-flow shape.
 */
public final class Keywords {

    /** Java keywords plus the literals true, false and null. */
    public static final Set<String> JAVA = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch",
            "char", "class", "const", "continue", "default", "do", "double",
            "else", "enum", "extends", "final", "finally", "float", "for",
            "goto", "if", "implements", "import", "instanceof", "int",
            "interface", "long", "native", "new", "package", "private",
            "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "try", "void", "volatile", "while", "true", "false", "null");

    /** JavaScript, TypeScript and JSX reserved and contextual words. */
    public static final Set<String> JAVASCRIPT = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do", "else",
            "export", "extends", "finally", "for", "function", "if", "import", "in", "instanceof", "let", "new",
            "return", "super", "switch", "this", "throw", "try", "typeof", "var", "void", "while", "with", "yield",
            "await", "async", "of", "from", "interface", "implements", "package", "private", "protected", "public",
            "enum", "type", "as", "any", "never", "unknown", "readonly", "global", "namespace", "declare", "module");

    /** Python 3 keywords, soft keywords excluded. */
    public static final Set<String> PYTHON = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    /** Go keywords plus the predeclared constants. */
    public static final Set<String> GO = Set.of(
            "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for",
            "func", "go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select",
            "struct", "switch", "type", "var", "nil", "true", "false", "iota");

    /** C, C++ and C# reserved words. */
    public static final Set<String> C_FAMILY = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
            "extern", "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict", "return",
            "short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void",
            "volatile", "while",
            "bool", "catch", "class", "constexpr", "const_cast", "decltype", "delete", "dynamic_cast",
            "explicit", "export", "friend", "mutable", "namespace", "new", "noexcept", "nullptr", "operator",
            "private", "protected", "public", "reinterpret_cast", "static_assert", "static_cast", "template",
            "this", "throw", "try", "typeid", "typename", "using", "virtual", "true", "false",
            "abstract", "base", "checked", "decimal", "delegate", "event", "fixed", "foreach",
            "implicit", "internal", "is", "lock", "null", "out", "override", "params", "readonly", "ref",
            "sbyte", "sealed", "stackalloc", "uint", "ulong", "unchecked", "unsafe", "ushort");

    /** Ruby keywords. */
    public static final Set<String> RUBY = Set.of(
            "BEGIN", "END", "alias", "and", "begin", "break", "case", "class", "def", "defined", "do", "else",
            "elsif", "end", "ensure", "false", "for", "if", "in", "module", "next", "nil", "not", "or", "redo",
            "rescue", "retry", "return", "self", "super", "then", "true", "undef", "unless", "until", "when",
            "while", "yield");

    /** PHP keywords and language constructs. */
    public static final Set<String> PHP = Set.of(
            "abstract", "array", "as", "break", "callable", "case", "catch", "class", "clone", "const",
            "continue", "declare", "default", "do", "echo", "else", "elseif", "empty", "enddeclare", "endfor",
            "endforeach", "endif", "endswitch", "endwhile", "extends", "final", "finally", "fn", "for",
            "foreach", "function", "global", "if", "implements", "include", "include_once", "instanceof",
            "insteadof", "interface", "isset", "list", "match", "namespace", "new", "print", "private",
            "protected", "public", "readonly", "require", "require_once", "return", "static", "switch",
            "throw", "trait", "try", "unset", "use", "var", "while", "yield");

    private Keywords() {
    }

    /**
     * Union of every language set, the default reserved-word set. One set
     * serves all files so that a word is treated the same whichever side it
     * appears on.
     */
    public static Set<String> combined() {
        Set<String> all = new HashSet<>(JAVA);
        all.addAll(JAVASCRIPT);
        all.addAll(PYTHON);
        all.addAll(GO);
        all.addAll(C_FAMILY);
        all.addAll(RUBY);
        all.addAll(PHP);
        return Set.copyOf(all);
    }
}
