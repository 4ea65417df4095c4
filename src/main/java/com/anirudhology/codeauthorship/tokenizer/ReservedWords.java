package com.anirudhology.codeauthorship.tokenizer;

import com.anirudhology.codeauthorship.types.Language;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Fixed reserved-word sets, one per language. Each set holds the keywords
 * of the language plus the names of its most common builtin identifiers.
 * The sets are computed once and shared read-only.
 */
public final class ReservedWords {

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break",
            "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
            "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
            "pass", "raise", "return", "try", "while", "with", "yield"
    );

    private static final Set<String> PYTHON_BUILTINS = Set.of(
            "ArithmeticError", "AssertionError", "AttributeError", "BaseException",
            "EOFError", "Ellipsis", "Exception", "IndexError", "KeyError", "KeyboardInterrupt",
            "LookupError", "MemoryError", "NameError", "NotImplemented", "NotImplementedError",
            "OSError", "OverflowError", "RecursionError", "RuntimeError", "StopIteration",
            "SyntaxError", "SystemExit", "TypeError", "ValueError", "ZeroDivisionError",
            "__build_class__", "__debug__", "__doc__", "__import__", "__name__",
            "abs", "all", "any", "ascii", "bin", "bool", "breakpoint", "bytearray", "bytes",
            "callable", "chr", "classmethod", "compile", "complex", "copyright", "credits",
            "delattr", "dict", "dir", "divmod", "enumerate", "eval", "exec", "exit", "filter",
            "float", "format", "frozenset", "getattr", "globals", "hasattr", "hash", "help",
            "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len", "license",
            "list", "locals", "map", "max", "memoryview", "min", "next", "object", "oct",
            "open", "ord", "pow", "print", "property", "quit", "range", "repr", "reversed",
            "round", "set", "setattr", "slice", "sorted", "staticmethod", "str", "sum",
            "super", "tuple", "type", "vars", "zip"
    );

    private static final Set<String> C_KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "_Alignas", "_Alignof", "_Atomic", "_Bool", "_Complex", "_Generic", "_Imaginary",
            "_Noreturn", "_Static_assert", "_Thread_local",
            "#include", "#define", "#ifdef", "#ifndef", "#endif", "#pragma", "include", "define"
    );

    private static final Set<String> C_BUILTINS = Set.of(
            "NULL", "EOF", "FILE", "size_t", "stdin", "stdout", "stderr",
            "printf", "scanf", "fprintf", "fscanf", "sprintf", "sscanf", "puts", "gets",
            "fgets", "fputs", "getchar", "putchar", "fopen", "fclose", "fread", "fwrite",
            "malloc", "calloc", "realloc", "free", "memset", "memcpy", "memmove", "memcmp",
            "strlen", "strcpy", "strncpy", "strcat", "strcmp", "strncmp", "strchr", "strstr",
            "atoi", "atol", "atof", "abs", "labs", "qsort", "bsearch", "exit",
            "sqrt", "pow", "fabs", "floor", "ceil", "log", "exp", "sin", "cos", "main"
    );

    private static final Set<String> CPP_KEYWORDS = Set.of(
            "alignas", "alignof", "and", "and_eq", "asm", "bitand", "bitor", "bool", "catch",
            "char16_t", "char32_t", "class", "compl", "constexpr", "const_cast", "decltype",
            "delete", "dynamic_cast", "explicit", "export", "false", "friend", "mutable",
            "namespace", "new", "noexcept", "not", "not_eq", "nullptr", "operator", "or",
            "or_eq", "private", "protected", "public", "reinterpret_cast", "static_assert",
            "static_cast", "template", "this", "thread_local", "throw", "true", "try",
            "typeid", "typename", "using", "virtual", "wchar_t", "xor", "xor_eq"
    );

    private static final Set<String> CPP_BUILTINS = Set.of(
            "std", "cin", "cout", "cerr", "endl", "string", "vector", "map", "set",
            "unordered_map", "unordered_set", "pair", "make_pair", "queue", "priority_queue",
            "stack", "deque", "list", "sort", "min", "max", "swap", "reverse", "fill",
            "lower_bound", "upper_bound", "begin", "end", "size", "push_back", "pop_back",
            "iostream", "algorithm", "cstdio", "cstdlib", "cstring", "cmath", "bits"
    );

    private static final Map<Language, Set<String>> WORDS = new EnumMap<>(Language.class);

    static {
        WORDS.put(Language.PYTHON, union(PYTHON_KEYWORDS, PYTHON_BUILTINS));
        WORDS.put(Language.C, union(C_KEYWORDS, C_BUILTINS));
        // C++ inherits every C keyword and library name
        WORDS.put(Language.CPP, union(WORDS.get(Language.C), union(CPP_KEYWORDS, CPP_BUILTINS)));
    }

    private ReservedWords() {
    }

    /**
     * @param language language whose reserved words are requested
     * @return immutable set of keywords and builtin identifiers of that language
     */
    public static Set<String> forLanguage(Language language) {
        return WORDS.get(language);
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        final Set<String> all = new HashSet<>(first);
        all.addAll(second);
        return Set.copyOf(all);
    }
}
