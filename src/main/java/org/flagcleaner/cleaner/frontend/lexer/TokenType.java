package org.flagcleaner.cleaner.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize in Swift source.
 */
public enum TokenType {
    // Punctuation.
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '{' character. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character. */
    COMMA,
    /** The ':' character. */
    COLON,
    /** The ';' character. */
    SEMICOLON,
    /** A single '.' used for member access. */
    PERIOD,
    /** The '\' character that starts a key path. */
    BACKSLASH,

    // Operators, classified by the whitespace around them.
    /** An operator bound on both sides or on neither, such as {@code &&} in {@code a && b}. */
    BINARY_OPERATOR,
    /** An operator bound only to the token after it, such as {@code !} in {@code !flag}. */
    PREFIX_OPERATOR,
    /** An operator bound only to the token before it, such as {@code ?} in {@code Int?}. */
    POSTFIX_OPERATOR,

    // Literals.
    /** An identifier, including backtick-quoted and {@code $0} style names. */
    IDENTIFIER,
    /** A reserved word such as {@code func} or {@code import}. */
    KEYWORD,
    /** An integer literal in any radix. */
    INTEGER_LITERAL,
    /** A floating-point literal. */
    FLOAT_LITERAL,
    /** A string literal, including raw and multi-line forms. */
    STRING_LITERAL,
    /** A bare regex literal such as {@code /a+b/}. */
    REGEX_LITERAL,
    /** An attribute such as {@code @MainActor}, without its arguments. */
    ATTRIBUTE,

    // Compiler directives.
    /** The {@code #if} directive. */
    POUND_IF,
    /** The {@code #elseif} directive, also accepted as {@code #elif}. */
    POUND_ELSEIF,
    /** The {@code #else} directive. */
    POUND_ELSE,
    /** The {@code #endif} directive. */
    POUND_ENDIF,
    /** Any other {@code #name}, such as {@code #available} or a macro expansion. */
    POUND_KEYWORD,

    // Miscellaneous.
    /** A character the lexer does not otherwise recognize. Kept so the stream stays lossless. */
    UNKNOWN,
    /** Represents the end of the source file. Its leading trivia holds the text after the last token. */
    END_OF_FILE
}
