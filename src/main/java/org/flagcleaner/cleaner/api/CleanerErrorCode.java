package org.flagcleaner.cleaner.api;

/**
 * Defines unique, testable codes for the diagnostics reported while reading a source file.
 * Tests assert on these codes instead of on message text.
 */
public enum CleanerErrorCode {
    // region Lexer Errors
    /** A string literal was not closed before the end of the line or file. */
    UNTERMINATED_STRING,
    /** A block comment was not closed before the end of the file. */
    UNTERMINATED_COMMENT,
    // endregion

    // region Parser Errors
    /** An #elseif, #else or #endif appeared without an open #if. */
    DIRECTIVE_WITHOUT_IF,
    /** An #elseif followed the #else clause of the same block. */
    ELSEIF_AFTER_ELSE,
    /** A block contained more than one #else clause. */
    DUPLICATE_ELSE,
    /** An #if block was not closed by #endif. */
    MISSING_ENDIF,
    /** An #if or #elseif directive had no condition. */
    MISSING_CONDITION,
    /** Tokens followed #else or #endif on the directive line. */
    UNEXPECTED_DIRECTIVE_ARGUMENT,
    /** A brace, bracket or parenthesis was not balanced within its enclosing clause or group. */
    UNBALANCED_DELIMITER,
    // endregion

    // region Warnings
    /** A condition used syntax the cleaner does not evaluate, such as os(iOS). */
    UNSUPPORTED_CONDITION
    // endregion
}
