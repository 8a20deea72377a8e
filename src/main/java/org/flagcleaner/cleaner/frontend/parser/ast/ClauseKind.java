package org.flagcleaner.cleaner.frontend.parser.ast;

/**
 * The kind of a branch in a conditional-compilation block.
 */
public enum ClauseKind {
    /** The opening {@code #if} clause. */
    IF,
    /** An {@code #elseif} clause. */
    ELSEIF,
    /** The closing {@code #else} clause. */
    ELSE
}
