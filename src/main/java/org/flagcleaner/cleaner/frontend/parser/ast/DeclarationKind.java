package org.flagcleaner.cleaner.frontend.parser.ast;

/**
 * Classifies one top-level or member item by its introducing keyword.
 */
public enum DeclarationKind {
    /** {@code struct}, {@code enum}, {@code protocol}, {@code class}, {@code extension} or {@code actor}. */
    TYPE(true),
    /** {@code typealias} or {@code associatedtype}. */
    TYPEALIAS(true),
    /** {@code func}, {@code init}, {@code deinit} or {@code subscript}. */
    FUNCTION(true),
    /** {@code var} or {@code let}. */
    VARIABLE(true),
    /** A {@code macro} declaration. */
    MACRO(true),
    /** A freestanding {@code #name} macro expansion. */
    MACRO_EXPANSION(true),
    /** An {@code import}. */
    IMPORT(false),
    /** Statements and every other item. */
    OTHER(false);

    private final boolean meaningful;

    DeclarationKind(boolean meaningful) {
        this.meaningful = meaningful;
    }

    /**
     * Reports whether a file containing an item of this kind still has content worth keeping.
     * @return {@code true} for declarations, {@code false} for imports and statements.
     */
    public boolean isMeaningful() {
        return meaningful;
    }
}
