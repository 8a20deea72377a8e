package org.flagcleaner.cleaner.frontend.lexer;

/**
 * One run of whitespace or one comment attached to a {@link Token}.
 * Trivia is kept verbatim so that printing a token stream reproduces its source exactly.
 */
public sealed interface TriviaPiece permits
        TriviaPiece.Newlines,
        TriviaPiece.CarriageReturnLineFeeds,
        TriviaPiece.CarriageReturns,
        TriviaPiece.Spaces,
        TriviaPiece.Tabs,
        TriviaPiece.LineComment,
        TriviaPiece.DocLineComment,
        TriviaPiece.BlockComment,
        TriviaPiece.DocBlockComment,
        TriviaPiece.Shebang,
        TriviaPiece.OtherWhitespace {

    /**
     * Returns the exact source text of this piece.
     * @return The text.
     */
    String text();

    /**
     * Reports whether this piece contains a line break.
     * @return {@code true} for newline runs and for block comments spanning lines.
     */
    default boolean isNewline() {
        return false;
    }

    /**
     * Reports whether this piece is a comment of any style.
     * @return {@code true} for comments.
     */
    default boolean isComment() {
        return false;
    }

    /** A run of {@code count} line feeds. */
    record Newlines(int count) implements TriviaPiece {
        @Override
        public String text() {
            return "\n".repeat(count);
        }

        @Override
        public boolean isNewline() {
            return true;
        }
    }

    /** A run of {@code count} CR LF pairs. */
    record CarriageReturnLineFeeds(int count) implements TriviaPiece {
        @Override
        public String text() {
            return "\r\n".repeat(count);
        }

        @Override
        public boolean isNewline() {
            return true;
        }
    }

    /** A run of {@code count} lone carriage returns. */
    record CarriageReturns(int count) implements TriviaPiece {
        @Override
        public String text() {
            return "\r".repeat(count);
        }

        @Override
        public boolean isNewline() {
            return true;
        }
    }

    /** A run of {@code count} spaces. */
    record Spaces(int count) implements TriviaPiece {
        @Override
        public String text() {
            return " ".repeat(count);
        }
    }

    /** A run of {@code count} horizontal tabs. */
    record Tabs(int count) implements TriviaPiece {
        @Override
        public String text() {
            return "\t".repeat(count);
        }
    }

    /** A {@code //} comment, without its line terminator. */
    record LineComment(String text) implements TriviaPiece {
        @Override
        public boolean isComment() {
            return true;
        }
    }

    /** A {@code ///} documentation comment, without its line terminator. */
    record DocLineComment(String text) implements TriviaPiece {
        @Override
        public boolean isComment() {
            return true;
        }
    }

    /** A block comment, possibly nested and spanning lines. */
    record BlockComment(String text) implements TriviaPiece {
        @Override
        public boolean isNewline() {
            return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
        }

        @Override
        public boolean isComment() {
            return true;
        }
    }

    /** A block comment opened with two asterisks. */
    record DocBlockComment(String text) implements TriviaPiece {
        @Override
        public boolean isNewline() {
            return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
        }

        @Override
        public boolean isComment() {
            return true;
        }
    }

    /** A {@code #!} line at the very start of a file. */
    record Shebang(String text) implements TriviaPiece {
    }

    /** Form feeds, vertical tabs and similar characters. */
    record OtherWhitespace(String text) implements TriviaPiece {
    }
}
