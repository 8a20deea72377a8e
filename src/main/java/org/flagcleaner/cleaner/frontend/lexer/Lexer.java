package org.flagcleaner.cleaner.frontend.lexer;

import org.flagcleaner.cleaner.api.CleanerErrorCode;
import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts Swift source text into a lossless sequence of tokens.
 * <p>
 * Every character of the input ends up either in a token's text or in one of its trivia lists,
 * so concatenating leading trivia, text and trailing trivia of all tokens yields the input again.
 * Newlines always belong to the leading trivia of the following token.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "associatedtype", "class", "deinit", "enum", "extension", "fileprivate", "func", "import",
            "init", "inout", "internal", "let", "open", "operator", "private", "precedencegroup",
            "protocol", "public", "rethrows", "static", "struct", "subscript", "typealias", "var",
            "break", "case", "catch", "continue", "default", "defer", "do", "else", "fallthrough",
            "for", "guard", "if", "in", "repeat", "return", "throw", "switch", "where", "while",
            "Any", "as", "await", "false", "is", "nil", "self", "Self", "super", "throws", "true", "try");

    private static final Set<String> VALUE_KEYWORDS = Set.of("false", "nil", "self", "Self", "super", "true");

    private static final String OPERATOR_CHARS = "/=-+!*%<>&|^~?";

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, always terminated by an {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        List<TriviaPiece> leading = new ArrayList<>();
        if (source.startsWith("#!")) {
            while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
            leading.add(new TriviaPiece.Shebang(source.substring(0, current)));
        }

        while (true) {
            scanTrivia(leading, false);
            if (isAtEnd()) {
                tokens.add(new Token(TokenType.END_OF_FILE, "", leading, List.of(), line, column));
                return tokens;
            }

            start = current;
            int tokenLine = line;
            int tokenColumn = column;
            TokenType type = scanToken();
            String text = source.substring(start, current);

            List<TriviaPiece> trailing = new ArrayList<>();
            scanTrivia(trailing, true);
            tokens.add(new Token(type, text, leading, trailing, tokenLine, tokenColumn));
            leading = new ArrayList<>();
        }
    }

    private TokenType scanToken() {
        char c = advance();
        switch (c) {
            case '(': return TokenType.LEFT_PAREN;
            case ')': return TokenType.RIGHT_PAREN;
            case '{': return TokenType.LEFT_BRACE;
            case '}': return TokenType.RIGHT_BRACE;
            case '[': return TokenType.LEFT_BRACKET;
            case ']': return TokenType.RIGHT_BRACKET;
            case ',': return TokenType.COMMA;
            case ':': return TokenType.COLON;
            case ';': return TokenType.SEMICOLON;
            case '\\': return TokenType.BACKSLASH;
            case '"':
                current--;
                column--;
                return string(0);
            case '#': return pound();
            case '@': return attribute();
            case '`': return backtickIdentifier();
            case '.':
                if (peek() != '.') {
                    return TokenType.PERIOD;
                }
                while (peek() == '.' || isOperatorChar(peek())) advance();
                return operatorType();
            default:
                if (isDigit(c)) {
                    return number(c);
                } else if (isIdentifierStart(c)) {
                    return identifier();
                } else if (c == '/' && regexLiteral()) {
                    return TokenType.REGEX_LITERAL;
                } else if (isOperatorChar(c)) {
                    return operator();
                }
                if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                    advance();
                }
                return TokenType.UNKNOWN;
        }
    }

    private TokenType identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        return KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
    }

    private TokenType backtickIdentifier() {
        while (!isAtEnd() && peek() != '`' && peek() != '\n') advance();
        if (peek() == '`') advance();
        return TokenType.IDENTIFIER;
    }

    private TokenType attribute() {
        if (!isIdentifierStart(peek())) {
            return TokenType.UNKNOWN;
        }
        while (isIdentifierPart(peek())) advance();
        return TokenType.ATTRIBUTE;
    }

    private TokenType pound() {
        int hashes = 1;
        while (peekAt(current + hashes - 1) == '#') hashes++;
        if (peekAt(current + hashes - 1) == '"') {
            // Raw string: rewind to the first '#' and let string() consume the delimiters.
            current = start;
            column -= 1;
            for (int i = 0; i < hashes; i++) advance();
            return string(hashes);
        }
        if (!isIdentifierStart(peek())) {
            return TokenType.UNKNOWN;
        }
        while (isIdentifierPart(peek())) advance();
        switch (source.substring(start, current)) {
            case "#if": return TokenType.POUND_IF;
            case "#elseif", "#elif": return TokenType.POUND_ELSEIF;
            case "#else": return TokenType.POUND_ELSE;
            case "#endif": return TokenType.POUND_ENDIF;
            default: return TokenType.POUND_KEYWORD;
        }
    }

    private TokenType string(int hashes) {
        int startLine = line;
        boolean multiline = source.startsWith("\"\"\"", current);
        advanceBy(multiline ? 3 : 1);
        if (!scanStringBody(hashes, multiline)) {
            diagnostics.reportError(CleanerErrorCode.UNTERMINATED_STRING,
                    "Unterminated string literal", logicalFileName, startLine);
        }
        return TokenType.STRING_LITERAL;
    }

    private boolean scanStringBody(int hashes, boolean multiline) {
        String closing = multiline ? "\"\"\"" : "\"";
        while (!isAtEnd()) {
            char c = peek();
            if ((c == '\n' || c == '\r') && !multiline) {
                return false;
            }
            if (c == '\\' && hashesAt(current + 1, hashes)) {
                advanceBy(1 + hashes);
                if (peek() == '(') {
                    advance();
                    if (!scanInterpolation()) {
                        return false;
                    }
                } else if (!isAtEnd() && (multiline || peek() != '\n')) {
                    advance();
                }
                continue;
            }
            if (c == '"' && source.startsWith(closing, current) && hashesAt(current + closing.length(), hashes)) {
                advanceBy(closing.length() + hashes);
                return true;
            }
            advance();
        }
        return false;
    }

    private boolean scanInterpolation() {
        int depth = 1;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '(') {
                depth++;
                advance();
            } else if (c == ')') {
                advance();
                if (--depth == 0) {
                    return true;
                }
            } else if (c == '"') {
                boolean multiline = source.startsWith("\"\"\"", current);
                advanceBy(multiline ? 3 : 1);
                if (!scanStringBody(0, multiline)) {
                    return false;
                }
            } else {
                advance();
            }
        }
        return false;
    }

    /**
     * Consumes the rest of a bare regex literal if the slash just read opens one. The literal must sit
     * where an expression can start, may not begin with whitespace or {@code )}, may not end with
     * whitespace, and closes on the same line. Otherwise nothing is consumed and the slash is an operator.
     */
    private boolean regexLiteral() {
        char first = peek();
        if (!canStartExpression() || isAtEnd() || Character.isWhitespace(first) || first == ')') {
            return false;
        }
        int position = current;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\n' || c == '\r') {
                return false;
            }
            if (c == '\\') {
                char escaped = peekAt(position + 1);
                if (escaped == '\n' || escaped == '\r' || escaped == '\0') {
                    return false;
                }
                position += 2;
                continue;
            }
            if (c == '/') {
                if (Character.isWhitespace(source.charAt(position - 1))) {
                    return false;
                }
                advanceBy(position + 1 - current);
                return true;
            }
            position++;
        }
        return false;
    }

    private boolean canStartExpression() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token previous = tokens.get(tokens.size() - 1);
        switch (previous.type()) {
            case IDENTIFIER, INTEGER_LITERAL, FLOAT_LITERAL, STRING_LITERAL, REGEX_LITERAL,
                    RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE, POSTFIX_OPERATOR:
                return false;
            case KEYWORD:
                return !VALUE_KEYWORDS.contains(previous.text());
            default:
                return true;
        }
    }

    private TokenType number(char first) {
        char radix = peek();
        if (first == '0' && (radix == 'x' || radix == 'o' || radix == 'b')) {
            advance();
            while (isHexDigit(peek()) || peek() == '_') advance();
            return TokenType.INTEGER_LITERAL;
        }
        while (isDigit(peek()) || peek() == '_') advance();
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int ahead = (peekNext() == '+' || peekNext() == '-') ? 2 : 1;
            if (isDigit(peekAt(current + ahead))) {
                isFloat = true;
                advanceBy(ahead);
                while (isDigit(peek()) || peek() == '_') advance();
            }
        }
        return isFloat ? TokenType.FLOAT_LITERAL : TokenType.INTEGER_LITERAL;
    }

    private TokenType operator() {
        while (isOperatorChar(peek()) && !startsComment(current)) advance();
        return operatorType();
    }

    /**
     * Classifies the operator just scanned by its surrounding whitespace:
     * bound on both sides or neither is binary, bound only on the left is postfix,
     * bound only on the right is prefix.
     */
    private TokenType operatorType() {
        boolean leftBound = start > 0 && !isLeftBoundary(source.charAt(start - 1));
        boolean rightBound = !isAtEnd() && !isRightBoundary(peek()) && !startsComment(current);
        if (leftBound == rightBound) {
            return TokenType.BINARY_OPERATOR;
        }
        return leftBound ? TokenType.POSTFIX_OPERATOR : TokenType.PREFIX_OPERATOR;
    }

    /**
     * Scans whitespace and comments into {@code out}. Trailing trivia stops before the next line break,
     * and a block comment spanning several lines is left for the next token's leading trivia.
     */
    private void scanTrivia(List<TriviaPiece> out, boolean trailing) {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ':
                    out.add(new TriviaPiece.Spaces(countRun(' ')));
                    break;
                case '\t':
                    out.add(new TriviaPiece.Tabs(countRun('\t')));
                    break;
                case '\f', '\u000B':
                    out.add(new TriviaPiece.OtherWhitespace(String.valueOf(advance())));
                    break;
                case '\n':
                    if (trailing) return;
                    out.add(new TriviaPiece.Newlines(countRun('\n')));
                    break;
                case '\r':
                    if (trailing) return;
                    out.add(carriageReturns());
                    break;
                case '/':
                    if (peekNext() == '/') {
                        out.add(lineComment());
                    } else if (peekNext() == '*') {
                        TriviaPiece comment = blockComment(trailing);
                        if (comment == null) return;
                        out.add(comment);
                    } else {
                        return;
                    }
                    break;
                default:
                    return;
            }
        }
    }

    private TriviaPiece carriageReturns() {
        int count = 0;
        if (peekNext() == '\n') {
            while (peek() == '\r' && peekNext() == '\n') {
                advanceBy(2);
                count++;
            }
            return new TriviaPiece.CarriageReturnLineFeeds(count);
        }
        while (peek() == '\r' && peekNext() != '\n') {
            advance();
            count++;
        }
        return new TriviaPiece.CarriageReturns(count);
    }

    private TriviaPiece lineComment() {
        int commentStart = current;
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
        String text = source.substring(commentStart, current);
        if (text.startsWith("///") && !text.startsWith("////")) {
            return new TriviaPiece.DocLineComment(text);
        }
        return new TriviaPiece.LineComment(text);
    }

    private TriviaPiece blockComment(boolean trailing) {
        int commentStart = current;
        int commentLine = line;
        int commentColumn = column;
        advanceBy(2);
        int depth = 1;
        while (!isAtEnd() && depth > 0) {
            if (peek() == '/' && peekNext() == '*') {
                advanceBy(2);
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advanceBy(2);
                depth--;
            } else {
                advance();
            }
        }
        String text = source.substring(commentStart, current);
        if (trailing && (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0)) {
            current = commentStart;
            line = commentLine;
            column = commentColumn;
            return null;
        }
        if (depth > 0) {
            diagnostics.reportError(CleanerErrorCode.UNTERMINATED_COMMENT,
                    "Unterminated block comment", logicalFileName, commentLine);
        }
        if (text.startsWith("/**") && !text.startsWith("/**/")) {
            return new TriviaPiece.DocBlockComment(text);
        }
        return new TriviaPiece.BlockComment(text);
    }

    private int countRun(char c) {
        int count = 0;
        while (peek() == c) {
            advance();
            count++;
        }
        return count;
    }

    private boolean hashesAt(int position, int count) {
        for (int i = 0; i < count; i++) {
            if (peekAt(position + i) != '#') return false;
        }
        return true;
    }

    private boolean startsComment(int position) {
        return peekAt(position) == '/' && (peekAt(position + 1) == '/' || peekAt(position + 1) == '*');
    }

    private boolean isLeftBoundary(char c) {
        return Character.isWhitespace(c) || "([{,;:".indexOf(c) >= 0;
    }

    private boolean isRightBoundary(char c) {
        return Character.isWhitespace(c) || ")]},;:".indexOf(c) >= 0;
    }

    private boolean isOperatorChar(char c) {
        return c != '\0' && OPERATOR_CHARS.indexOf(c) >= 0;
    }

    private boolean isIdentifierStart(char c) {
        return c == '_' || c == '$' || Character.isLetter(c);
    }

    private boolean isIdentifierPart(char c) {
        return c == '_' || c == '$' || Character.isLetterOrDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void advanceBy(int count) {
        for (int i = 0; i < count && !isAtEnd(); i++) advance();
    }

    private char peek() {
        return peekAt(current);
    }

    private char peekNext() {
        return peekAt(current + 1);
    }

    private char peekAt(int position) {
        if (position >= source.length()) return '\0';
        return source.charAt(position);
    }
}
