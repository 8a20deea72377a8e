package org.flagcleaner.cleaner.frontend.parser;

import org.flagcleaner.cleaner.api.CleanerErrorCode;
import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;
import org.flagcleaner.cleaner.frontend.lexer.Token;
import org.flagcleaner.cleaner.frontend.lexer.TokenType;
import org.flagcleaner.cleaner.frontend.parser.ast.BraceGroupNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ClauseKind;
import org.flagcleaner.cleaner.frontend.parser.ast.ClauseNode;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionExpr;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionalBlockNode;
import org.flagcleaner.cleaner.frontend.parser.ast.DeclarationKind;
import org.flagcleaner.cleaner.frontend.parser.ast.DeclarationNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SyntaxNode;
import org.flagcleaner.cleaner.frontend.parser.ast.TokenNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link SourceFileNode} from the tokens produced by the
 * {@link org.flagcleaner.cleaner.frontend.lexer.Lexer}.
 * <p>
 * The parser only recovers the structure the cleaner needs: items split at line starts,
 * brace groups, and {@code #if} blocks wherever they appear. Everything else is kept as plain tokens.
 */
public class Parser {

    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "fileprivate", "internal", "open", "package", "static", "final",
            "override", "mutating", "nonmutating", "lazy", "weak", "unowned", "required", "convenience",
            "dynamic", "optional", "indirect", "prefix", "postfix", "infix", "nonisolated", "isolated",
            "distributed", "consuming", "borrowing", "async");

    private static final Set<String> CONTINUATION_KEYWORDS = Set.of("else", "where", "catch");

    private static final Set<TokenType> CONTINUATION_STARTS = EnumSet.of(
            TokenType.PERIOD, TokenType.BINARY_OPERATOR, TokenType.RIGHT_PAREN, TokenType.RIGHT_BRACKET,
            TokenType.COMMA, TokenType.COLON, TokenType.LEFT_BRACE);

    private static final Set<TokenType> CONTINUATION_ENDS = EnumSet.of(
            TokenType.PERIOD, TokenType.BINARY_OPERATOR, TokenType.PREFIX_OPERATOR, TokenType.COMMA,
            TokenType.LEFT_PAREN, TokenType.LEFT_BRACKET, TokenType.COLON, TokenType.ATTRIBUTE,
            TokenType.BACKSLASH);

    private enum Scope { FILE, BRACES, CLAUSE }

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by an end-of-file token.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param logicalFileName The name of the file being parsed, for error reporting.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Parses the entire token stream.
     * @return The root node. Check the diagnostics engine for errors before trusting its structure.
     */
    public SourceFileNode parse() {
        List<SyntaxNode> items = items(Scope.FILE);
        return new SourceFileNode(items, peek());
    }

    private List<SyntaxNode> items(Scope scope) {
        List<SyntaxNode> items = new ArrayList<>();
        while (!isAtEnd()) {
            if (checkClauseTerminator()) {
                if (scope == Scope.CLAUSE) break;
                items.add(stray(CleanerErrorCode.DIRECTIVE_WITHOUT_IF,
                        "'" + peek().text() + "' without matching #if"));
                continue;
            }
            if (check(TokenType.RIGHT_BRACE)) {
                if (scope == Scope.BRACES) break;
                items.add(stray(CleanerErrorCode.UNBALANCED_DELIMITER, "Unexpected '}'"));
                continue;
            }
            items.add(check(TokenType.POUND_IF) ? conditionalBlock() : declaration());
        }
        return items;
    }

    private DeclarationNode declaration() {
        List<SyntaxNode> parts = new ArrayList<>();
        List<Token> head = new ArrayList<>();
        boolean onlyAttributes = true;
        int depth = 0;
        Token last = null;

        while (!isAtEnd()) {
            Token token = peek();
            if (last != null && depth == 0 && startsNewItem(token, last, onlyAttributes)) {
                break;
            }
            if (checkClauseTerminator() || check(TokenType.RIGHT_BRACE)) {
                if (depth > 0) {
                    diagnostics.reportError(CleanerErrorCode.UNBALANCED_DELIMITER,
                            "Unclosed bracket before '" + token.text() + "'", logicalFileName, token.line());
                }
                break;
            }
            if (check(TokenType.POUND_IF)) {
                ConditionalBlockNode block = conditionalBlock();
                parts.add(block);
                last = previous();
                continue;
            }
            if (check(TokenType.LEFT_BRACE)) {
                parts.add(braceGroup());
                last = previous();
                onlyAttributes = false;
                continue;
            }

            int depthBefore = depth;
            if (token.type() == TokenType.LEFT_PAREN || token.type() == TokenType.LEFT_BRACKET) {
                depth++;
            } else if ((token.type() == TokenType.RIGHT_PAREN || token.type() == TokenType.RIGHT_BRACKET) && depth > 0) {
                depth--;
            }
            parts.add(new TokenNode(advance()));
            last = token;

            if (depthBefore == 0 && depth == 0) {
                head.add(token);
                if (token.type() != TokenType.ATTRIBUTE && !MODIFIERS.contains(token.text())) {
                    onlyAttributes = false;
                }
            }
        }
        return new DeclarationNode(classify(head), parts);
    }

    private boolean startsNewItem(Token token, Token previous, boolean onlyAttributes) {
        if (previous.type() == TokenType.SEMICOLON) return true;
        if (!token.hasNewlineBefore()) return false;
        if (token.type() == TokenType.POUND_IF) return true;
        if (onlyAttributes) return false;
        if (CONTINUATION_STARTS.contains(token.type())) return false;
        if (token.type() == TokenType.KEYWORD && CONTINUATION_KEYWORDS.contains(token.text())) return false;
        return !CONTINUATION_ENDS.contains(previous.type());
    }

    private BraceGroupNode braceGroup() {
        Token leftBrace = advance();
        List<SyntaxNode> inner = items(Scope.BRACES);
        Token rightBrace = null;
        if (check(TokenType.RIGHT_BRACE)) {
            rightBrace = advance();
        } else {
            diagnostics.reportError(CleanerErrorCode.UNBALANCED_DELIMITER,
                    "Expected '}' to close '{' opened here", logicalFileName, leftBrace.line());
        }
        return new BraceGroupNode(leftBrace, inner, rightBrace);
    }

    private ConditionalBlockNode conditionalBlock() {
        Token opening = peek();
        List<ClauseNode> clauses = new ArrayList<>();
        clauses.add(clause(ClauseKind.IF));
        boolean seenElse = false;

        while (true) {
            if (check(TokenType.POUND_ELSEIF)) {
                if (seenElse) {
                    diagnostics.reportError(CleanerErrorCode.ELSEIF_AFTER_ELSE,
                            "#elseif after #else", logicalFileName, peek().line());
                }
                clauses.add(clause(ClauseKind.ELSEIF));
            } else if (check(TokenType.POUND_ELSE)) {
                if (seenElse) {
                    diagnostics.reportError(CleanerErrorCode.DUPLICATE_ELSE,
                            "Second #else in the same block", logicalFileName, peek().line());
                }
                seenElse = true;
                clauses.add(clause(ClauseKind.ELSE));
            } else if (check(TokenType.POUND_ENDIF)) {
                Token endif = advance();
                if (!isAtEnd() && !peek().hasNewlineBefore()) {
                    diagnostics.reportError(CleanerErrorCode.UNEXPECTED_DIRECTIVE_ARGUMENT,
                            "Unexpected '" + peek().text() + "' after #endif", logicalFileName, endif.line());
                }
                return new ConditionalBlockNode(clauses, endif);
            } else {
                diagnostics.reportError(CleanerErrorCode.MISSING_ENDIF,
                        "#if without #endif", logicalFileName, opening.line());
                return new ConditionalBlockNode(clauses, null);
            }
        }
    }

    private ClauseNode clause(ClauseKind kind) {
        Token poundKeyword = advance();
        List<Token> conditionTokens = new ArrayList<>();
        while (!isAtEnd() && !peek().hasNewlineBefore()) {
            conditionTokens.add(advance());
        }

        ConditionExpr condition = null;
        if (kind == ClauseKind.ELSE) {
            if (!conditionTokens.isEmpty()) {
                diagnostics.reportError(CleanerErrorCode.UNEXPECTED_DIRECTIVE_ARGUMENT,
                        "#else takes no condition", logicalFileName, poundKeyword.line());
            }
        } else if (conditionTokens.isEmpty()) {
            diagnostics.reportError(CleanerErrorCode.MISSING_CONDITION,
                    poundKeyword.text() + " requires a condition", logicalFileName, poundKeyword.line());
        } else {
            condition = new ConditionParser(conditionTokens).parse();
            if (condition instanceof ConditionExpr.Unsupported unsupported) {
                diagnostics.reportWarning(CleanerErrorCode.UNSUPPORTED_CONDITION,
                        "Unsupported condition: " + unsupported.reason(), logicalFileName, poundKeyword.line());
            }
        }

        List<SyntaxNode> body = items(Scope.CLAUSE);
        return new ClauseNode(kind, poundKeyword, conditionTokens, condition, body);
    }

    private DeclarationNode stray(CleanerErrorCode code, String message) {
        Token token = advance();
        diagnostics.reportError(code, message, logicalFileName, token.line());
        return new DeclarationNode(DeclarationKind.OTHER, List.of(new TokenNode(token)));
    }

    /**
     * Classifies an item by the first token after its attributes and modifiers.
     */
    private DeclarationKind classify(List<Token> head) {
        int i = 0;
        while (i < head.size() - 1) {
            Token token = head.get(i);
            boolean classModifier = token.text().equals("class") && isIntroducer(head.get(i + 1).text());
            if (token.type() == TokenType.ATTRIBUTE || MODIFIERS.contains(token.text()) || classModifier) {
                i++;
            } else {
                break;
            }
        }
        if (head.isEmpty()) {
            return DeclarationKind.OTHER;
        }

        Token introducer = head.get(i);
        boolean namedNext = i + 1 < head.size() && head.get(i + 1).type() == TokenType.IDENTIFIER;
        if (introducer.type() == TokenType.POUND_KEYWORD) {
            return DeclarationKind.MACRO_EXPANSION;
        }
        switch (introducer.text()) {
            case "struct", "enum", "protocol", "class", "extension":
                return DeclarationKind.TYPE;
            case "actor":
                return namedNext ? DeclarationKind.TYPE : DeclarationKind.OTHER;
            case "typealias", "associatedtype":
                return DeclarationKind.TYPEALIAS;
            case "func", "init", "deinit", "subscript":
                return DeclarationKind.FUNCTION;
            case "var", "let":
                return DeclarationKind.VARIABLE;
            case "macro":
                return namedNext ? DeclarationKind.MACRO : DeclarationKind.OTHER;
            case "import":
                return DeclarationKind.IMPORT;
            default:
                return DeclarationKind.OTHER;
        }
    }

    private boolean isIntroducer(String text) {
        return switch (text) {
            case "func", "var", "let", "subscript", "init" -> true;
            default -> MODIFIERS.contains(text);
        };
    }

    private boolean checkClauseTerminator() {
        return check(TokenType.POUND_ELSEIF) || check(TokenType.POUND_ELSE) || check(TokenType.POUND_ENDIF);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
