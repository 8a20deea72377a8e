package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;
import org.flagcleaner.cleaner.frontend.SourcePrinter;
import org.flagcleaner.cleaner.frontend.lexer.Lexer;
import org.flagcleaner.cleaner.frontend.lexer.TriviaPiece;
import org.flagcleaner.cleaner.frontend.parser.Parser;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link BlockRewriter}.
 * Each test parses a Swift snippet, resolves {@code FEATURE_FLAG} and compares the printed result.
 */
public class BlockRewriterTest {

    private static final String FLAG = "FEATURE_FLAG";

    private final BlockRewriter rewriter = new BlockRewriter(new SequentialConditionEvaluator());

    private static SourceFileNode parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SourceFileNode file = new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics, "Test.swift").parse();
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return file;
    }

    private String clean(String... lines) {
        return SourcePrinter.print(rewriter.rewrite(parse(String.join("\n", lines)), FLAG).tree());
    }

    private static String text(String... lines) {
        return String.join("\n", lines);
    }

    @Test
    @Tag("unit")
    void testIfEnabledFlag() {
        assertThat(clean(
                "#if FEATURE_FLAG",
                "let enabledPart = \"Enabled Part\"",
                "#endif"))
                .isEqualTo("let enabledPart = \"Enabled Part\"");
    }

    @Test
    @Tag("unit")
    void testNotIfEnabledFlag() {
        assertThat(clean(
                "#if !FEATURE_FLAG",
                "let enabledPart = \"Enabled Part\"",
                "#endif"))
                .isEmpty();
    }

    @Test
    @Tag("unit")
    void testElseEnabledFlag() {
        assertThat(clean(
                "#if !FEATURE_FLAG",
                "let disabledPart = \"Disabled Part\"",
                "#else",
                "let enabledPart = \"Enabled Part\"",
                "#endif"))
                .isEqualTo("let enabledPart = \"Enabled Part\"");
    }

    @Test
    @Tag("unit")
    void testHasIndentation() {
        assertThat(clean(
                "#if !FEATURE_FLAG",
                "    let disabledPart = \"Disabled Part\"",
                "#else",
                "    let enabledPart = \"Enabled Part\"",
                "#endif"))
                .isEqualTo("    let enabledPart = \"Enabled Part\"");
    }

    @Test
    @Tag("unit")
    void testHasNewlines() {
        assertThat(clean(
                "#if !FEATURE_FLAG",
                "",
                "    let disabledPart = \"Disabled Part\"",
                "#else",
                "",
                "    let enabledPart = \"Enabled Part\"",
                "#endif"))
                .isEqualTo(text(
                        "",
                        "    let enabledPart = \"Enabled Part\""));
    }

    @Test
    @Tag("unit")
    void testHasComments() {
        assertThat(clean(
                "// Top comment",
                "#if !FEATURE_FLAG // Disabled",
                "    /*",
                "      Internal comment",
                "    */",
                "    let disabledPart = \"Disabled Part\"",
                "#else // FEATURE_FLAG",
                "    /*",
                "          Internal comment",
                "    */",
                "    let enabledPart = \"Enabled Part\"",
                "#endif // FEATURE_FLAG",
                "/// Bottom comment"))
                .isEqualTo(text(
                        "// Top comment",
                        "    /*",
                        "          Internal comment",
                        "    */",
                        "    let enabledPart = \"Enabled Part\"",
                        "/// Bottom comment"));
    }

    @Test
    @Tag("unit")
    void testKeepNewlinesAbove() {
        assertThat(clean(
                "#import Module",
                "",
                "#if FEATURE_FLAG",
                "let enabledPart = \"Enabled Part\"",
                "#endif"))
                .isEqualTo(text(
                        "#import Module",
                        "",
                        "let enabledPart = \"Enabled Part\""));
    }

    @Test
    @Tag("unit")
    void testKeepNewlinesBelow() {
        assertThat(clean(
                "#if FEATURE_FLAG",
                "let enabledPart = \"Enabled Part\"",
                "#endif",
                "",
                "let foo = \"foo\""))
                .isEqualTo(text(
                        "let enabledPart = \"Enabled Part\"",
                        "",
                        "let foo = \"foo\""));
    }

    @Test
    @Tag("unit")
    void testMultipleEnabledFlags() {
        assertThat(clean(
                "#if FEATURE_FLAG",
                "let enabledPart = \"Enabled Part\"",
                "#endif",
                "",
                "#if FEATURE_FLAG",
                "let enabledPart2 = \"Enabled Part\"",
                "#endif",
                "",
                "#if FEATURE_FLAG",
                "let enabledPart3 = \"Enabled Part\"",
                "#endif"))
                .isEqualTo(text(
                        "let enabledPart = \"Enabled Part\"",
                        "",
                        "let enabledPart2 = \"Enabled Part\"",
                        "",
                        "let enabledPart3 = \"Enabled Part\""));
    }

    @Test
    @Tag("unit")
    void testNestedFlagsInsideUnrelatedBlock() {
        assertThat(clean(
                "#if GLOBAL_FLAG",
                "let top = \"top\"",
                "#if FEATURE_FLAG",
                "let enabledPart = \"Enabled Part\"",
                "#else",
                "let disabledPart = \"Disabled Part\"",
                "#endif",
                "let bottom = \"bottom\"",
                "#else",
                "let top2 = \"top\"",
                "#if FEATURE_FLAG",
                "let enabledPart2 = \"Enabled Part\"",
                "#else",
                "let disabledPart2 = \"Disabled Part\"",
                "#endif",
                "let bottom2 = \"bottom\"",
                "#endif"))
                .isEqualTo(text(
                        "#if GLOBAL_FLAG",
                        "let top = \"top\"",
                        "let enabledPart = \"Enabled Part\"",
                        "let bottom = \"bottom\"",
                        "#else",
                        "let top2 = \"top\"",
                        "let enabledPart2 = \"Enabled Part\"",
                        "let bottom2 = \"bottom\"",
                        "#endif"));
    }

    @Test
    @Tag("unit")
    void testIndentedBlocksInsideMembersAndFunctions() {
        assertThat(clean(
                "struct Settings {",
                "    #if FEATURE_FLAG",
                "    var isOn: Bool { true }",
                "    #else",
                "    var isOn: Bool { false }",
                "    #endif",
                "",
                "    func reset() {",
                "        #if !FEATURE_FLAG",
                "        legacyReset()",
                "        #endif",
                "        start()",
                "    }",
                "}"))
                .isEqualTo(text(
                        "struct Settings {",
                        "    var isOn: Bool { true }",
                        "",
                        "    func reset() {",
                        "",
                        "        start()",
                        "    }",
                        "}"));
    }

    @Test
    @Tag("unit")
    void testBlockInsideExpression() {
        assertThat(clean(
                "let values = [",
                "#if FEATURE_FLAG",
                "    1,",
                "#endif",
                "    2",
                "]"))
                .isEqualTo(text(
                        "let values = [",
                        "    1,",
                        "    2",
                        "]"));
    }

    @Test
    @Tag("unit")
    void testElseIfWinner() {
        assertThat(clean(
                "#if !FEATURE_FLAG",
                "let a = 1",
                "#elseif FEATURE_FLAG",
                "let b = 2",
                "#else",
                "let c = 3",
                "#endif"))
                .isEqualTo("let b = 2");
    }

    @Test
    @Tag("unit")
    void testNestedBlockInsideWinnerIsResolvedInTheSamePass() {
        // Arrange
        SourceFileNode file = parse(text(
                "#if FEATURE_FLAG",
                "let a = 1",
                "#if !FEATURE_FLAG",
                "let b = 2",
                "#endif",
                "let c = 3",
                "#endif"));

        // Act
        RewriteResult result = rewriter.rewrite(file, FLAG);

        // Assert
        assertThat(result.resolvedBlocks()).isEqualTo(2);
        assertThat(SourcePrinter.print(result.tree())).isEqualTo(text(
                "let a = 1",
                "",
                "let c = 3"));
    }

    @Test
    @Tag("unit")
    void testSameLineCommentOfLastBodyTokenIsKept() {
        assertThat(clean(
                "#if FEATURE_FLAG",
                "let a = 1 // keep me",
                "#endif // FEATURE_FLAG"))
                .isEqualTo("let a = 1 // keep me");
    }

    @Test
    @Tag("unit")
    void testEmptyWinnerKeepsEndifComment() {
        assertThat(clean(
                "#if FEATURE_FLAG",
                "#else",
                "let a = 1",
                "#endif // done",
                "let b = 2"))
                .isEqualTo(text(
                        " // done",
                        "let b = 2"));
    }

    @Test
    @Tag("unit")
    void testCarriageReturnLineFeeds() {
        assertThat(clean("#if FEATURE_FLAG\r\n\r\nlet a = 1\r\n#endif\r\n"))
                .isEqualTo("\r\nlet a = 1\r\n");
    }

    @Test
    @Tag("unit")
    void testBlocksNotGuardedByTheTargetAloneAreUntouched() {
        String[] sources = {
                text("#if OTHER_FLAG", "let a = 1", "#endif"),
                text("#if FEATURE_FLAG && OTHER_FLAG", "let a = 1", "#endif"),
                text("#if FEATURE_FLAG", "let a = 1", "#elseif OTHER_FLAG", "let b = 2", "#endif"),
                text("#if FEATURE_FLAG && os(iOS)", "let a = 1", "#endif"),
                text("#if 0", "let a = 1", "#endif"),
                text("#if FEATURE_FLAG_2", "let a = 1", "#endif")
        };
        for (String source : sources) {
            // Arrange
            SourceFileNode file = parse(source);

            // Act
            RewriteResult result = rewriter.rewrite(file, FLAG);

            // Assert
            assertThat(result.edited()).as(source).isFalse();
            assertThat(result.tree()).as(source).isSameAs(file);
        }
    }

    @Test
    @Tag("unit")
    void testDropOneLineBreak() {
        assertThat(BlockRewriter.dropOneLineBreak(List.of(new TriviaPiece.Newlines(3), new TriviaPiece.Spaces(2))))
                .containsExactly(new TriviaPiece.Newlines(2), new TriviaPiece.Spaces(2));
        assertThat(BlockRewriter.dropOneLineBreak(List.of(new TriviaPiece.CarriageReturnLineFeeds(1))))
                .isEmpty();
        assertThat(BlockRewriter.dropOneLineBreak(List.of(new TriviaPiece.Spaces(2), new TriviaPiece.Newlines(1))))
                .containsExactly(new TriviaPiece.Spaces(2), new TriviaPiece.Newlines(1));
    }

    @Test
    @Tag("unit")
    void testWithoutDirectiveIndent() {
        assertThat(BlockRewriter.withoutDirectiveIndent(List.of(new TriviaPiece.Newlines(1), new TriviaPiece.Spaces(4))))
                .containsExactly(new TriviaPiece.Newlines(1));
        assertThat(BlockRewriter.withoutDirectiveIndent(List.of(new TriviaPiece.Tabs(1)))).isEmpty();
        assertThat(BlockRewriter.withoutDirectiveIndent(
                List.of(new TriviaPiece.BlockComment("/* c */"), new TriviaPiece.Spaces(1))))
                .containsExactly(new TriviaPiece.BlockComment("/* c */"), new TriviaPiece.Spaces(1));
    }
}
