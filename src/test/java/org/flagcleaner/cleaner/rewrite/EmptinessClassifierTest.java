package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;
import org.flagcleaner.cleaner.frontend.lexer.Lexer;
import org.flagcleaner.cleaner.frontend.parser.Parser;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EmptinessClassifier}.
 */
public class EmptinessClassifierTest {

    private final EmptinessClassifier classifier = new EmptinessClassifier();

    private boolean isEmpty(String... lines) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SourceFileNode file = new Parser(new Lexer(String.join("\n", lines), diagnostics).scanTokens(),
                diagnostics, "Test.swift").parse();
        return classifier.isEmpty(file);
    }

    @Test
    @Tag("unit")
    void testFullyEmpty() {
        assertThat(isEmpty("")).isTrue();
    }

    @Test
    @Tag("unit")
    void testCommentsOnly() {
        assertThat(isEmpty(
                "// Comment",
                "/*",
                "  Comment",
                "*/",
                "/// Comment")).isTrue();
    }

    @Test
    @Tag("unit")
    void testImportsAndStatementsOnly() {
        assertThat(isEmpty("import UIKit", "@testable import ABC", "print(\"hello\")")).isTrue();
    }

    @Test
    @Tag("unit")
    void testDeclarationsAreMeaningful() {
        assertThat(isEmpty("import UIKit", "extension Foo {}")).isFalse();
        assertThat(isEmpty("typealias Id = String")).isFalse();
        assertThat(isEmpty("private let constant = 1")).isFalse();
        assertThat(isEmpty("#Preview { Text(\"hi\") }")).isFalse();
    }

    @Test
    @Tag("unit")
    void testDeclarationInsideRemainingConditionalBlockCounts() {
        assertThat(isEmpty("#if DEBUG", "func debugOnly() {}", "#endif")).isFalse();
        assertThat(isEmpty("#if DEBUG", "print(1)", "#endif")).isTrue();
    }
}
