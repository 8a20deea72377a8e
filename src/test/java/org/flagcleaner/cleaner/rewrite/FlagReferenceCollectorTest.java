package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;
import org.flagcleaner.cleaner.frontend.lexer.Lexer;
import org.flagcleaner.cleaner.frontend.parser.Parser;
import org.flagcleaner.cleaner.frontend.parser.ast.ConditionalBlockNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FlagReferenceCollector}.
 */
public class FlagReferenceCollectorTest {

    private final FlagReferenceCollector collector = new FlagReferenceCollector();

    private ConditionalBlockNode block(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return (ConditionalBlockNode) new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics, "Test.swift")
                .parse().items().get(0);
    }

    @Test
    @Tag("unit")
    void testCollectsFlagsOfAllConditionsInOrder() {
        // Arrange
        ConditionalBlockNode block = block("#if B && !(A || 0)\n#elseif C || B\n#else\n#endif");

        // Act & Assert
        assertThat(collector.collect(block)).hasValueSatisfying(flags ->
                assertThat(flags).containsExactly("B", "A", "C"));
    }

    @Test
    @Tag("unit")
    void testLiteralOnlyConditionsYieldEmptySet() {
        assertThat(collector.collect(block("#if 0\n#endif"))).hasValueSatisfying(flags -> assertThat(flags).isEmpty());
    }

    @Test
    @Tag("unit")
    void testUnsupportedConditionYieldsNothing() {
        assertThat(collector.collect(block("#if FLAG\n#elseif os(iOS)\n#endif"))).isEmpty();
        assertThat(collector.collect(block("#if true\n#endif"))).isEmpty();
    }
}
