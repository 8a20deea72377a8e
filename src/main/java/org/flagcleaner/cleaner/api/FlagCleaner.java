package org.flagcleaner.cleaner.api;

import org.flagcleaner.cleaner.diagnostics.Diagnostic;
import org.flagcleaner.cleaner.diagnostics.DiagnosticsEngine;
import org.flagcleaner.cleaner.frontend.SourcePrinter;
import org.flagcleaner.cleaner.frontend.lexer.Lexer;
import org.flagcleaner.cleaner.frontend.lexer.Token;
import org.flagcleaner.cleaner.frontend.parser.Parser;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;
import org.flagcleaner.cleaner.rewrite.BlockRewriter;
import org.flagcleaner.cleaner.rewrite.EmptinessClassifier;
import org.flagcleaner.cleaner.rewrite.EvaluationMode;
import org.flagcleaner.cleaner.rewrite.IConditionEvaluator;
import org.flagcleaner.cleaner.rewrite.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main entry point for cleaning Swift source text.
 * <p>
 * Parses the text, resolves every conditional block that depends on the target flag alone, and decides
 * whether the result should be written back or the file deleted. The operation is pure: it never touches
 * the file system and may be called concurrently for different texts.
 */
public class FlagCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(FlagCleaner.class);

    private final BlockRewriter rewriter;
    private final EmptinessClassifier emptinessClassifier = new EmptinessClassifier();

    /**
     * Creates a cleaner with the default sequential evaluator.
     */
    public FlagCleaner() {
        this(EvaluationMode.SEQUENTIAL.createEvaluator());
    }

    /**
     * Creates a cleaner with the given condition evaluator.
     * @param evaluator The evaluator for clause conditions.
     */
    public FlagCleaner(IConditionEvaluator evaluator) {
        this.rewriter = new BlockRewriter(evaluator);
    }

    /**
     * Cleans source text.
     * @param sourceText The Swift source.
     * @param targetFlag The flag to resolve as enabled.
     * @return What to do with the file.
     * @throws SourceParseException if the text cannot be parsed.
     */
    public CleanResult clean(String sourceText, String targetFlag) throws SourceParseException {
        return clean(sourceText, targetFlag, "<memory>");
    }

    /**
     * Cleans source text, naming the file in diagnostics.
     * @param sourceText The Swift source.
     * @param targetFlag The flag to resolve as enabled.
     * @param fileName The logical file name used in diagnostics.
     * @return What to do with the file.
     * @throws SourceParseException if the text, or the cleaned text, cannot be parsed.
     */
    public CleanResult clean(String sourceText, String targetFlag, String fileName) throws SourceParseException {
        if (targetFlag == null || targetFlag.isBlank()) {
            throw new IllegalArgumentException("Target flag must not be blank");
        }

        SourceFileNode tree = parse(sourceText, fileName);
        RewriteResult result = rewriter.rewrite(tree, targetFlag);
        if (!result.edited()) {
            return CleanResult.unchanged();
        }

        String cleaned = SourcePrinter.print(result.tree());
        LOG.debug("Resolved {} conditional block(s) for {} in {}", result.resolvedBlocks(), targetFlag, fileName);
        if (emptinessClassifier.isEmpty(parse(cleaned, fileName))) {
            return CleanResult.delete();
        }
        return CleanResult.rewritten(cleaned);
    }

    private SourceFileNode parse(String text, String fileName) throws SourceParseException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(text, diagnostics, fileName).scanTokens();
        SourceFileNode tree = new Parser(tokens, diagnostics, fileName).parse();
        if (diagnostics.hasErrors()) {
            throw new SourceParseException("Failed to parse " + fileName + ":\n" + diagnostics.summary(),
                    diagnostics.getErrors());
        }
        for (Diagnostic warning : diagnostics.getDiagnostics()) {
            LOG.debug("{}", warning);
        }
        return tree;
    }
}
