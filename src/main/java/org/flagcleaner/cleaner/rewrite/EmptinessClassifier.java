package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.TreeWalker;
import org.flagcleaner.cleaner.frontend.parser.ast.DeclarationNode;
import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;

/**
 * Decides whether a cleaned file still has content worth keeping.
 * <p>
 * A file is empty when it holds no type, typealias, function, variable, macro or macro expansion
 * anywhere, including inside remaining conditional blocks and code blocks. Comments, imports and
 * other statements do not count.
 */
public class EmptinessClassifier {

    private final TreeWalker walker = new TreeWalker();

    /**
     * Checks a parsed file for meaningful declarations.
     * @param file The file to inspect.
     * @return {@code true} if the file has none.
     */
    public boolean isEmpty(SourceFileNode file) {
        return !walker.anyMatch(file,
                node -> node instanceof DeclarationNode declaration && declaration.kind().isMeaningful());
    }
}
