package org.flagcleaner.cleaner.rewrite;

import org.flagcleaner.cleaner.frontend.parser.ast.SourceFileNode;

/**
 * The outcome of one {@link BlockRewriter} pass over a file.
 *
 * @param tree The rewritten tree; the input tree itself if nothing was resolved.
 * @param resolvedBlocks The number of conditional blocks that were resolved for the target flag.
 */
public record RewriteResult(SourceFileNode tree, int resolvedBlocks) {

    /**
     * Reports whether the pass changed anything.
     * @return {@code true} if at least one block was resolved.
     */
    public boolean edited() {
        return resolvedBlocks > 0;
    }
}
