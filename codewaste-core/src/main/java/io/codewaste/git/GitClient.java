package io.codewaste.git;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to a repository's history.
 *
 * <p>Implementations never throw for git failures. A failed query is
 * reported as no data.</p>
 */
public interface GitClient {

    /**
     * Whether the root is inside a git work tree.
     */
    boolean isWorkTree();

    /**
     * Commits touching the file, following renames, newest first.
     *
     * @param filePath repository-relative path
     * @return the commits, or empty if git could not answer
     */
    Optional<List<CommitRef>> fileHistory(String filePath);

    /**
     * Line-level attribution for lines [startLine, endLine] of the file.
     *
     * @return one entry per attributed line, or empty if git could not answer
     */
    Optional<List<BlameLine>> blame(String filePath, int startLine, int endLine);
}
