package io.codewaste.git;

/**
 * Attribution of one source line.
 *
 * @param commit     full commit hash
 * @param author     author name, or null if the porcelain block had none
 * @param authorTime author time in epoch seconds, or null if absent or malformed
 */
public record BlameLine(String commit, String author, Long authorTime) {
}
