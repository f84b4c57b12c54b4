package io.codewaste.git;

/**
 * One commit in a file's history.
 */
public record CommitRef(String commit, String author) {
}
