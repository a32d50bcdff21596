package com.williamcallahan.agentknowledge.domain;

/**
 * Provenance details describing where an entry came from.
 *
 * @param project logical project name
 * @param repo repository identifier
 * @param commit commit hash at the time of capture
 * @param branch branch name
 * @param os operating system
 * @param runtime runtime or interpreter version
 * @param language primary programming language
 * @param framework framework in use
 */
public record EntryMetadata(
        String project,
        String repo,
        String commit,
        String branch,
        String os,
        String runtime,
        String language,
        String framework) {

    /**
     * Returns metadata with every field absent.
     */
    public static EntryMetadata empty() {
        return new EntryMetadata(null, null, null, null, null, null, null, null);
    }

    /**
     * Metadata used for documentation files pulled from a local directory.
     */
    public static EntryMetadata forLocalDocs(String project, String repo) {
        return new EntryMetadata(project, repo, null, null, null, null, "markdown", null);
    }
}
