package com.example.SmartDairy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Attribution attached to a final answer.
 *
 * @param label      display name: document file name, web result title or data file name
 * @param kind       where the information came from
 * @param url        link for web results, null otherwise
 * @param chunkIndex fragment sequence index for document sources, null otherwise
 * @param priority   tier assigned by the hybrid strategy, null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceReference(
        String label,
        SourceKind kind,
        String url,
        Integer chunkIndex,
        SourcePriority priority
) {

    public static SourceReference document(String fileName, int chunkIndex) {
        return new SourceReference(fileName, SourceKind.DOCUMENT, null, chunkIndex, null);
    }

    public static SourceReference web(String title, String url) {
        return new SourceReference(title, SourceKind.WEB, url, null, null);
    }

    public static SourceReference tabular(String fileName) {
        return new SourceReference(fileName, SourceKind.TABULAR, null, null, null);
    }

    public SourceReference withPriority(SourcePriority newPriority) {
        return new SourceReference(label, kind, url, chunkIndex, newPriority);
    }
}
