package com.vidnyan.codequest.domain.model;

/**
 * Source code location of an extracted entity.
 */
public record Location(
    String filePath,
    int startLine,
    int endLine
) {

    /**
     * Number of source lines spanned, inclusive.
     */
    public int lineSpan() {
        return endLine - startLine + 1;
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + startLine + "-" + endLine;
    }
}
