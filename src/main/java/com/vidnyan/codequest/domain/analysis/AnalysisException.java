package com.vidnyan.codequest.domain.analysis;

/**
 * Raised when an analysis run cannot produce a usable call graph:
 * no source files, no entities, no entry points, an empty graph or no levels.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
