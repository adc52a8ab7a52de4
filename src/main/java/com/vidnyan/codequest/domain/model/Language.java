package com.vidnyan.codequest.domain.model;

import java.util.List;

/**
 * Source languages understood by the analysis pipeline.
 * Each language owns the file extensions used to discover its sources.
 */
public enum Language {
    PYTHON(List.of(".py")),
    JAVA(List.of(".java")),
    GOLANG(List.of(".go"));

    private final List<String> extensions;

    Language(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Check if a file name carries one of this language's extensions.
     */
    public boolean matches(String fileName) {
        return extensions.stream().anyMatch(fileName::endsWith);
    }
}
