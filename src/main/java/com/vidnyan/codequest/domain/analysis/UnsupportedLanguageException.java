package com.vidnyan.codequest.domain.analysis;

import com.vidnyan.codequest.domain.model.Language;

/**
 * Raised before any file is touched when no extractor exists for a language.
 */
public class UnsupportedLanguageException extends RuntimeException {

    private final Language language;

    public UnsupportedLanguageException(Language language, String message) {
        super(message);
        this.language = language;
    }

    public Language getLanguage() {
        return language;
    }
}
