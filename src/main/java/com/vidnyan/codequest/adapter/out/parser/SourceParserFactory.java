package com.vidnyan.codequest.adapter.out.parser;

import com.vidnyan.codequest.adapter.out.parser.java.JavaSourceParser;
import com.vidnyan.codequest.adapter.out.parser.python.PythonSourceParser;
import com.vidnyan.codequest.application.port.out.SourceParser;
import com.vidnyan.codequest.domain.analysis.UnsupportedLanguageException;
import com.vidnyan.codequest.domain.model.Language;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh {@link SourceParser} per call for the requested language.
 */
@Component
public class SourceParserFactory {

    /**
     * @throws UnsupportedLanguageException when no extractor exists for the language
     */
    public SourceParser create(Language language) {
        return switch (language) {
            case PYTHON -> new PythonSourceParser();
            case JAVA -> new JavaSourceParser();
            default -> throw new UnsupportedLanguageException(language, "No extractor available for " + language);
        };
    }
}
