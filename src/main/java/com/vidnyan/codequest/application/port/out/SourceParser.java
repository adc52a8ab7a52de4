package com.vidnyan.codequest.application.port.out;

import com.vidnyan.codequest.domain.analysis.FileExtraction;
import com.vidnyan.codequest.domain.model.Language;

import java.nio.file.Path;

/**
 * Port for extracting code entities from one source file.
 * Implemented by one adapter per language.
 */
public interface SourceParser {

    Language language();

    /**
     * Parse a single file into its entities and call sites.
     * Entities come out in declaration order, each class directly followed by its methods.
     *
     * @throws SourceParseException when the file cannot be read or is not valid source
     */
    FileExtraction parse(Path file) throws SourceParseException;
}
