package com.vidnyan.codequest.domain.analysis;

import java.nio.file.Path;
import java.util.List;

/**
 * Entities extracted from one source file, in declaration order.
 * A class entity is followed directly by its methods.
 */
public record FileExtraction(
    Path file,
    List<ExtractedEntity> entities,
    int complexity,
    int lineCount
) {

    public FileExtraction {
        entities = List.copyOf(entities);
    }
}
