package com.vidnyan.codequest.application.port.in;

import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import com.vidnyan.codequest.domain.level.LevelGenerator;
import com.vidnyan.codequest.domain.model.Language;

import java.nio.file.Path;

/**
 * Primary use case: analyze a source tree and generate learning levels from its call graph.
 */
public interface AnalyzeProjectUseCase {

    /**
     * Analyze a source tree.
     *
     * @param request Analysis request parameters
     * @return call graph, levels and run metadata
     * @throws com.vidnyan.codequest.domain.analysis.AnalysisException when the run cannot produce a result
     * @throws com.vidnyan.codequest.domain.analysis.UnsupportedLanguageException when the language has no extractor
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path sourcePath,
        Language language,
        String projectId,
        int maxLevels,
        int chainDepth
    ) {
        public static AnalysisRequest forPath(Path path, Language language) {
            return new AnalysisRequest(path, language, path.toString(),
                    LevelGenerator.DEFAULT_MAX_LEVELS, LevelGenerator.DEFAULT_CHAIN_DEPTH);
        }
    }
}
