package com.vidnyan.codequest.domain.analysis;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.level.Level;
import com.vidnyan.codequest.domain.model.Language;

import java.time.Instant;
import java.util.List;

/**
 * Complete output of one analysis run.
 * {@code valid} is false when the graph failed structural validation; the
 * problems are listed in {@code errors}. Skipped files are listed in {@code warnings}.
 */
public record AnalysisResult(
    String projectId,
    Language language,
    CallGraph callGraph,
    List<Level> levels,
    Instant analyzedAt,
    long analysisTimeMs,
    int filesAnalyzed,
    int linesOfCode,
    boolean valid,
    List<String> errors,
    List<String> warnings
) {

    public AnalysisResult {
        levels = List.copyOf(levels);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * Copy whose levels carry no answer payloads.
     */
    public AnalysisResult learnerView() {
        return new AnalysisResult(projectId, language, callGraph,
                levels.stream().map(Level::learnerView).toList(),
                analyzedAt, analysisTimeMs, filesAnalyzed, linesOfCode, valid, errors, warnings);
    }
}
