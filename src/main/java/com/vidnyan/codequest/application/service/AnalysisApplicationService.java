package com.vidnyan.codequest.application.service;

import com.vidnyan.codequest.adapter.out.parser.SourceParserFactory;
import com.vidnyan.codequest.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.codequest.application.port.out.SourceParseException;
import com.vidnyan.codequest.application.port.out.SourceParser;
import com.vidnyan.codequest.domain.analysis.AnalysisException;
import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import com.vidnyan.codequest.domain.analysis.CallResolver;
import com.vidnyan.codequest.domain.analysis.EntryPointIdentifier;
import com.vidnyan.codequest.domain.analysis.FileExtraction;
import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.level.Level;
import com.vidnyan.codequest.domain.level.LevelGenerator;
import com.vidnyan.codequest.scanner.RepositoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisApplicationService implements AnalyzeProjectUseCase {

    private final SourceParserFactory parserFactory;
    private final RepositoryScanner repositoryScanner;
    private final CallResolver callResolver;
    private final EntryPointIdentifier entryPointIdentifier;
    private final LevelGenerator levelGenerator;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting {} analysis of: {}", request.language(), request.sourcePath());

        SourceParser parser = parserFactory.create(request.language());

        // Step 1: Discover source files
        log.info("Step 1: Scanning source files...");
        List<Path> files = scan(request);
        if (files.isEmpty()) {
            throw new AnalysisException("No " + request.language() + " files found in " + request.sourcePath());
        }
        log.info("Found {} source files", files.size());

        // Step 2: Extract entities per file
        log.info("Step 2: Extracting code entities...");
        List<FileExtraction> extractions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Path file : files) {
            try {
                extractions.add(parser.parse(file));
            } catch (SourceParseException e) {
                log.warn("Skipping {}: {}", file, e.getMessage());
                warnings.add("Failed to parse " + e.getMessage());
            }
        }
        log.info("Parsed {} of {} files", extractions.size(), files.size());

        // Step 3: Resolve calls
        log.info("Step 3: Resolving calls...");
        CallResolver.Resolution resolution = callResolver.resolve(extractions);
        warnings.addAll(resolution.warnings());
        if (resolution.nodes().isEmpty()) {
            throw new AnalysisException("Call graph is empty: no code entities extracted from "
                    + request.sourcePath());
        }

        // Step 4: Build graph
        log.info("Step 4: Building call graph...");
        List<String> entryPoints = entryPointIdentifier.identify(resolution.nodes().values());
        if (entryPoints.isEmpty()) {
            throw new AnalysisException("No entry points identified in " + request.sourcePath());
        }
        CallGraph callGraph = CallGraph.of(resolution.nodes(), resolution.edges(), entryPoints);
        CallGraph.Stats stats = callGraph.stats();
        log.info("Built: {} nodes, {} edges, {} entry points, max depth {}",
                stats.nodeCount(), stats.edgeCount(), stats.entryPointCount(), stats.maxDepth());

        // Step 5: Validate
        log.info("Step 5: Validating graph...");
        List<String> errors = callGraph.structuralProblems();
        errors.forEach(problem -> log.error("Invalid graph: {}", problem));

        // Step 6: Generate levels
        log.info("Step 6: Generating levels...");
        List<Level> levels = levelGenerator.generate(callGraph, request.maxLevels(), request.chainDepth());
        if (levels.isEmpty()) {
            throw new AnalysisException("No levels could be generated: no call chain of two or more entities in "
                    + request.sourcePath());
        }

        int linesOfCode = extractions.stream().mapToInt(FileExtraction::lineCount).sum();
        Duration totalDuration = Duration.between(startTime, Instant.now());
        log.info("Analysis complete: {} levels from {} files ({} lines) in {}ms",
                levels.size(), files.size(), linesOfCode, totalDuration.toMillis());

        return new AnalysisResult(
                request.projectId(),
                request.language(),
                callGraph,
                levels,
                startTime,
                totalDuration.toMillis(),
                files.size(),
                linesOfCode,
                errors.isEmpty(),
                errors,
                warnings);
    }

    private List<Path> scan(AnalysisRequest request) {
        try {
            return repositoryScanner.scanSourceFiles(request.sourcePath(), request.language());
        } catch (IOException e) {
            throw new AnalysisException("Cannot scan " + request.sourcePath(), e);
        }
    }
}
