package com.vidnyan.codequest.adapter.in.cli;

import com.vidnyan.codequest.adapter.out.export.DotExporter;
import com.vidnyan.codequest.adapter.out.export.JsonResultWriter;
import com.vidnyan.codequest.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.codequest.application.port.in.AnalyzeProjectUseCase.AnalysisRequest;
import com.vidnyan.codequest.config.AnalysisProperties;
import com.vidnyan.codequest.domain.analysis.AnalysisException;
import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import com.vidnyan.codequest.domain.analysis.UnsupportedLanguageException;
import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.level.Level;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI Runner for standalone analysis.
 * Runs analysis when codequest.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private final AnalyzeProjectUseCase analyzeProjectUseCase;
    private final AnalysisProperties properties;
    private final JsonResultWriter jsonResultWriter;
    private final DotExporter dotExporter;
    private final ConfigurableApplicationContext context;

    @Value("${codequest.analyze.path:}")
    private String sourcePath;

    @Override
    public void run(String... args) throws Exception {
        if (!properties.isEnabled()) {
            log.info("Analysis disabled (codequest.analysis.enabled=false).");
            return;
        }
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set codequest.analyze.path property.");
            return;
        }

        int exitCode = 0;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                 CodeQuest - Level Generator                  ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("║ Language:  {}", properties.getLanguage());
            log.info("╚══════════════════════════════════════════════════════════════╝");

            Path root = Path.of(sourcePath);
            AnalysisRequest request = new AnalysisRequest(root, properties.getLanguage(), root.toString(),
                    properties.getMaxLevels(), properties.getChainDepth());
            AnalysisResult result = analyzeProjectUseCase.analyze(request);

            printResults(result);

            if (!properties.getOutputFile().isBlank()) {
                jsonResultWriter.write(result, Path.of(properties.getOutputFile()), properties.isLearnerView());
            }
            if (!properties.getDotFile().isBlank()) {
                dotExporter.write(result.callGraph(), Path.of(properties.getDotFile()));
            }

            log.info("");
            log.info("Analysis complete!");
        } catch (AnalysisException | UnsupportedLanguageException e) {
            log.error("Analysis failed: {}", e.getMessage());
            exitCode = 1;
        } finally {
            // Ensure application shuts down after analysis
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisResult result) {
        CallGraph.Stats stats = result.callGraph().stats();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files analyzed:   {}", result.filesAnalyzed());
        log.info(" Lines of code:    {}", result.linesOfCode());
        log.info(" Nodes:            {}", stats.nodeCount());
        log.info(" Edges:            {}", stats.edgeCount());
        log.info(" Entry points:     {}", stats.entryPointCount());
        log.info(" Max depth:        {}", stats.maxDepth());
        log.info(" Duration:         {}ms", result.analysisTimeMs());
        log.info(" Valid:            {}", result.valid() ? "yes" : "NO");
        log.info("───────────────────────────────────────────────────────────────");

        if (!result.warnings().isEmpty()) {
            log.info(" WARNINGS ({}):", result.warnings().size());
            result.warnings().forEach(w -> log.info("   🟡 {}", w));
        }
        if (!result.errors().isEmpty()) {
            log.info(" ERRORS ({}):", result.errors().size());
            result.errors().forEach(e -> log.info("   🔴 {}", e));
        }

        log.info("");
        log.info(" LEVELS:");
        log.info("───────────────────────────────────────────────────────────────");
        for (Level level : result.levels()) {
            log.info("");
            log.info(" {} {} [{}] {} XP, ~{} min", level.id(), level.name(), level.difficulty(),
                    level.xpReward(), level.estimatedTime());
            log.info(" Chain:      {}", CallGraph.formatChain(level.callChain()));
            log.info(" Challenges: {}", level.challenges().size());
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
