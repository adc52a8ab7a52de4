package com.vidnyan.codequest.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codequest.adapter.out.export.DotExporter;
import com.vidnyan.codequest.adapter.out.export.JsonResultWriter;
import com.vidnyan.codequest.adapter.out.parser.SourceParserFactory;
import com.vidnyan.codequest.application.service.AnalysisApplicationService;
import com.vidnyan.codequest.config.AnalysisProperties;
import com.vidnyan.codequest.config.CodeQuestConfiguration;
import com.vidnyan.codequest.domain.analysis.CallResolver;
import com.vidnyan.codequest.domain.analysis.EntryPointIdentifier;
import com.vidnyan.codequest.domain.level.ChainScorer;
import com.vidnyan.codequest.domain.level.ChallengeSynthesizer;
import com.vidnyan.codequest.domain.level.CodeSnippetExtractor;
import com.vidnyan.codequest.domain.level.DifficultyClassifier;
import com.vidnyan.codequest.domain.level.LevelGenerator;
import com.vidnyan.codequest.scanner.RepositoryScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.ExitCodeEvent;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AnalysisCliRunnerTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private AnalysisProperties properties;
    private ConfigurableApplicationContext context;
    private AnalysisCliRunner runner;

    @BeforeEach
    void setUp() {
        objectMapper = new CodeQuestConfiguration().objectMapper();
        properties = new AnalysisProperties();
        context = mock(ConfigurableApplicationContext.class);
        AnalysisApplicationService service = new AnalysisApplicationService(
                new SourceParserFactory(),
                new RepositoryScanner(),
                new CallResolver(),
                new EntryPointIdentifier(),
                new LevelGenerator(new ChainScorer(), new DifficultyClassifier(),
                        new ChallengeSynthesizer(), new CodeSnippetExtractor()));
        runner = new AnalysisCliRunner(service, properties, new JsonResultWriter(objectMapper),
                new DotExporter(), context);
    }

    @Test
    void run_WithoutPathShouldDoNothing() throws Exception {
        runner.run();

        verify(context, never()).close();
    }

    @Test
    void run_DisabledShouldDoNothing() throws Exception {
        properties.setEnabled(false);
        ReflectionTestUtils.setField(runner, "sourcePath", tempDir.toString());

        runner.run();

        verify(context, never()).close();
    }

    @Test
    void run_ShouldWriteExportsAndExit() throws Exception {
        // Arrange
        Path project = tempDir.resolve("project");
        Files.createDirectories(project);
        Files.writeString(project.resolve("main.py"), "def main():\n    work()\n\n\ndef work():\n    pass\n");
        Path json = tempDir.resolve("out/result.json");
        Path dot = tempDir.resolve("out/graph.dot");
        properties.setOutputFile(json.toString());
        properties.setDotFile(dot.toString());
        properties.setLearnerView(true);
        ReflectionTestUtils.setField(runner, "sourcePath", project.toString());

        // Act
        runner.run();

        // Assert
        assertTrue(Files.exists(json));
        assertTrue(Files.readString(dot).startsWith("digraph CallGraph {"));
        assertTrue(objectMapper.readTree(json.toFile())
                .get("levels").get(0).get("challenges").get(0).get("answer").isEmpty());
        verify(context).close();
        verify(context, never()).publishEvent(any(ExitCodeEvent.class));
    }

    @Test
    void run_FailedAnalysisShouldExitWithErrorCode() throws Exception {
        Files.writeString(tempDir.resolve("lib.py"), "def helper():\n    pass\n");
        ReflectionTestUtils.setField(runner, "sourcePath", tempDir.toString());

        runner.run();

        verify(context).publishEvent(any(ExitCodeEvent.class));
        verify(context).close();
    }
}
