package com.vidnyan.codequest.adapter.out.export;

import com.vidnyan.codequest.config.CodeQuestConfiguration;
import com.vidnyan.codequest.domain.analysis.AnalysisResult;
import com.vidnyan.codequest.domain.graph.CallEdge;
import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.level.ChainScorer;
import com.vidnyan.codequest.domain.level.ChallengeSynthesizer;
import com.vidnyan.codequest.domain.level.CodeSnippetExtractor;
import com.vidnyan.codequest.domain.level.DifficultyClassifier;
import com.vidnyan.codequest.domain.level.Level;
import com.vidnyan.codequest.domain.level.LevelGenerator;
import com.vidnyan.codequest.domain.model.CodeNode;
import com.vidnyan.codequest.domain.model.Language;
import com.vidnyan.codequest.domain.model.NodeKind;
import com.vidnyan.codequest.domain.model.Parameter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static com.vidnyan.codequest.domain.GraphFixtures.function;
import static com.vidnyan.codequest.domain.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

class GraphCodecTest {

    private GraphCodec codec;
    private CallGraph graph;

    @BeforeEach
    void setUp() {
        codec = new GraphCodec(new CodeQuestConfiguration().objectMapper());
        graph = graph()
                .node(function("main").decorators(List.of("click.command()")).docstring("Entry."))
                .node(function("load").parameters(List.of(new Parameter("path", "str", "None"))).async(true))
                .node(function("Store").kind(new NodeKind.ClassKind(2)))
                .node(function("save").kind(new NodeKind.Method("Store")).generator(true))
                .call("main", "load").call("load", "save").call("main", "Store")
                .entry("main")
                .build();
    }

    @Test
    void graphRoundTrip_ShouldPreserveMembershipAndMetrics() {
        // Act
        Map<String, Object> map = codec.toMap(graph);
        CallGraph decoded = codec.graphFromMap(map);

        // Assert
        assertEquals(graph.getNodes().keySet(), decoded.getNodes().keySet());
        assertEquals(new HashSet<>(graph.getEdges()), new HashSet<>(decoded.getEdges()));
        assertEquals(graph.getEntryPoints(), decoded.getEntryPoints());
        assertEquals(graph.stats(), decoded.stats());
    }

    @Test
    void graphRoundTrip_ShouldPreserveNodeData() {
        CallGraph decoded = codec.graphFromMap(codec.toMap(graph));

        for (CodeNode original : graph.getNodes().values()) {
            CodeNode copy = decoded.node(original.getId()).orElseThrow();
            assertEquals(original.getKind(), copy.getKind());
            assertEquals(original.getLocation(), copy.getLocation());
            assertEquals(original.getParameters(), copy.getParameters());
            assertEquals(original.getDecorators(), copy.getDecorators());
            assertEquals(original.getDocstring(), copy.getDocstring());
            assertEquals(original.isAsync(), copy.isAsync());
            assertEquals(original.isGenerator(), copy.isGenerator());
            assertEquals(new HashSet<>(original.getCalls()), new HashSet<>(copy.getCalls()));
            assertEquals(new HashSet<>(original.getCalledBy()), new HashSet<>(copy.getCalledBy()));
        }
    }

    @Test
    void toMap_ShouldUsePlainValues() {
        Map<String, Object> map = codec.toMap(graph);

        assertEquals(4, map.get("totalNodes"));
        assertInstanceOf(Map.class, map.get("nodes"));
        assertInstanceOf(List.class, map.get("edges"));
        @SuppressWarnings("unchecked")
        Map<String, Object> edge = (Map<String, Object>) ((List<?>) map.get("edges")).get(0);
        assertEquals("DIRECT", edge.get("callType"));
    }

    @Test
    void levelRoundTrip_ShouldBeLossless() {
        Level level = generator().generate(graph).get(0);

        Level decoded = codec.levelFromMap(codec.toMap(level));

        assertEquals(level, decoded);
    }

    @Test
    void resultRoundTrip_ShouldPreserveRunMetadata() {
        // Arrange
        List<Level> levels = generator().generate(graph);
        AnalysisResult result = new AnalysisResult("demo", Language.PYTHON, graph, levels,
                Instant.parse("2024-05-01T10:15:30Z"), 42, 3, 120, true, List.of(), List.of("skipped x.py"));

        // Act
        AnalysisResult decoded = codec.resultFromMap(codec.toMap(result));

        // Assert
        assertEquals(result.projectId(), decoded.projectId());
        assertEquals(result.language(), decoded.language());
        assertEquals(result.analyzedAt(), decoded.analyzedAt());
        assertEquals(result.levels(), decoded.levels());
        assertEquals(result.warnings(), decoded.warnings());
        assertEquals(result.linesOfCode(), decoded.linesOfCode());
        assertEquals(result.callGraph().stats(), decoded.callGraph().stats());
    }

    @Test
    void graphFromMap_ShouldRecomputeMetrics() {
        Map<String, Object> map = codec.toMap(graph);
        map.put("totalNodes", 99);
        map.put("maxDepth", 99);

        CallGraph decoded = codec.graphFromMap(map);

        assertEquals(4, decoded.getTotalNodes());
        assertEquals(graph.getMaxDepth(), decoded.getMaxDepth());
    }

    @Test
    void graphFromMap_ShouldKeepDanglingEdgesDetectable() {
        CodeNode lonely = function("lonely").build();
        CallGraph broken = CallGraph.of(Map.of(lonely.getId(), lonely),
                List.of(CallEdge.direct(lonely.getId(), "app.py::ghost", 2)), List.of());

        CallGraph decoded = codec.graphFromMap(codec.toMap(broken));

        assertFalse(decoded.structuralProblems().isEmpty());
    }

    private static LevelGenerator generator() {
        return new LevelGenerator(new ChainScorer(), new DifficultyClassifier(),
                new ChallengeSynthesizer(), new CodeSnippetExtractor());
    }
}
