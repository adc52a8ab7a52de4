package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.graph.CallGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.codequest.domain.GraphFixtures.function;
import static com.vidnyan.codequest.domain.GraphFixtures.graph;
import static com.vidnyan.codequest.domain.GraphFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class LevelGeneratorTest {

    private LevelGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new LevelGenerator(
                new ChainScorer(), new DifficultyClassifier(), new ChallengeSynthesizer(), new CodeSnippetExtractor());
    }

    @Test
    void generate_ShouldBuildLevelsInRankOrder() {
        // Arrange
        CallGraph graph = graph()
                .nodes("main", "load", "parse", "report")
                .call("main", "load").call("load", "parse").call("main", "report")
                .entry("main")
                .build();

        // Act
        List<Level> levels = generator.generate(graph);

        // Assert
        assertEquals(2, levels.size());
        Level first = levels.get(0);
        assertEquals("level_1", first.id());
        assertEquals("Understanding main", first.name());
        assertEquals("Learn how main works and trace its execution to parse", first.description());
        assertEquals(List.of(id("main"), id("load"), id("parse")), first.callChain());
        assertEquals(id("main"), first.entryNodeId());
        assertTrue(first.prerequisites().isEmpty());

        Level second = levels.get(1);
        assertEquals("level_2", second.id());
        assertEquals(List.of("level_1"), second.prerequisites());
        assertEquals(List.of(id("main"), id("report")), second.callChain());
    }

    @Test
    void generate_ShouldDeriveRewardsAndTimeFromChallenges() {
        CallGraph graph = graph()
                .nodes("main", "load", "parse")
                .call("main", "load").call("load", "parse")
                .entry("main")
                .build();

        Level level = generator.generate(graph).get(0);

        assertEquals(Difficulty.TUTORIAL, level.difficulty());
        assertEquals(50, level.xpReward());
        assertEquals(List.of(ChallengeType.MULTIPLE_CHOICE, ChallengeType.CODE_TRACING),
                level.challenges().stream().map(Challenge::type).toList());
        assertEquals(6, level.estimatedTime());
        assertEquals(25, level.maxScore());
        assertEquals(List.of("Trace execution from main to parse"), level.objectives());
    }

    @Test
    void generate_ShouldCapObjectivesAtThree() {
        CallGraph graph = graph()
                .node(function("main").decorators(List.of("click.command()")).async(true))
                .node(function("stream").generator(true))
                .call("main", "stream")
                .entry("main")
                .build();

        Level level = generator.generate(graph).get(0);

        assertEquals(List.of(
                "Trace execution from main to stream",
                "Understand click.command() pattern",
                "Master async/await pattern"), level.objectives());
    }

    @Test
    void generate_ShouldRespectMaxLevels() {
        CallGraph graph = graph()
                .nodes("main", "a", "b", "c")
                .call("main", "a").call("main", "b").call("main", "c")
                .entry("main")
                .build();

        assertEquals(3, generator.generate(graph).size());
        assertEquals(2, generator.generate(graph, 2, 5).size());
    }

    @Test
    void generate_ShouldBeDeterministic() {
        CallGraph graph = graph()
                .node(function("main").docstring("Entry point. Starts everything."))
                .nodes("a", "b")
                .call("main", "a").call("a", "b")
                .entry("main")
                .build();

        assertEquals(generator.generate(graph), generator.generate(graph));
    }

    @Test
    void generate_GraphWithoutChainsShouldYieldNoLevels() {
        CallGraph graph = graph().nodes("main").entry("main").build();

        assertTrue(generator.generate(graph).isEmpty());
    }

    @Test
    void learnerView_ShouldRedactEveryChallenge() {
        CallGraph graph = graph()
                .nodes("main", "a", "b")
                .call("main", "a").call("a", "b")
                .entry("main")
                .build();
        Level level = generator.generate(graph).get(0);

        Level view = level.learnerView();

        assertTrue(view.challenges().stream().allMatch(c -> c.answer().isEmpty()));
        assertFalse(level.challenges().stream().allMatch(c -> c.answer().isEmpty()));
        assertEquals(level.maxScore(), view.maxScore());
    }
}
