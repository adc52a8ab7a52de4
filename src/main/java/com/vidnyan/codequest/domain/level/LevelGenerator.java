package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.model.CodeNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a call graph into an ordered sequence of learning levels.
 * <p>
 * Steps per level: rank chains, classify difficulty, select challenge types,
 * synthesize challenges, assemble the level. Generation is deterministic for a
 * given graph.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LevelGenerator {

    public static final int DEFAULT_MAX_LEVELS = 10;
    public static final int DEFAULT_CHAIN_DEPTH = 5;
    static final int MAX_OBJECTIVES = 3;
    static final int MINUTES_PER_CHALLENGE = 3;

    private final ChainScorer chainScorer;
    private final DifficultyClassifier difficultyClassifier;
    private final ChallengeSynthesizer challengeSynthesizer;
    private final CodeSnippetExtractor snippetExtractor;

    public List<Level> generate(CallGraph graph) {
        return generate(graph, DEFAULT_MAX_LEVELS, DEFAULT_CHAIN_DEPTH);
    }

    public List<Level> generate(CallGraph graph, int maxLevels, int chainDepth) {
        List<ScoredChain> ranked = chainScorer.rank(graph, chainDepth);
        log.debug("Ranked {} candidate chains", ranked.size());

        List<Level> levels = new ArrayList<>();
        for (ScoredChain candidate : ranked.subList(0, Math.min(maxLevels, ranked.size()))) {
            List<String> chain = candidate.chain();
            Difficulty difficulty = difficultyClassifier.classify(graph, chain);

            List<Challenge> challenges = new ArrayList<>();
            for (ChallengeType type : challengeSynthesizer.selectTypes(graph, chain, difficulty)) {
                challenges.add(challengeSynthesizer.synthesize(type, graph, chain));
            }

            Level level = assemble(levels.size() + 1, graph, chain, difficulty, challenges);
            log.debug("{}: {} [{}] score={}", level.id(), CallGraph.formatChain(chain), difficulty,
                    String.format("%.1f", candidate.score()));
            levels.add(level);
        }
        return levels;
    }

    private Level assemble(int number, CallGraph graph, List<String> chain,
                           Difficulty difficulty, List<Challenge> challenges) {
        CodeNode entry = graph.getNodes().get(chain.get(0));
        List<String> names = ChallengeSynthesizer.namesOf(graph, chain);
        String start = names.get(0);
        String end = names.get(names.size() - 1);

        return new Level(
                "level_" + number,
                "Understanding " + entry.getName(),
                "Learn how " + start + " works and trace its execution to " + end,
                difficulty,
                entry.getId(),
                chain,
                snippetExtractor.extract(entry),
                challenges,
                objectives(graph, chain, start, end),
                difficulty.xpReward(),
                challenges.size() * MINUTES_PER_CHALLENGE,
                number > 1 ? List.of("level_" + (number - 1)) : List.of());
    }

    private List<String> objectives(CallGraph graph, List<String> chain, String start, String end) {
        List<String> objectives = new ArrayList<>();
        objectives.add("Trace execution from " + start + " to " + end);
        for (String id : chain.subList(0, Math.min(3, chain.size()))) {
            CodeNode node = graph.getNodes().get(id);
            if (node == null) {
                continue;
            }
            if (node.decorated()) {
                objectives.add("Understand " + node.getDecorators().get(0) + " pattern");
            }
            if (node.isAsync()) {
                objectives.add("Master async/await pattern");
            }
            if (node.isGenerator()) {
                objectives.add("Understand how " + node.getName() + " yields values lazily");
            }
        }
        return objectives.size() > MAX_OBJECTIVES ? objectives.subList(0, MAX_OBJECTIVES) : objectives;
    }
}
