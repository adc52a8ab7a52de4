package com.vidnyan.codequest.domain.level;

import java.util.List;

/**
 * A generated learning level built around one call chain.
 */
public record Level(
    String id,
    String name,
    String description,
    Difficulty difficulty,
    String entryNodeId,
    List<String> callChain,
    String codeSnippet,
    List<Challenge> challenges,
    List<String> objectives,
    int xpReward,
    int estimatedTime,
    List<String> prerequisites
) {

    public Level {
        callChain = List.copyOf(callChain);
        challenges = List.copyOf(challenges);
        objectives = List.copyOf(objectives);
        prerequisites = prerequisites != null ? List.copyOf(prerequisites) : List.of();
    }

    public int maxScore() {
        return challenges.stream().mapToInt(Challenge::points).sum();
    }

    /**
     * Copy safe to hand to a learner: every challenge is redacted.
     */
    public Level learnerView() {
        return new Level(id, name, description, difficulty, entryNodeId, callChain, codeSnippet,
                challenges.stream().map(Challenge::redacted).toList(),
                objectives, xpReward, estimatedTime, prerequisites);
    }
}
