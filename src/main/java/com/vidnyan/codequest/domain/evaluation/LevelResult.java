package com.vidnyan.codequest.domain.evaluation;

import java.util.List;

/**
 * Outcome of grading all challenges of a level.
 */
public record LevelResult(
    String levelId,
    boolean completed,
    int score,
    int maxScore,
    boolean perfect,
    List<ChallengeResult> challengeResults
) {

    public LevelResult {
        challengeResults = List.copyOf(challengeResults);
    }

    public double percentage() {
        return maxScore > 0 ? score * 100.0 / maxScore : 0;
    }
}
