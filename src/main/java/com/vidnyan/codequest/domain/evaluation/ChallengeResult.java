package com.vidnyan.codequest.domain.evaluation;

import java.util.List;

/**
 * Outcome of grading one answer. Hints are only returned for answers that were not fully correct.
 */
public record ChallengeResult(
    String challengeId,
    boolean correct,
    int pointsEarned,
    int maxPoints,
    String feedback,
    List<String> hints
) {

    public ChallengeResult {
        hints = hints != null ? List.copyOf(hints) : List.of();
    }
}
