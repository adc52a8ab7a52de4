package com.vidnyan.codequest.domain.level;

/**
 * Kinds of challenge a level can carry, with id prefix and point value.
 */
public enum ChallengeType {
    MULTIPLE_CHOICE("mc", 10),
    CODE_TRACING("trace", 15),
    FILL_BLANK("fill", 12),
    CODE_COMPLETION("complete", 20),
    DEBUGGING("debug", 15),
    ARCHITECTURE("arch", 15);

    private final String prefix;
    private final int points;

    ChallengeType(String prefix, int points) {
        this.prefix = prefix;
        this.points = points;
    }

    public String prefix() {
        return prefix;
    }

    public int points() {
        return points;
    }

    public String challengeId(String entryId) {
        return prefix + "_" + entryId;
    }
}
