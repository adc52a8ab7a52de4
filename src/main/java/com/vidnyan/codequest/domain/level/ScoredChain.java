package com.vidnyan.codequest.domain.level;

import java.util.List;

/**
 * Candidate call chain with its importance score.
 */
public record ScoredChain(List<String> chain, double score) {

    public ScoredChain {
        chain = List.copyOf(chain);
    }

    public String entryId() {
        return chain.get(0);
    }

    public String terminalId() {
        return chain.get(chain.size() - 1);
    }
}
