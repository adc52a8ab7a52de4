package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.model.CodeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks call chains by how worthwhile they are to teach.
 * <p>
 * Importance is the sum of four parts:
 * <ul>
 *   <li>proximity: 40 * 0.7^i for each position i in the chain</li>
 *   <li>frequency: average fan-in times 5, capped at 30</li>
 *   <li>complexity: average complexity, capped at 20</li>
 *   <li>documentation: documented share of the chain times 10</li>
 * </ul>
 */
@Slf4j
@Component
public class ChainScorer {

    static final int MIN_CHAIN_LENGTH = 2;
    static final int FALLBACK_NODE_COUNT = 5;

    /**
     * Collect candidate chains from all entry points and rank them, best first.
     * Falls back to the most called nodes when no entry point yields a candidate.
     * Ties keep discovery order.
     */
    public List<ScoredChain> rank(CallGraph graph, int chainDepth) {
        List<ScoredChain> candidates = new ArrayList<>();
        for (String entryId : graph.getEntryPoints()) {
            collect(graph, entryId, chainDepth, candidates);
        }

        if (candidates.isEmpty()) {
            List<CodeNode> byFanIn = new ArrayList<>(graph.getNodes().values());
            byFanIn.sort(Comparator.comparingInt((CodeNode n) -> n.getCalledBy().size()).reversed());
            List<CodeNode> roots = byFanIn.subList(0, Math.min(FALLBACK_NODE_COUNT, byFanIn.size()));
            log.debug("No entry point chains, falling back to {} most called nodes", roots.size());
            for (CodeNode root : roots) {
                collect(graph, root.getId(), chainDepth, candidates);
            }
        }

        candidates.sort(Comparator.comparingDouble(ScoredChain::score).reversed());
        return candidates;
    }

    private void collect(CallGraph graph, String rootId, int chainDepth, List<ScoredChain> candidates) {
        for (List<String> chain : graph.chains(rootId, chainDepth)) {
            if (chain.size() >= MIN_CHAIN_LENGTH) {
                candidates.add(new ScoredChain(chain, importance(graph, chain)));
            }
        }
    }

    public double importance(CallGraph graph, List<String> chain) {
        if (chain.isEmpty()) {
            return 0;
        }
        double proximity = 0;
        for (int i = 0; i < chain.size(); i++) {
            proximity += 40 * Math.pow(0.7, i);
        }

        int calledBy = 0;
        int complexity = 0;
        int documented = 0;
        for (String id : chain) {
            CodeNode node = graph.getNodes().get(id);
            if (node == null) {
                continue;
            }
            calledBy += node.getCalledBy().size();
            complexity += node.getComplexity();
            if (node.documented()) {
                documented++;
            }
        }

        double length = chain.size();
        double frequency = Math.min(30, calledBy / length * 5);
        double complexityScore = Math.min(20, complexity / length);
        double docs = documented / length * 10;
        return proximity + frequency + complexityScore + docs;
    }
}
