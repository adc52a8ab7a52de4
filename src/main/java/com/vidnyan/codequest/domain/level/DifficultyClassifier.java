package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.model.CodeNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies a call chain into a difficulty tier.
 * The 0-100 score combines chain length (max 20), average complexity (max 30),
 * abstraction from decorators, async and generators (max 25) and type dependencies (max 25).
 */
@Component
public class DifficultyClassifier {

    public Difficulty classify(CallGraph graph, List<String> chain) {
        return Difficulty.fromScore(score(graph, chain));
    }

    public double score(CallGraph graph, List<String> chain) {
        double lengthScore = Math.min(20, chain.size() * 4);

        int present = 0;
        int complexity = 0;
        int abstraction = 0;
        int dependencies = 0;
        for (String id : chain) {
            CodeNode node = graph.getNodes().get(id);
            if (node == null) {
                continue;
            }
            present++;
            complexity += node.getComplexity();
            abstraction += node.getDecorators().size() * 3;
            if (node.isAsync()) {
                abstraction += 5;
            }
            if (node.isGenerator()) {
                abstraction += 5;
            }
            dependencies += node.getDependsOn().size();
        }

        double avgComplexity = present > 0 ? (double) complexity / present : 0;
        return lengthScore
                + Math.min(30, avgComplexity * 2)
                + Math.min(25, abstraction)
                + Math.min(25, dependencies * 2);
    }
}
