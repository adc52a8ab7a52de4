package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.model.CodeNode;
import com.vidnyan.codequest.domain.model.Language;
import com.vidnyan.codequest.domain.model.Parameter;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Picks challenge types for a chain and fills their templates.
 * Output is deterministic: option shuffling is seeded from the entry node id.
 */
@Component
public class ChallengeSynthesizer {

    static final int MAX_CHALLENGES = 5;
    static final int COMPLEX_CHAIN_THRESHOLD = 10;

    static final List<String> PURPOSE_DISTRACTORS = List.of(
            "Parses input", "Validates data", "Formats output");
    static final List<String> DESIGN_PATTERNS = List.of(
            "Decorator", "Facade", "Factory", "Observer", "Strategy");

    /**
     * Ordered selection rules, at most five types.
     */
    public List<ChallengeType> selectTypes(CallGraph graph, List<String> chain, Difficulty difficulty) {
        List<CodeNode> nodes = nodesOf(graph, chain);
        boolean decorated = nodes.stream().anyMatch(CodeNode::decorated);
        double avgComplexity = nodes.stream().mapToInt(CodeNode::getComplexity).sum() / (double) chain.size();

        List<ChallengeType> types = new ArrayList<>();
        types.add(ChallengeType.MULTIPLE_CHOICE);
        if (chain.size() >= 3) {
            types.add(ChallengeType.CODE_TRACING);
        }
        if (decorated || difficulty.atLeast(Difficulty.INTERMEDIATE)) {
            types.add(ChallengeType.FILL_BLANK);
        }
        if (difficulty.atLeast(Difficulty.INTERMEDIATE)) {
            types.add(ChallengeType.CODE_COMPLETION);
        }
        if (avgComplexity > COMPLEX_CHAIN_THRESHOLD) {
            types.add(ChallengeType.DEBUGGING);
        }
        if (difficulty.atLeast(Difficulty.ADVANCED)) {
            types.add(ChallengeType.ARCHITECTURE);
        }
        return types.size() > MAX_CHALLENGES ? types.subList(0, MAX_CHALLENGES) : types;
    }

    /**
     * Build one challenge of the given type for a chain whose entry node is in the graph.
     */
    public Challenge synthesize(ChallengeType type, CallGraph graph, List<String> chain) {
        CodeNode entry = graph.node(chain.get(0))
                .orElseThrow(() -> new IllegalArgumentException("Chain entry not in graph: " + chain.get(0)));
        return switch (type) {
            case MULTIPLE_CHOICE -> multipleChoice(entry);
            case CODE_TRACING -> codeTracing(graph, entry, chain);
            case FILL_BLANK -> fillBlank(entry);
            case CODE_COMPLETION -> codeCompletion(graph, entry, chain);
            case DEBUGGING -> debugging(graph, entry, chain);
            case ARCHITECTURE -> architecture(graph, entry, chain);
        };
    }

    private Challenge multipleChoice(CodeNode entry) {
        String prompt;
        String correct;
        List<String> distractors;
        if (entry.documented()) {
            prompt = "What does the function " + entry.getName() + "() do?";
            correct = firstSentence(entry.getDocstring());
            distractors = PURPOSE_DISTRACTORS;
        } else {
            int count = entry.getParameters().size();
            prompt = "How many parameters does " + entry.getName() + "() accept?";
            correct = String.valueOf(count);
            distractors = new ArrayList<>();
            for (int offset : new int[] {-1, 1, 2}) {
                if (count + offset >= 0) {
                    distractors.add(String.valueOf(count + offset));
                }
            }
        }

        List<String> options = new ArrayList<>();
        options.add(correct);
        options.addAll(distractors);
        Collections.shuffle(options, new Random(entry.getId().hashCode()));

        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", prompt);
        question.put("options", List.copyOf(options));
        return new Challenge(
                ChallengeType.MULTIPLE_CHOICE.challengeId(entry.getId()),
                ChallengeType.MULTIPLE_CHOICE,
                question,
                Map.of("correct", correct),
                List.of("Check the function signature at line " + entry.getLocation().startLine()),
                ChallengeType.MULTIPLE_CHOICE.points());
    }

    private Challenge codeTracing(CallGraph graph, CodeNode entry, List<String> chain) {
        List<String> names = namesOf(graph, chain);
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", "Trace the execution flow from " + names.get(0) + " to " + names.get(names.size() - 1));
        question.put("steps", chain.size());
        return new Challenge(
                ChallengeType.CODE_TRACING.challengeId(entry.getId()),
                ChallengeType.CODE_TRACING,
                question,
                Map.of("chain", names),
                List.of("Start with " + entry.getName()),
                ChallengeType.CODE_TRACING.points());
    }

    private Challenge fillBlank(CodeNode entry) {
        String template = entry.getLanguage() == Language.PYTHON
                ? "@____\ndef " + entry.getName() + "():"
                : "@____\n" + entry.getName() + "(...)";
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", "Complete the decorator for " + entry.getName());
        question.put("template", template);
        String fill = entry.decorated() ? entry.getDecorators().get(0) : "decorator";
        return new Challenge(
                ChallengeType.FILL_BLANK.challengeId(entry.getId()),
                ChallengeType.FILL_BLANK,
                question,
                Map.of("fill", fill),
                List.of("Check the decorators used in this function"),
                ChallengeType.FILL_BLANK.points());
    }

    private Challenge codeCompletion(CallGraph graph, CodeNode entry, List<String> chain) {
        List<String> callees = new ArrayList<>();
        for (String id : chain.subList(1, chain.size())) {
            if (entry.getCalls().contains(id)) {
                graph.node(id).ifPresent(n -> callees.add(n.getName()));
            }
        }
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", "Complete the implementation of " + entry.getName());
        question.put("template", signatureOf(entry));
        return new Challenge(
                ChallengeType.CODE_COMPLETION.challengeId(entry.getId()),
                ChallengeType.CODE_COMPLETION,
                question,
                Map.of("patterns", callees),
                List.of("Think about which functions " + entry.getName() + " delegates to"),
                ChallengeType.CODE_COMPLETION.points());
    }

    private Challenge debugging(CallGraph graph, CodeNode entry, List<String> chain) {
        List<String> names = namesOf(graph, chain);
        String terminal = names.get(names.size() - 1);
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", "The call chain below never reaches its last step. Fix the code so it does.");
        question.put("chain", CallGraph.formatChain(names));
        return new Challenge(
                ChallengeType.DEBUGGING.challengeId(entry.getId()),
                ChallengeType.DEBUGGING,
                question,
                Map.of("patterns", List.of(terminal)),
                List.of("Follow the chain down to " + terminal),
                ChallengeType.DEBUGGING.points());
    }

    private Challenge architecture(CallGraph graph, CodeNode entry, List<String> chain) {
        boolean decorated = nodesOf(graph, chain).stream().anyMatch(CodeNode::decorated);
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("prompt", "What design pattern is used here?");
        question.put("options", DESIGN_PATTERNS);
        return new Challenge(
                ChallengeType.ARCHITECTURE.challengeId(entry.getId()),
                ChallengeType.ARCHITECTURE,
                question,
                Map.of("pattern", decorated ? "Decorator" : "Facade"),
                List.of(decorated
                        ? "Look at how functions are wrapped"
                        : "Look at how " + entry.getName() + " hides the calls behind it"),
                ChallengeType.ARCHITECTURE.points());
    }

    static String firstSentence(String docstring) {
        int dot = docstring.indexOf('.');
        return (dot >= 0 ? docstring.substring(0, dot) : docstring).trim();
    }

    private static String signatureOf(CodeNode node) {
        String params = node.getParameters().stream()
                .map(Parameter::name)
                .collect(Collectors.joining(", "));
        if (node.getLanguage() == Language.PYTHON) {
            return "def " + node.getName() + "(" + params + "):\n    ...";
        }
        String returnType = node.getReturnType() != null ? node.getReturnType() : "void";
        return returnType + " " + node.getName() + "(" + params + ") {\n    ...\n}";
    }

    private static List<CodeNode> nodesOf(CallGraph graph, List<String> chain) {
        List<CodeNode> nodes = new ArrayList<>();
        for (String id : chain) {
            graph.node(id).ifPresent(nodes::add);
        }
        return nodes;
    }

    static List<String> namesOf(CallGraph graph, List<String> chain) {
        return chain.stream()
                .map(id -> graph.node(id).map(CodeNode::getName).orElse(nameFromId(id)))
                .toList();
    }

    private static String nameFromId(String id) {
        int sep = id.lastIndexOf(CodeNode.ID_SEPARATOR);
        return sep >= 0 ? id.substring(sep + CodeNode.ID_SEPARATOR.length()) : id;
    }
}
