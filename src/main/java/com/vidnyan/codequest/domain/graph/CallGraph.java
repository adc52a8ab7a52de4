package com.vidnyan.codequest.domain.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.codequest.domain.model.CodeNode;

import java.util.*;

/**
 * Call graph of one analysis run: nodes, resolved edges and entry points.
 * Metrics are computed once at construction and never recomputed.
 * Immutable; the graph owns frozen copies of its nodes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CallGraph {

    /**
     * Path depth bound used for the graph-wide depth metric.
     */
    public static final int DEPTH_BOUND = 100;

    private final Map<String, CodeNode> nodes;
    private final List<CallEdge> edges;
    private final List<String> entryPoints;

    private final int totalNodes;
    private final int totalEdges;
    private final int maxDepth;

    private CallGraph(Map<String, CodeNode> nodes, List<CallEdge> edges, List<String> entryPoints) {
        Map<String, CodeNode> owned = new LinkedHashMap<>();
        nodes.forEach((id, node) -> owned.put(id, node.frozen()));
        this.nodes = Collections.unmodifiableMap(owned);
        this.edges = List.copyOf(edges);
        this.entryPoints = List.copyOf(entryPoints);

        this.totalNodes = this.nodes.size();
        this.totalEdges = this.edges.size();
        this.maxDepth = computeMaxDepth();
    }

    /**
     * Build a call graph. Node iteration order is preserved.
     */
    @JsonCreator
    public static CallGraph of(
            @JsonProperty("nodes") Map<String, CodeNode> nodes,
            @JsonProperty("edges") List<CallEdge> edges,
            @JsonProperty("entryPoints") List<String> entryPoints
    ) {
        return new CallGraph(
                nodes != null ? nodes : Map.of(),
                edges != null ? edges : List.of(),
                entryPoints != null ? entryPoints : List.of());
    }

    public Map<String, CodeNode> getNodes() {
        return nodes;
    }

    public List<CallEdge> getEdges() {
        return edges;
    }

    public List<String> getEntryPoints() {
        return entryPoints;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public int getTotalEdges() {
        return totalEdges;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public Optional<CodeNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * Enumerate call chains starting at a node.
     * <p>
     * A path is recorded when its last node is a leaf or when it sits at depth
     * {@code maxDepth} and still has calls. A path whose callees are all already on
     * it closes a cycle and is dropped. A node never repeats within one path but may
     * appear again on a sibling branch. Chains come out in depth-first discovery
     * order and are not deduplicated.
     */
    public List<List<String>> chains(String entryId, int maxDepth) {
        List<List<String>> chains = new ArrayList<>();
        if (!nodes.containsKey(entryId)) {
            return chains;
        }

        Deque<List<String>> frontier = new ArrayDeque<>();
        frontier.push(List.of(entryId));

        while (!frontier.isEmpty()) {
            List<String> path = frontier.pop();
            CodeNode current = nodes.get(path.get(path.size() - 1));

            if (current.getCalls().isEmpty() || path.size() > maxDepth) {
                chains.add(path);
                continue;
            }
            List<String> next = extensions(current, path);
            // Reverse push keeps callee order on pop
            for (int i = next.size() - 1; i >= 0; i--) {
                frontier.push(append(path, next.get(i)));
            }
        }
        return chains;
    }

    /**
     * Check structural invariants: every edge endpoint must be a known node.
     *
     * @return human readable problems, empty when the graph is well-formed
     */
    public List<String> structuralProblems() {
        List<String> problems = new ArrayList<>();
        for (CallEdge edge : edges) {
            if (!nodes.containsKey(edge.source())) {
                problems.add("Edge source not in nodes: " + edge.source());
            }
            if (!nodes.containsKey(edge.target())) {
                problems.add("Edge target not in nodes: " + edge.target());
            }
        }
        return problems;
    }

    /**
     * Format a call chain as a readable string.
     */
    public static String formatChain(List<String> chain) {
        return String.join(" → ", chain);
    }

    private int computeMaxDepth() {
        int deepest = 0;
        for (String entryId : entryPoints) {
            deepest = Math.max(deepest, depthFrom(entryId));
        }
        return deepest;
    }

    private int depthFrom(String entryId) {
        if (!nodes.containsKey(entryId)) {
            return 0;
        }
        int deepest = 0;
        Deque<List<String>> frontier = new ArrayDeque<>();
        frontier.push(List.of(entryId));

        while (!frontier.isEmpty()) {
            List<String> path = frontier.pop();
            int depth = path.size() - 1;
            deepest = Math.max(deepest, depth);
            if (depth >= DEPTH_BOUND) {
                continue;
            }
            CodeNode current = nodes.get(path.get(path.size() - 1));
            for (String callee : extensions(current, path)) {
                frontier.push(append(path, callee));
            }
        }
        return deepest;
    }

    private List<String> extensions(CodeNode current, List<String> path) {
        List<String> next = new ArrayList<>();
        for (String callee : current.getCalls()) {
            if (nodes.containsKey(callee) && !path.contains(callee)) {
                next.add(callee);
            }
        }
        return next;
    }

    private static List<String> append(List<String> path, String id) {
        List<String> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(id);
        return Collections.unmodifiableList(extended);
    }

    public Stats stats() {
        return new Stats(totalNodes, totalEdges, entryPoints.size(), maxDepth);
    }

    public record Stats(int nodeCount, int edgeCount, int entryPointCount, int maxDepth) {}
}
