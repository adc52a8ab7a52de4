package com.vidnyan.codequest.domain.graph;

/**
 * Represents an edge in the call graph.
 * Immutable value object.
 */
public record CallEdge(
    String source,
    String target,
    CallType callType,
    Integer line
) {

    /**
     * Types of call relationships.
     * The name-only resolver only produces {@link #DIRECT}.
     */
    public enum CallType {
        DIRECT,
        INDIRECT,
        POLYMORPHIC
    }

    public static CallEdge direct(String source, String target, Integer line) {
        return new CallEdge(source, target, CallType.DIRECT, line);
    }
}
