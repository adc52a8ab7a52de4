package com.vidnyan.codequest.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Language-agnostic representation of a function, method or class.
 * Immutable value object - resolution produces enriched copies via {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeNode {

    public static final String ID_SEPARATOR = "::";

    String id;
    String name;
    NodeKind kind;
    Language language;
    Location location;

    @Builder.Default
    List<Parameter> parameters = List.of();
    String returnType;
    @Builder.Default
    List<String> decorators = List.of();
    String docstring;

    boolean exported;
    boolean async;
    boolean generator;

    @Builder.Default
    int complexity = 1;
    int loc;

    // Relationships (ids), filled by the call resolver
    @Builder.Default
    Set<String> calls = Set.of();
    @Builder.Default
    Set<String> calledBy = Set.of();
    @Builder.Default
    Set<String> dependsOn = Set.of();

    /**
     * Build the id of an entity: file basename plus qualified name.
     */
    public static String idOf(String fileName, String qualifiedName) {
        return fileName + ID_SEPARATOR + qualifiedName;
    }

    public boolean decorated() {
        return !decorators.isEmpty();
    }

    public boolean documented() {
        return docstring != null && !docstring.isBlank();
    }

    /**
     * Copy with unmodifiable, order-preserving collections.
     */
    public CodeNode frozen() {
        return toBuilder()
                .parameters(List.copyOf(parameters))
                .decorators(List.copyOf(decorators))
                .calls(Collections.unmodifiableSet(new LinkedHashSet<>(calls)))
                .calledBy(Collections.unmodifiableSet(new LinkedHashSet<>(calledBy)))
                .dependsOn(Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn)))
                .build();
    }
}
