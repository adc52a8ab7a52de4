package com.vidnyan.codequest.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind of an extracted code entity.
 * Each variant carries only the fields that belong to it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = NodeKind.Function.class, name = "function"),
    @JsonSubTypes.Type(value = NodeKind.Method.class, name = "method"),
    @JsonSubTypes.Type(value = NodeKind.ClassKind.class, name = "class")
})
public sealed interface NodeKind permits NodeKind.Function, NodeKind.Method, NodeKind.ClassKind {

    /**
     * Short label used in ids, reports and DOT output.
     */
    String label();

    /**
     * Top-level function.
     */
    record Function() implements NodeKind {
        @Override
        public String label() {
            return "function";
        }
    }

    /**
     * Function declared directly inside a class body.
     */
    record Method(String className) implements NodeKind {
        @Override
        public String label() {
            return "method";
        }
    }

    /**
     * Class, with the number of methods declared directly in its body.
     */
    record ClassKind(int methodCount) implements NodeKind {
        @Override
        public String label() {
            return "class";
        }
    }
}
