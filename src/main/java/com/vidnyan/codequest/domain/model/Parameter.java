package com.vidnyan.codequest.domain.model;

/**
 * Function or method parameter.
 * Type and default are kept as unparsed source text and may be null.
 */
public record Parameter(
    String name,
    String typeText,
    String defaultText
) {

    public static Parameter named(String name) {
        return new Parameter(name, null, null);
    }
}
