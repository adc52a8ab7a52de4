package com.vidnyan.codequest.domain.analysis;

import com.vidnyan.codequest.domain.model.CodeNode;

import java.util.List;

/**
 * Output of the node extractor for one entity, before resolution.
 *
 * @param node           the extracted node, relationship sets still empty
 * @param callSites      call expressions in source order
 * @param typeReferences type text referenced by the signature (bases, parameter and return types)
 */
public record ExtractedEntity(
    CodeNode node,
    List<CallSite> callSites,
    List<String> typeReferences
) {

    public ExtractedEntity {
        callSites = List.copyOf(callSites);
        typeReferences = List.copyOf(typeReferences);
    }

    public String id() {
        return node.getId();
    }
}
