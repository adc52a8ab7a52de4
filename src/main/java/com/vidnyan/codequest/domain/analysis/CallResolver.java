package com.vidnyan.codequest.domain.analysis;

import com.vidnyan.codequest.domain.graph.CallEdge;
import com.vidnyan.codequest.domain.model.CodeNode;
import com.vidnyan.codequest.domain.model.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves call sites to extracted entities by bare name.
 * <p>
 * A callee name resolves to the first entity with that name in extraction order
 * (files in path order, then declaration order). There is no scope or type
 * narrowing, so same-named entities in other classes or files are never chosen.
 * Unmatched names are dropped without an edge.
 */
@Slf4j
@Component
public class CallResolver {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Resolve calls and type dependencies across all extracted files.
     */
    public Resolution resolve(List<FileExtraction> files) {
        List<String> warnings = new ArrayList<>();
        List<ExtractedEntity> entities = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (FileExtraction file : files) {
            for (ExtractedEntity entity : file.entities()) {
                if (!seenIds.add(entity.id())) {
                    warnings.add("Duplicate entity id skipped: " + entity.id() + " in " + file.file());
                    continue;
                }
                entities.add(entity);
            }
        }

        Map<String, String> firstByName = new HashMap<>();
        Map<String, String> firstClassByName = new HashMap<>();
        for (ExtractedEntity entity : entities) {
            CodeNode node = entity.node();
            firstByName.putIfAbsent(node.getName(), node.getId());
            if (node.getKind() instanceof NodeKind.ClassKind) {
                firstClassByName.putIfAbsent(node.getName(), node.getId());
            }
        }

        Map<String, Set<String>> calls = new LinkedHashMap<>();
        Map<String, Set<String>> calledBy = new LinkedHashMap<>();
        List<CallEdge> edges = new ArrayList<>();
        int unresolved = 0;

        for (ExtractedEntity entity : entities) {
            String sourceId = entity.id();
            Set<String> targets = calls.computeIfAbsent(sourceId, k -> new LinkedHashSet<>());
            for (CallSite site : entity.callSites()) {
                String targetId = firstByName.get(site.calleeName());
                if (targetId == null) {
                    unresolved++;
                    continue;
                }
                if (targets.add(targetId)) {
                    calledBy.computeIfAbsent(targetId, k -> new LinkedHashSet<>()).add(sourceId);
                    edges.add(CallEdge.direct(sourceId, targetId, site.line()));
                }
            }
        }

        Map<String, CodeNode> nodes = new LinkedHashMap<>();
        for (ExtractedEntity entity : entities) {
            CodeNode node = entity.node();
            nodes.put(node.getId(), node.toBuilder()
                    .calls(calls.getOrDefault(node.getId(), Set.of()))
                    .calledBy(calledBy.getOrDefault(node.getId(), Set.of()))
                    .dependsOn(resolveDependencies(entity, firstClassByName))
                    .build()
                    .frozen());
        }

        log.debug("Resolved {} edges between {} nodes ({} call sites unresolved)",
                edges.size(), nodes.size(), unresolved);
        return new Resolution(nodes, edges, warnings);
    }

    private Set<String> resolveDependencies(ExtractedEntity entity, Map<String, String> firstClassByName) {
        Set<String> dependsOn = new LinkedHashSet<>();
        for (String typeText : entity.typeReferences()) {
            Matcher matcher = IDENTIFIER.matcher(typeText);
            while (matcher.find()) {
                String classId = firstClassByName.get(matcher.group());
                if (classId != null && !classId.equals(entity.id())) {
                    dependsOn.add(classId);
                }
            }
        }
        return dependsOn;
    }

    /**
     * Resolved nodes (in extraction order), edges and non-fatal warnings.
     */
    public record Resolution(
        Map<String, CodeNode> nodes,
        List<CallEdge> edges,
        List<String> warnings
    ) {}
}
