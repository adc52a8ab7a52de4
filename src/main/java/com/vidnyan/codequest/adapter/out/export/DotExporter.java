package com.vidnyan.codequest.adapter.out.export;

import com.vidnyan.codequest.domain.graph.CallEdge;
import com.vidnyan.codequest.domain.graph.CallGraph;
import com.vidnyan.codequest.domain.model.CodeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Graphviz DOT rendering of a call graph, for debugging only.
 * Entry points are filled green; direct calls are solid edges, other call types dashed.
 */
@Slf4j
@Component
public class DotExporter {

    public String export(CallGraph graph) {
        Set<String> entryPoints = new HashSet<>(graph.getEntryPoints());
        StringBuilder dot = new StringBuilder();
        dot.append("digraph CallGraph {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, fontname=\"Helvetica\"];\n");

        for (CodeNode node : graph.getNodes().values()) {
            dot.append("  ").append(quote(node.getId()))
                    .append(" [label=").append(quote(node.getName() + "\\n" + node.getKind().label()));
            if (entryPoints.contains(node.getId())) {
                dot.append(", style=filled, fillcolor=lightgreen");
            }
            dot.append("];\n");
        }

        for (CallEdge edge : graph.getEdges()) {
            dot.append("  ").append(quote(edge.source())).append(" -> ").append(quote(edge.target()));
            if (edge.callType() != CallEdge.CallType.DIRECT) {
                dot.append(" [style=dashed]");
            }
            dot.append(";\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    public void write(CallGraph graph, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, export(graph), StandardCharsets.UTF_8);
        log.info("Wrote call graph DOT to {}", file);
    }

    private static String quote(String text) {
        return "\"" + text.replace("\"", "\\\"") + "\"";
    }
}
