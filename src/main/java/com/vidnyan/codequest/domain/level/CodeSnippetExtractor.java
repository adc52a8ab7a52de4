package com.vidnyan.codequest.domain.level;

import com.vidnyan.codequest.domain.model.CodeNode;
import com.vidnyan.codequest.domain.model.Language;
import com.vidnyan.codequest.domain.model.Location;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the source lines of a node back from disk for display in a level.
 */
@Slf4j
@Component
public class CodeSnippetExtractor {

    public static final int MAX_SNIPPET_LINES = 40;

    public String extract(CodeNode node) {
        Location location = node.getLocation();
        try {
            List<String> lines = Files.readAllLines(Path.of(location.filePath()), StandardCharsets.UTF_8);
            int from = Math.max(0, location.startLine() - 1);
            int to = Math.min(lines.size(), Math.min(location.endLine(), location.startLine() - 1 + MAX_SNIPPET_LINES));
            if (from >= to) {
                return placeholder(node);
            }
            return String.join("\n", lines.subList(from, to));
        } catch (IOException | RuntimeException e) {
            log.debug("Could not read snippet for {}: {}", node.getId(), e.getMessage());
            return placeholder(node);
        }
    }

    private static String placeholder(CodeNode node) {
        String comment = node.getLanguage() == Language.PYTHON ? "#" : "//";
        return comment + " Source not available for " + node.getId();
    }
}
