package com.vidnyan.codequest.domain.analysis;

import com.vidnyan.codequest.domain.model.CodeNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Flags root-of-execution nodes by name and decorator text.
 * Matching is plain case-insensitive substring search, so it is broad:
 * a decorator mentioning "target" counts because it contains "get".
 */
@Component
public class EntryPointIdentifier {

    public static final String ROOT_NAME = "main";

    static final List<String> DECORATOR_KEYWORDS = List.of(
            "route", "command", "get", "post", "put", "delete");

    /**
     * Return ids of entry-point nodes in node order, each at most once.
     */
    public List<String> identify(Collection<CodeNode> nodes) {
        List<String> entryPoints = new ArrayList<>();
        for (CodeNode node : nodes) {
            if (isEntryPoint(node)) {
                entryPoints.add(node.getId());
            }
        }
        return entryPoints;
    }

    public boolean isEntryPoint(CodeNode node) {
        if (ROOT_NAME.equals(node.getName())) {
            return true;
        }
        for (String decorator : node.getDecorators()) {
            String text = decorator.toLowerCase(Locale.ROOT);
            if (DECORATOR_KEYWORDS.stream().anyMatch(text::contains)) {
                return true;
            }
        }
        return false;
    }
}
