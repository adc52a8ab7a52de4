package com.vidnyan.codequest.adapter.out.parser.python;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A tree-sitter parse of one Python source text.
 * Node text is read back from the source through the parser's byte offsets.
 */
final class PythonSyntaxTree {

    /**
     * Python 2 statements the grammar still accepts.
     */
    private static final Set<String> LEGACY_STATEMENTS = Set.of("print_statement", "exec_statement");

    private final String source;
    private final TSTree tree;
    private final int[] byteOffsets;

    private PythonSyntaxTree(String source, TSTree tree) {
        this.source = source;
        this.tree = tree;
        this.byteOffsets = byteOffsets(source);
    }

    static PythonSyntaxTree parse(String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return new PythonSyntaxTree(source, parser.parseString(null, source));
    }

    TSNode root() {
        return tree.getRootNode();
    }

    String text(TSNode node) {
        return source.substring(charIndex(node.getStartByte()), charIndex(node.getEndByte()));
    }

    /**
     * First syntax error in the tree: an error node, a node the parser had to invent,
     * or a Python 2 statement.
     */
    Optional<String> firstError() {
        if (!root().hasError()) {
            Optional<TSNode> legacy = find(root(), node -> LEGACY_STATEMENTS.contains(node.getType()));
            return legacy.map(node -> "Python 2 " + node.getType().replace('_', ' ') + " (line " + startLine(node) + ")");
        }
        Optional<TSNode> broken = find(root(), node -> node.isMissing() || "ERROR".equals(node.getType()));
        return Optional.of(broken
                .map(node -> (node.isMissing() ? "missing " + node.getType() : "invalid syntax")
                        + " (line " + startLine(node) + ")")
                .orElse("invalid syntax"));
    }

    static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Last line holding text of the node; an end point at column 0 belongs to the previous line.
     */
    static int endLine(TSNode node) {
        int row = node.getEndPoint().getRow();
        if (node.getEndPoint().getColumn() == 0 && row > node.getStartPoint().getRow()) {
            return row;
        }
        return row + 1;
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    static Optional<TSNode> field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return present(child) ? Optional.of(child) : Optional.empty();
    }

    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> children = new ArrayList<>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            children.add(node.getNamedChild(i));
        }
        return children;
    }

    /**
     * Visit the node and all of its descendants in source order.
     */
    static void walk(TSNode node, Consumer<TSNode> visitor) {
        Deque<TSNode> frontier = new ArrayDeque<>();
        frontier.push(node);
        while (!frontier.isEmpty()) {
            TSNode current = frontier.pop();
            visitor.accept(current);
            for (int i = current.getChildCount() - 1; i >= 0; i--) {
                frontier.push(current.getChild(i));
            }
        }
    }

    private static Optional<TSNode> find(TSNode node, Predicate<TSNode> match) {
        Deque<TSNode> frontier = new ArrayDeque<>();
        frontier.push(node);
        while (!frontier.isEmpty()) {
            TSNode current = frontier.pop();
            if (match.test(current)) {
                return Optional.of(current);
            }
            for (int i = current.getChildCount() - 1; i >= 0; i--) {
                frontier.push(current.getChild(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Byte offset of every char index, as the parser counts them in the UTF-8 form JNI hands over.
     */
    private static int[] byteOffsets(String source) {
        int[] offsets = new int[source.length() + 1];
        int bytes = 0;
        for (int i = 0; i < source.length(); i++) {
            offsets[i] = bytes;
            char c = source.charAt(i);
            if (c != 0 && c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else {
                bytes += 3;
            }
        }
        offsets[source.length()] = bytes;
        return offsets;
    }

    private int charIndex(int byteOffset) {
        int index = Arrays.binarySearch(byteOffsets, byteOffset);
        return index >= 0 ? index : Math.min(-index - 1, source.length());
    }
}
