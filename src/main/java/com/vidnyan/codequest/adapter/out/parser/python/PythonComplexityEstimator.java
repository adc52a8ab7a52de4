package com.vidnyan.codequest.adapter.out.parser.python;

import org.treesitter.TSNode;

import java.util.Set;

import static com.vidnyan.codequest.adapter.out.parser.python.PythonSyntaxTree.field;

/**
 * Cyclomatic-style complexity of a whole Python file.
 * <p>
 * Starts at 1 and adds one per {@code if}, {@code elif}, {@code for}, {@code while}
 * and {@code except} statement, plus one per boolean operator group. Operands
 * chained by the same operator form one group, so {@code a and b and c} adds 1
 * and {@code a and b or c} adds 2. Comprehension clauses and conditional
 * expressions are not counted.
 */
public class PythonComplexityEstimator {

    private static final Set<String> BRANCHES = Set.of(
            "if_statement", "elif_clause", "for_statement", "while_statement",
            "except_clause", "except_group_clause");

    private static final String BOOLEAN_OPERATOR = "boolean_operator";

    int estimate(TSNode root) {
        int[] complexity = {1};
        PythonSyntaxTree.walk(root, node -> {
            String type = node.getType();
            if (BRANCHES.contains(type)) {
                complexity[0]++;
            } else if (BOOLEAN_OPERATOR.equals(type) && startsGroup(node)) {
                complexity[0]++;
            }
        });
        return complexity[0];
    }

    /**
     * {@code a and b and c} nests as {@code (a and b) and c}; only the outermost
     * operator of a same-operator run starts a group.
     */
    private static boolean startsGroup(TSNode node) {
        TSNode parent = node.getParent();
        if (!PythonSyntaxTree.present(parent) || !BOOLEAN_OPERATOR.equals(parent.getType())) {
            return true;
        }
        return !operator(parent).equals(operator(node));
    }

    private static String operator(TSNode node) {
        return field(node, "operator").map(TSNode::getType).orElse("");
    }
}
