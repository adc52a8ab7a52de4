package com.vidnyan.codequest.adapter.out.parser.java;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cyclomatic-style complexity of a whole compilation unit: 1 plus one per
 * {@code if}, {@code for}, for-each, {@code while}, {@code do}, {@code catch}
 * and each {@code &&} / {@code ||}.
 */
public class JavaComplexityEstimator {

    public int estimate(CompilationUnit cu) {
        AtomicInteger complexity = new AtomicInteger(1);
        cu.accept(new VoidVisitorAdapter<Void>() {

            @Override
            public void visit(IfStmt n, Void arg) {
                super.visit(n, arg);
                complexity.incrementAndGet();
            }

            @Override
            public void visit(ForStmt n, Void arg) {
                super.visit(n, arg);
                complexity.incrementAndGet();
            }

            @Override
            public void visit(ForEachStmt n, Void arg) {
                super.visit(n, arg);
                complexity.incrementAndGet();
            }

            @Override
            public void visit(WhileStmt n, Void arg) {
                super.visit(n, arg);
                complexity.incrementAndGet();
            }

            @Override
            public void visit(DoStmt n, Void arg) {
                super.visit(n, arg);
                complexity.incrementAndGet();
            }

            @Override
            public void visit(CatchClause n, Void arg) {
                super.visit(n, arg);
                complexity.incrementAndGet();
            }

            @Override
            public void visit(BinaryExpr n, Void arg) {
                super.visit(n, arg);
                if (n.getOperator() == BinaryExpr.Operator.AND || n.getOperator() == BinaryExpr.Operator.OR) {
                    complexity.incrementAndGet();
                }
            }
        }, null);
        return complexity.get();
    }
}
