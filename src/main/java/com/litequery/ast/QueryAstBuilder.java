package com.litequery.ast;

import com.litequery.compiler.UnsupportedExpressionException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Collects independent clauses and assembles them into one root node.
 * Several clauses are joined under an implicit {@code AND}.
 */
public class QueryAstBuilder {
    public static final String AND = "AND";

    private final MutableList<QueryAst> clauses = Lists.mutable.empty();

    /** Starts an operator node; operands are appended in order. */
    public static OperatorBuilder open(String token) {
        return new OperatorBuilder(token);
    }

    public QueryAstBuilder add(QueryAst clause) {
        clauses.add(clause);
        return this;
    }

    public int clauseCount() {
        return clauses.size();
    }

    public QueryAst finish() {
        if (clauses.isEmpty()) {
            throw new UnsupportedExpressionException("empty predicate", "Predicate produced no clause");
        }
        if (clauses.size() == 1) {
            return clauses.getFirst();
        }
        return new QueryAst.Operator(AND, clauses);
    }

    public static final class OperatorBuilder {
        private final String token;
        private final MutableList<QueryAst> operands = Lists.mutable.empty();

        private OperatorBuilder(String token) {
            this.token = token;
        }

        public OperatorBuilder append(QueryAst operand) {
            operands.add(operand);
            return this;
        }

        public QueryAst.Operator build() {
            return new QueryAst.Operator(token, operands);
        }
    }
}
