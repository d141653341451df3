package com.litequery.compiler;

import com.litequery.ast.QueryAst;
import com.litequery.ast.QueryAstBuilder;
import com.litequery.expr.BinaryOperator;
import com.litequery.expr.Expression;
import com.litequery.expr.ResultOperator;
import com.litequery.expr.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Translates a where-clause predicate into the native engine's query AST.
 * <p>
 * Each visit returns the node it produced; the compile context is passed down by value so
 * a quantifier body never leaks its variable binding into sibling clauses. A fresh
 * compiler is created for every predicate.
 */
public final class WhereExpressionCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(WhereExpressionCompiler.class);

    private final QueryAstBuilder query = new QueryAstBuilder();
    private final MemberPathFlattener flattener = new MemberPathFlattener();

    private WhereExpressionCompiler() {
    }

    /**
     * Compiles {@code predicate}, usually a lambda such as {@code doc -> doc.a < 5}.
     *
     * @return the root operator node; independent top-level clauses are joined by {@code AND}
     * @throws UnsupportedExpressionException if any part of the predicate has no encoding
     */
    public static QueryAst compile(Expression predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        WhereExpressionCompiler compiler = new WhereExpressionCompiler();
        compiler.addClauses(predicate);
        QueryAst root = compiler.query.finish();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Compiled {} top-level clause(s) into {}", compiler.query.clauseCount(), root.toPlain());
        }
        return root;
    }

    private void addClauses(Expression expression) {
        Expression body = unwrap(expression);
        if (body instanceof Expression.Binary binary && binary.operator() == BinaryOperator.AND_ALSO) {
            addClauses(binary.left());
            addClauses(binary.right());
            return;
        }

        QueryAst clause = visit(body, CompileContext.NORMAL);
        if (!(clause instanceof QueryAst.Operator) && !(clause instanceof QueryAst.Quantifier)) {
            throw new UnsupportedExpressionException(body.getClass().getSimpleName(),
                    "Predicate clause is not a condition: " + body);
        }
        query.add(clause);
    }

    QueryAst visit(Expression expression, CompileContext context) {
        if (expression instanceof Expression.Binary binary) {
            return visitBinary(binary, context);
        }
        if (expression instanceof Expression.Unary unary) {
            return visit(unary.operand(), context);
        }
        if (expression instanceof Expression.Constant constant) {
            return literal(constant);
        }
        if (expression instanceof Expression.Lambda lambda) {
            return visit(lambda.body(), context);
        }
        if (expression instanceof Expression.Member member) {
            return flattener.flatten(member, context);
        }
        if (expression instanceof Expression.MethodCall call) {
            return visitMethodCall(call, context);
        }
        if (expression instanceof Expression.SubQuery subQuery) {
            return visitSubQuery(subQuery, context);
        }
        throw new UnsupportedExpressionException(expression.getClass().getSimpleName());
    }

    private QueryAst visitBinary(Expression.Binary binary, CompileContext context) {
        BinaryOperator operator = binary.operator();
        if (operator.isComparison()) {
            return QueryAstBuilder.open(operator.queryToken())
                    .append(visit(binary.left(), context))
                    .append(visit(binary.right(), context))
                    .build();
        }
        if (operator == BinaryOperator.AND_ALSO) {
            QueryAstBuilder conjunction = new QueryAstBuilder();
            addConjuncts(binary, context, conjunction);
            return conjunction.finish();
        }
        throw new UnsupportedExpressionException(operator.symbol(),
                "Unsupported binary operator: " + operator.symbol());
    }

    private void addConjuncts(Expression expression, CompileContext context, QueryAstBuilder conjunction) {
        Expression body = unwrap(expression);
        if (body instanceof Expression.Binary binary && binary.operator() == BinaryOperator.AND_ALSO) {
            addConjuncts(binary.left(), context, conjunction);
            addConjuncts(binary.right(), context, conjunction);
        } else {
            conjunction.add(visit(body, context));
        }
    }

    private QueryAst visitMethodCall(Expression.MethodCall call, CompileContext context) {
        if (MemberPathFlattener.isIndexer(call)) {
            return flattener.flatten(call, context);
        }
        return SpecialForm.lookup(call.method())
                .map(form -> form.encode(call, this, context))
                .orElseThrow(() -> new UnsupportedExpressionException(call.method(),
                        "Unsupported method: " + call.method()));
    }

    private QueryAst visitSubQuery(Expression.SubQuery subQuery, CompileContext context) {
        ResultOperator resultOperator = subQuery.resultOperator();

        if (resultOperator instanceof ResultOperator.All all) {
            if (all.predicate() != null && subQuery.where() != null) {
                throw new UnsupportedExpressionException(all.name(),
                        "all() with both a filter clause and a predicate is not supported");
            }
            Expression predicate = all.predicate() != null ? all.predicate() : subQuery.where();
            return quantify(QueryAst.Quantifier.EVERY, subQuery.source(), requirePredicate(predicate, all), context);
        }
        if (resultOperator instanceof ResultOperator.Any any) {
            return quantify(QueryAst.Quantifier.ANY, subQuery.source(), requirePredicate(subQuery.where(), any), context);
        }

        if (subQuery.where() != null) {
            throw new UnsupportedExpressionException(resultOperator.name(),
                    resultOperator.name() + "() with a filter clause is not supported");
        }
        if (resultOperator instanceof ResultOperator.Count) {
            // The count wraps the collection reference in place
            return QueryAst.Operator.of("ARRAY_COUNT()", visit(subQuery.source(), context));
        }
        if (resultOperator instanceof ResultOperator.First || resultOperator instanceof ResultOperator.Last) {
            String suffix = resultOperator instanceof ResultOperator.First ? "[0]" : "[-1]";
            QueryAst collection = visit(subQuery.source(), context);
            if (collection instanceof QueryAst.PathRef path) {
                return path.withSuffix(suffix);
            }
            if (collection instanceof QueryAst.QuantifiedPathRef path) {
                return path.withSuffix(suffix);
            }
            throw new UnsupportedExpressionException(resultOperator.name(),
                    resultOperator.name() + "() requires a property path, found " + collection.toPlain());
        }
        throw new UnsupportedExpressionException(resultOperator.name(),
                "Unsupported result operator: " + resultOperator.name());
    }

    QueryAst quantify(String keyword, Expression collection, Expression predicate, CompileContext context) {
        QueryAst source = visit(collection, context);
        QueryAst condition = visit(predicate, CompileContext.quantifierBody(boundParameter(predicate)));
        return new QueryAst.Quantifier(keyword, QueryAst.VARIABLE, source, condition);
    }

    // Literals must be scalars: an array would read as a path or operator node
    private static QueryAst literal(Expression.Constant constant) {
        Object value = constant.value();
        ValueType type = constant.type();
        if (type == ValueType.ARRAY || type == ValueType.OBJECT) {
            throw new UnsupportedExpressionException("constant",
                    "Constant must be a string, number, boolean or null, found " + type);
        }
        if ((value instanceof Double d && !Double.isFinite(d)) || (value instanceof Float f && !Float.isFinite(f))) {
            throw new UnsupportedExpressionException("constant", "Constant must be a finite number, found " + value);
        }
        return new QueryAst.Literal(value);
    }

    private static String boundParameter(Expression predicate) {
        Expression current = predicate;
        while (current instanceof Expression.Unary unary) {
            current = unary.operand();
        }
        return current instanceof Expression.Lambda lambda ? lambda.parameter() : null;
    }

    private static Expression requirePredicate(Expression predicate, ResultOperator resultOperator) {
        if (predicate == null) {
            throw new UnsupportedExpressionException(resultOperator.name(),
                    resultOperator.name() + "() requires a predicate");
        }
        return predicate;
    }

    private static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (true) {
            if (current instanceof Expression.Lambda lambda) {
                current = lambda.body();
            } else if (current instanceof Expression.Unary unary) {
                current = unary.operand();
            } else {
                return current;
            }
        }
    }
}
