package com.litequery.compiler;

import com.litequery.ast.QueryAst;
import com.litequery.expr.Expression;
import com.litequery.expr.ResultOperator;

/**
 * Turns a chain of member accesses and indexer calls, such as {@code doc.a.b.get(2)},
 * into a single path reference {@code a.b[2]}.
 */
public class MemberPathFlattener {
    public static final String INDEXER_METHOD = "get";

    public QueryAst flatten(Expression expression, CompileContext context) {
        StringBuilder sb = new StringBuilder();
        Expression.Parameter root = walk(expression, sb);
        String path = sb.substring(1);
        if (!context.isQuantifierBody()) {
            return new QueryAst.PathRef(path);
        }

        // Only the bound parameter can be rendered as the quantifier variable
        if (context.boundParameter() != null && !context.boundParameter().equals(root.name())) {
            throw new UnsupportedExpressionException(root.name(), "Path '" + path + "' refers to '"
                    + root.name() + "' inside a quantifier over '" + context.boundParameter() + "'");
        }
        return new QueryAst.QuantifiedPathRef(path);
    }

    public static boolean isIndexer(Expression expression) {
        return expression instanceof Expression.MethodCall call
                && INDEXER_METHOD.equals(call.method())
                && call.receiver() instanceof Expression.Member;
    }

    String flattenPath(Expression expression) {
        StringBuilder sb = new StringBuilder();
        walk(expression, sb);
        return sb.substring(1);
    }

    private static Expression.Parameter walk(Expression expression, StringBuilder sb) {
        // Walk outermost access first, prepending each segment
        Expression current = expression;
        while (true) {
            if (current instanceof Expression.Member member) {
                sb.insert(0, "." + member.name());
                current = member.target();
            } else if (current instanceof Expression.MethodCall call) {
                if (!isIndexer(call)) {
                    throw new UnsupportedExpressionException(call.method(),
                            "Unsupported method in member path: " + call.method());
                }
                Expression.Member collection = (Expression.Member) call.receiver();
                sb.insert(0, "." + collection.name() + "[" + index(call) + "]");
                current = collection.target();
            } else if (current instanceof Expression.SubQuery subQuery && isElementAccess(subQuery)) {
                sb.insert(0, subQuery.resultOperator() instanceof ResultOperator.First ? "[0]" : "[-1]");
                current = subQuery.source();
            } else {
                break;
            }
        }

        if (!(current instanceof Expression.Parameter parameter)) {
            throw new UnsupportedExpressionException(current.getClass().getSimpleName(),
                    "Member path must start at the lambda parameter, found " + current);
        }
        if (sb.length() == 0 || sb.charAt(0) != '.') {
            throw new UnsupportedExpressionException("path", "Not a member path: " + expression);
        }
        return parameter;
    }

    private static Object index(Expression.MethodCall call) {
        if (call.arguments().size() != 1 || !(call.arguments().getFirst() instanceof Expression.Constant constant)) {
            throw new UnsupportedExpressionException(INDEXER_METHOD,
                    "Indexer argument must be a single literal: " + call.arguments());
        }
        if (constant.value() == null) {
            throw new UnsupportedExpressionException(INDEXER_METHOD, "Indexer argument must not be null");
        }
        return constant.value();
    }

    private static boolean isElementAccess(Expression.SubQuery subQuery) {
        return subQuery.where() == null
                && (subQuery.resultOperator() instanceof ResultOperator.First
                    || subQuery.resultOperator() instanceof ResultOperator.Last);
    }
}
