package com.litequery.compiler;

import com.litequery.ast.QueryAst;
import com.litequery.ast.QueryAstBuilder;
import com.litequery.expr.Expression;
import com.litequery.expr.ValueType;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Method calls with a dedicated encoding in the query language. Operands are the
 * receiver (for instance calls) followed by the arguments.
 */
public enum SpecialForm {
    CONTAINS("contains", "CONTAINS()", 2) {
        @Override
        QueryAst encode(MutableList<Expression> operands, WhereExpressionCompiler compiler, CompileContext context) {
            // String containment only; collection membership has no encoding
            if (operands.getFirst().type() != ValueType.STRING) {
                throw new UnsupportedExpressionException(methodName(),
                        "contains() is only supported on text values, found " + operands.getFirst().type());
            }
            return super.encode(operands, compiler, context);
        }
    },
    REGEX_MATCH("isRegexMatch", "REGEXP_LIKE()", 2),
    BETWEEN("between", "BETWEEN", 3),
    ANY_AND_EVERY("anyAndEvery", QueryAst.Quantifier.ANY_AND_EVERY, 2) {
        @Override
        QueryAst encode(MutableList<Expression> operands, WhereExpressionCompiler compiler, CompileContext context) {
            return compiler.quantify(token(), operands.get(0), operands.get(1), context);
        }
    };

    private final String methodName;
    private final String token;
    private final int arity;

    SpecialForm(String methodName, String token, int arity) {
        this.methodName = methodName;
        this.token = token;
        this.arity = arity;
    }

    public String methodName() {
        return methodName;
    }

    public String token() {
        return token;
    }

    public int arity() {
        return arity;
    }

    public static Optional<SpecialForm> lookup(String methodName) {
        for (SpecialForm form : values()) {
            if (form.methodName.equals(methodName)) {
                return Optional.of(form);
            }
        }
        return Optional.empty();
    }

    QueryAst encode(Expression.MethodCall call, WhereExpressionCompiler compiler, CompileContext context) {
        MutableList<Expression> operands = Lists.mutable.empty();
        if (!call.isStatic()) {
            operands.add(call.receiver());
        }
        operands.addAll(call.arguments());
        if (operands.size() != arity) {
            throw new UnsupportedExpressionException(methodName,
                    methodName + "() takes " + arity + " operands, found " + operands.size());
        }
        return encode(operands, compiler, context);
    }

    QueryAst encode(MutableList<Expression> operands, WhereExpressionCompiler compiler, CompileContext context) {
        QueryAstBuilder.OperatorBuilder node = QueryAstBuilder.open(token);
        operands.each(operand -> node.append(compiler.visit(operand, context)));
        return node.build();
    }
}
