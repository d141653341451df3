package com.litequery.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Host-side predicate expression tree, the input of the where-clause compiler.
 * The set of node kinds is closed; anything the compiler cannot translate is
 * still representable and rejected at compile time.
 */
public sealed interface Expression {

    /** Static type of the value this node produces. */
    default ValueType type() {
        return ValueType.UNKNOWN;
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public ValueType type() {
            return operator.isComparison() || operator == BinaryOperator.AND_ALSO
                    || operator == BinaryOperator.OR_ELSE ? ValueType.BOOLEAN : left.type();
        }
    }

    // Implicit conversion or quoting inserted upstream (e.g. lambda to delegate)
    record Unary(Expression operand) implements Expression {
        public Unary {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public ValueType type() {
            return operand.type();
        }
    }

    record Constant(Object value) implements Expression {
        @Override
        public ValueType type() {
            return ValueType.of(value);
        }
    }

    record Lambda(String parameter, Expression body) implements Expression {
        public Lambda {
            Objects.requireNonNull(parameter, "parameter must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    record Parameter(String name) implements Expression {
        public Parameter {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    record Member(Expression target, String name, ValueType type) implements Expression {
        public Member {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(name, "name must not be null");
            type = type != null ? type : ValueType.UNKNOWN;
        }
    }

    // receiver is null for static calls
    record MethodCall(Expression receiver, String method, MutableList<Expression> arguments, ValueType type)
            implements Expression {
        public MethodCall {
            Objects.requireNonNull(method, "method must not be null");
            arguments = arguments != null ? Lists.mutable.withAll(arguments) : Lists.mutable.empty();
            type = type != null ? type : ValueType.UNKNOWN;
        }

        public boolean isStatic() {
            return receiver == null;
        }
    }

    // Sub-collection query: source.where(where).<resultOperator>
    record SubQuery(Expression source, Expression where, ResultOperator resultOperator) implements Expression {
        public SubQuery {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(resultOperator, "resultOperator must not be null");
        }

        @Override
        public ValueType type() {
            return resultOperator.resultType(source);
        }
    }

    static Parameter parameter(String name) {
        return new Parameter(name);
    }

    static Constant constant(Object value) {
        return new Constant(value);
    }

    static Lambda lambda(String parameter, Expression body) {
        return new Lambda(parameter, body);
    }

    static Binary binary(BinaryOperator operator, Expression left, Expression right) {
        return new Binary(operator, left, right);
    }

    static Member member(Expression target, String name) {
        return new Member(target, name, ValueType.UNKNOWN);
    }

    static Member member(Expression target, String name, ValueType type) {
        return new Member(target, name, type);
    }

    static MethodCall call(Expression receiver, String method, Expression... arguments) {
        return new MethodCall(receiver, method, Lists.mutable.with(arguments), ValueType.UNKNOWN);
    }

    static SubQuery subQuery(Expression source, Expression where, ResultOperator resultOperator) {
        return new SubQuery(source, where, resultOperator);
    }

    /** Member chain rooted at {@code root}, e.g. {@code path(doc, "a", "b")} for {@code doc.a.b}. */
    static Expression path(Expression root, String... names) {
        Expression current = root;
        for (String name : names) {
            current = member(current, name);
        }
        return current;
    }
}
