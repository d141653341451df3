package com.litequery.expr;

import java.util.Objects;

/** Operator applied to the result of a {@link Expression.SubQuery}. */
public sealed interface ResultOperator {

    String name();

    default ValueType resultType(Expression source) {
        return ValueType.UNKNOWN;
    }

    record All(Expression predicate) implements ResultOperator {
        @Override
        public String name() {
            return "all";
        }

        @Override
        public ValueType resultType(Expression source) {
            return ValueType.BOOLEAN;
        }
    }

    record Any() implements ResultOperator {
        @Override
        public String name() {
            return "any";
        }

        @Override
        public ValueType resultType(Expression source) {
            return ValueType.BOOLEAN;
        }
    }

    record Count() implements ResultOperator {
        @Override
        public String name() {
            return "count";
        }

        @Override
        public ValueType resultType(Expression source) {
            return ValueType.NUMBER;
        }
    }

    record First() implements ResultOperator {
        @Override
        public String name() {
            return "first";
        }
    }

    record Last() implements ResultOperator {
        @Override
        public String name() {
            return "last";
        }
    }

    // sum, average, min, max, distinct, ... : representable, not translatable
    record Aggregate(String function) implements ResultOperator {
        public Aggregate {
            Objects.requireNonNull(function, "function must not be null");
        }

        @Override
        public String name() {
            return function;
        }
    }
}
