package com.litequery.ast;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Query AST in the native engine's prefix-array grammar. Every node renders to
 * plain lists and scalars through {@link #toPlain()}.
 */
public sealed interface QueryAst {

    /** Binder token of quantifier variables; bound paths render as {@code ["?X", path]}. */
    String VARIABLE = "X";

    Object toPlain();

    record Literal(Object value) implements QueryAst {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record PathRef(String path) implements QueryAst {
        public PathRef {
            Objects.requireNonNull(path, "path must not be null");
        }

        public PathRef withSuffix(String suffix) {
            return new PathRef(path + suffix);
        }

        @Override
        public Object toPlain() {
            return Lists.mutable.with(path);
        }
    }

    record QuantifiedPathRef(String path) implements QueryAst {
        public QuantifiedPathRef {
            Objects.requireNonNull(path, "path must not be null");
        }

        public QuantifiedPathRef withSuffix(String suffix) {
            return new QuantifiedPathRef(path + suffix);
        }

        @Override
        public Object toPlain() {
            return Lists.mutable.with("?" + VARIABLE, path);
        }
    }

    record Operator(String token, ListIterable<QueryAst> operands) implements QueryAst {
        public Operator {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("Operator token must not be empty");
            }
            operands = Lists.immutable.withAll(operands);
        }

        public static Operator of(String token, QueryAst... operands) {
            return new Operator(token, Lists.immutable.with(operands));
        }

        public int arity() {
            return operands.size();
        }

        @Override
        public Object toPlain() {
            MutableList<Object> plain = Lists.mutable.with(token);
            operands.each(operand -> plain.add(operand.toPlain()));
            return plain;
        }
    }

    // [keyword, variable, collection, predicate]
    record Quantifier(String keyword, String variable, QueryAst collection, QueryAst predicate)
            implements QueryAst {
        public static final String ANY = "ANY";
        public static final String EVERY = "EVERY";
        public static final String ANY_AND_EVERY = "ANY AND EVERY";

        public Quantifier {
            if (!ANY.equals(keyword) && !EVERY.equals(keyword) && !ANY_AND_EVERY.equals(keyword)) {
                throw new IllegalArgumentException("Unknown quantifier keyword: " + keyword);
            }
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(collection, "collection must not be null");
            Objects.requireNonNull(predicate, "predicate must not be null");
        }

        @Override
        public Object toPlain() {
            return Lists.mutable.with(keyword, variable, collection.toPlain(), predicate.toPlain());
        }
    }
}
