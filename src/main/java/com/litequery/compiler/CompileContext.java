package com.litequery.compiler;

/**
 * Mode of the current walk plus, inside a quantifier body, the name of the lambda
 * parameter bound to the quantifier variable (null when the body is not a lambda).
 */
public record CompileContext(CompileMode mode, String boundParameter) {
    public static final CompileContext NORMAL = new CompileContext(CompileMode.NORMAL, null);

    public static CompileContext quantifierBody(String boundParameter) {
        return new CompileContext(CompileMode.QUANTIFIER_BODY, boundParameter);
    }

    public boolean isQuantifierBody() {
        return mode == CompileMode.QUANTIFIER_BODY;
    }
}
