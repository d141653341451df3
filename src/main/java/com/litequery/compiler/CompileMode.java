package com.litequery.compiler;

public enum CompileMode {
    NORMAL,
    // paths are relative to the quantifier variable
    QUANTIFIER_BODY
}
