package com.litequery.compiler;

import com.litequery.expr.Expression;
import com.litequery.expr.ValueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.litequery.expr.BinaryOperator.EQUAL;
import static com.litequery.expr.Expression.binary;
import static com.litequery.expr.Expression.call;
import static com.litequery.expr.Expression.constant;
import static com.litequery.expr.Expression.lambda;
import static com.litequery.expr.Expression.member;
import static org.junit.jupiter.api.Assertions.*;

public class SpecialFormTest {
    private static final Expression DOC = Expression.parameter("doc");

    private static Object compile(Expression body) {
        return WhereExpressionCompiler.compile(lambda("doc", body)).toPlain();
    }

    @ParameterizedTest
    @CsvSource({
        "contains, CONTAINS, 2",
        "isRegexMatch, REGEX_MATCH, 2",
        "between, BETWEEN, 3",
        "anyAndEvery, ANY_AND_EVERY, 2"
    })
    public void testLookup(String methodName, SpecialForm expected, int arity) {
        assertEquals(expected, SpecialForm.lookup(methodName).orElseThrow());
        assertEquals(arity, expected.arity());
    }

    @Test
    public void testLookupIsCaseSensitive() {
        assertTrue(SpecialForm.lookup("Contains").isEmpty());
        assertTrue(SpecialForm.lookup("get").isEmpty());
    }

    @Test
    public void testContainsOnText() {
        Expression receiver = member(DOC, "title", ValueType.STRING);

        assertEquals(List.of("CONTAINS()", List.of("title"), "java"),
                compile(call(receiver, "contains", constant("java"))));
    }

    @Test
    public void testContainsOnCollectionIsRejected() {
        Expression receiver = member(DOC, "tags", ValueType.ARRAY);

        UnsupportedExpressionException e = assertThrows(UnsupportedExpressionException.class,
                () -> compile(call(receiver, "contains", constant("java"))));
        assertEquals("contains", e.getConstruct());
    }

    @Test
    public void testContainsOnUntypedMemberIsRejected() {
        assertThrows(UnsupportedExpressionException.class,
                () -> compile(call(member(DOC, "title"), "contains", constant("java"))));
    }

    @Test
    public void testRegexMatch() {
        Expression subject = member(DOC, "email");

        assertEquals(List.of("REGEXP_LIKE()", List.of("email"), ".*@example\\.com"),
                compile(call(null, "isRegexMatch", subject, constant(".*@example\\.com"))));
    }

    @Test
    public void testBetweenKeepsValueLowHighOrder() {
        Object result = compile(call(null, "between", member(DOC, "age"), constant(18), constant(65)));

        assertEquals(List.of("BETWEEN", List.of("age"), 18, 65), result);
    }

    @Test
    public void testBetweenAsInstanceCall() {
        Object result = compile(call(member(DOC, "age"), "between", constant(1), constant(9)));

        assertEquals(List.of("BETWEEN", List.of("age"), 1, 9), result);
    }

    @Test
    public void testBetweenWithWrongArityIsRejected() {
        assertThrows(UnsupportedExpressionException.class,
                () -> compile(call(null, "between", member(DOC, "age"), constant(18))));
    }

    @Test
    public void testAnyAndEvery() {
        Expression x = Expression.parameter("x");
        Expression predicate = lambda("x", binary(EQUAL, member(x, "done"), constant(true)));

        assertEquals(List.of("ANY AND EVERY", "X", List.of("tasks"), List.of("=", List.of("?X", "done"), true)),
                compile(call(null, "anyAndEvery", member(DOC, "tasks"), predicate)));
    }

    @Test
    public void testAnyAndEveryWithoutPredicateIsRejected() {
        assertThrows(UnsupportedExpressionException.class,
                () -> compile(call(null, "anyAndEvery", member(DOC, "tasks"))));
    }
}
