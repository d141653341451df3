package com.litequery.compiler;

import com.litequery.ast.QueryAst;
import com.litequery.expr.Expression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.litequery.expr.Expression.call;
import static com.litequery.expr.Expression.constant;
import static com.litequery.expr.Expression.member;
import static org.junit.jupiter.api.Assertions.*;

public class MemberPathFlattenerTest {
    private static final Expression DOC = Expression.parameter("doc");

    private final MemberPathFlattener flattener = new MemberPathFlattener();

    // doc.a.b.get(2)
    private static Expression indexedPath() {
        return call(Expression.path(DOC, "a", "b"), "get", constant(2));
    }

    @Test
    public void testNormalMode() {
        QueryAst path = flattener.flatten(indexedPath(), CompileContext.NORMAL);

        assertEquals(new QueryAst.PathRef("a.b[2]"), path);
        assertEquals(List.of("a.b[2]"), path.toPlain());
    }

    @Test
    public void testQuantifierBodyMode() {
        QueryAst path = flattener.flatten(indexedPath(), CompileContext.quantifierBody("doc"));

        assertEquals(new QueryAst.QuantifiedPathRef("a.b[2]"), path);
        assertEquals(List.of("?X", "a.b[2]"), path.toPlain());
    }

    @Test
    public void testFlatteningIsRepeatable() {
        Expression expression = member(indexedPath(), "c");

        assertEquals(flattener.flatten(expression, CompileContext.NORMAL),
                flattener.flatten(expression, CompileContext.NORMAL));
    }

    @Test
    public void testSingleMember() {
        assertEquals("name", flattener.flattenPath(member(DOC, "name")));
    }

    @Test
    public void testIndexerInTheMiddleOfAChain() {
        Expression expression = member(call(member(DOC, "lines"), "get", constant(0)), "sku");

        assertEquals("lines[0].sku", flattener.flattenPath(expression));
    }

    @Test
    public void testStringKeyIndexer() {
        Expression expression = call(member(DOC, "attributes"), "get", constant("color"));

        assertEquals("attributes[color]", flattener.flattenPath(expression));
    }

    @Test
    public void testOtherMethodInChainIsRejected() {
        Expression expression = member(call(member(DOC, "name"), "trim"), "length");

        UnsupportedExpressionException e = assertThrows(UnsupportedExpressionException.class,
                () -> flattener.flatten(expression, CompileContext.NORMAL));
        assertEquals("trim", e.getConstruct());
    }

    @Test
    public void testNonLiteralIndexIsRejected() {
        Expression expression = call(member(DOC, "items"), "get", member(DOC, "position"));

        assertThrows(UnsupportedExpressionException.class,
                () -> flattener.flatten(expression, CompileContext.NORMAL));
    }

    @Test
    public void testPathMustStartAtParameter() {
        Expression expression = member(constant("captured"), "length");

        assertThrows(UnsupportedExpressionException.class,
                () -> flattener.flatten(expression, CompileContext.NORMAL));
    }

    @Test
    public void testIsIndexer() {
        assertTrue(MemberPathFlattener.isIndexer(indexedPath()));
        assertFalse(MemberPathFlattener.isIndexer(call(DOC, "get", constant(0))));
        assertFalse(MemberPathFlattener.isIndexer(member(DOC, "get")));
    }

    @Test
    public void testQuantifierBodyRejectsOtherParameter() {
        Expression outer = member(DOC, "limit");

        UnsupportedExpressionException e = assertThrows(UnsupportedExpressionException.class,
                () -> flattener.flatten(outer, CompileContext.quantifierBody("x")));
        assertEquals("doc", e.getConstruct());
    }

    @Test
    public void testQuantifierBodyWithoutLambdaKeepsModeOnlyRendering() {
        QueryAst path = flattener.flatten(member(DOC, "limit"), CompileContext.quantifierBody(null));

        assertEquals(new QueryAst.QuantifiedPathRef("limit"), path);
    }
}
