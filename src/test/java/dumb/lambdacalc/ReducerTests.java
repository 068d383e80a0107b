package dumb.lambdacalc;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class ReducerTests extends AbstractTest {

    private static final String OMEGA = "(λx.xx)(λx.xx)";

    @Test
    void normalFormHasNoSteps() {
        var t = term("λf.λx.f(fx)");
        assertFalse(session.reducer.steps(t).hasNext());
        assertNull(session.reducer.step(t));
        var result = session.reducer.reduce(t, 100);
        assertTrue(result.steps().isEmpty());
        assertFalse(result.truncated());
        assertSame(t, result.last());
    }

    @Test
    void identityAppliedReducesInOneStep() {
        var t = assertInstanceOf(Term.App.class, term("(λx.x)a"));
        var result = session.reducer.reduce(t, 100);
        assertEquals(1, result.steps().size());
        assertSame(t.argument(), result.last());
        assertEquals("a", result.last().toLambda());
    }

    @Test
    void curriedApplication() {
        var result = session.reducer.reduce(term("(λx.λy.x)ab"), 100);
        assertEquals(2, result.steps().size());
        assertEquals("(λy.a)b", result.steps().get(0).toLambda());
        assertEquals("a", result.last().toLambda());
    }

    @Test
    void outermostRedexFirst() {
        var result = session.reducer.reduce(term("(λx.y)" + "(" + OMEGA + ")"), 100);
        assertEquals(1, result.steps().size());
        assertEquals("y", result.last().toLambda());
    }

    @Test
    void reducesInsideArgumentOnceTheFunctionIsStuck() {
        var result = session.reducer.reduce(term("x((λy.y)z)"), 100);
        assertEquals(1, result.steps().size());
        assertEquals("xz", result.last().toLambda());
    }

    @Test
    void reducesUnderAbstraction() {
        var result = session.reducer.reduce(term("λx.(λy.y)x"), 100);
        assertEquals("λx.x", result.last().toLambda());
    }

    @Test
    void divergentTermStopsAtTheStepLimit() {
        var omega = term(OMEGA);
        var result = session.reducer.reduce(omega, 5);
        assertEquals(5, result.steps().size());
        assertTrue(result.truncated());
        result.steps().forEach(t -> assertAlphaEquivalent(omega, t));
    }

    @Test
    void normalFormReachedExactlyAtTheLimitIsNotTruncated() {
        var result = session.reducer.reduce(term("(λx.λy.x)ab"), 2);
        assertEquals(2, result.steps().size());
        assertFalse(result.truncated());
        assertEquals("a", result.last().toLambda());
    }

    @Test
    void noStepIsComputedPastTheLimit() {
        var omega = term(OMEGA);
        var before = session.ids.peek();
        session.reducer.reduce(omega, 3);
        var usedByReduce = session.ids.peek() - before;

        before = session.ids.peek();
        var t = omega;
        for (var i = 0; i < 3; i++) t = session.reducer.step(t);
        assertEquals(session.ids.peek() - before, usedByReduce);
    }

    @Test
    void normalFormCheck() {
        assertTrue(Reducer.normal(term("λf.λx.f(fx)")));
        assertTrue(Reducer.normal(term("x(λy.y)")));
        assertFalse(Reducer.normal(term("λx.(λy.y)x")));
        assertFalse(Reducer.normal(term("x((λy.y)z)")));
        assertFalse(Reducer.normal(term(OMEGA)));
    }

    @Test
    void zeroBudget() {
        var result = session.reducer.reduce(term("(λx.x)(λy.y)"), 0);
        assertTrue(result.steps().isEmpty());
        assertTrue(result.truncated());
    }

    @Test
    void stepsAreLazy() {
        var it = session.reducer.steps(term(OMEGA));
        for (var i = 0; i < 3; i++) {
            assertTrue(it.hasNext());
            assertNotNull(it.next());
        }
    }

    @Test
    void exhaustedIteratorThrows() {
        var it = session.reducer.steps(term("(λx.x)(λy.y)"));
        assertEquals("λy.y", it.next().toLambda());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void inputIsNotModified() {
        var t = term("(λx.λy.x)(λz.z)");
        var before = t.toLambda();
        normalize(t);
        assertEquals(before, t.toLambda());
    }

    @Test
    void successorOfTwoIsThree() {
        define("{succ}=λn.λf.λx.f(nfx)");
        var nf = normalize("{succ}2");
        assertAlphaEquivalent(numeral(3), nf);
        assertEquals(3, Church.decode(nf).orElseThrow());
    }

    @Test
    void substitutedCopiesDoNotCapture() {
        var nf = normalize("(λz.zz)(λy.λq.yq)");
        assertAlphaEquivalent(term("λa.λb.ab"), nf);
        assertNotAlphaEquivalent(term("λa.λb.bb"), nf);
    }

    @Test
    void duplicatedArgumentsGetDistinctBinders() {
        var step = assertInstanceOf(Term.App.class, session.reducer.step(term("(λf.ff)(λy.y)")));
        var f = assertInstanceOf(Term.Abs.class, step.function());
        var a = assertInstanceOf(Term.Abs.class, step.argument());
        assertNotEquals(f.param().id(), a.param().id());
    }
}
