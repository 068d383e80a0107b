package dumb.lambdacalc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SessionTests extends AbstractTest {

    private static final String OMEGA = "(λx.xx)(λx.xx)";

    @Test
    void definitionIsRegistered() throws LambdaException {
        var e = assertInstanceOf(Evaluation.Defined.class, session.evaluate("{id}=λx.x"));
        assertEquals("ID", e.definition().name);
        assertTrue(session.shorthands.contains("ID"));
        assertEquals(List.of(), e.lines(false));
    }

    @Test
    void freeTermIsNotReduced() {
        var e = assertThrows(LambdaException.NotFullyBound.class, () -> session.evaluate("(λx.x)y"));
        assertEquals("NotFullyBoundError", e.kind());
    }

    @Test
    void output() throws LambdaException {
        var e = assertInstanceOf(Evaluation.Reduced.class, session.evaluate("(λx.x)(λy.y)"));
        assertEquals(List.of(
                "INPUT (λx.x)(λy.y)",
                "β ==> λy.y",
                "",
                "No known shorthand representations."), e.lines(false));
    }

    @Test
    void outputNamesTheResult() throws LambdaException {
        session.evaluate("{succ}=λn.λf.λx.f(nfx)");
        var e = assertInstanceOf(Evaluation.Reduced.class, session.evaluate("{succ}2"));
        var lines = e.lines(false);
        assertEquals("INPUT (λn.λf.λx.f(nfx))(λf.λx.f(fx))", lines.get(0));
        assertTrue(lines.get(1).startsWith(Evaluation.STEP_MARKER));
        assertEquals("-> As Church numeral 3", lines.get(lines.size() - 1));
    }

    @Test
    void stepBudgetFromConfiguration() throws LambdaException {
        session = new Session(new Configuration().withMaxSteps(10));
        var e = assertInstanceOf(Evaluation.Reduced.class, session.evaluate(OMEGA));
        assertTrue(e.truncated());
        assertEquals(10, e.steps().size());
        assertNull(e.report());
        var lines = e.lines(false);
        assertEquals("Stopped after 10 reductions without reaching a normal form.", lines.get(lines.size() - 1));
    }

    @Test
    void astOutput() throws LambdaException {
        var e = assertInstanceOf(Evaluation.Reduced.class, session.evaluate("λx.x"));
        var lines = e.lines(true);
        assertEquals("INPUT λx.x", lines.get(0));
        assertTrue(lines.get(1).contains("\"type\": \"abstraction\""), lines.get(1));
    }

    @Test
    void loadSkipsBlankLinesAndComments() throws LambdaException {
        session.load(List.of("# identity", "", "{id}=λx.x", "   ", "{k}=λx.λy.x"));
        assertEquals(List.of("ID", "K"), List.copyOf(session.shorthands.entries().keySet()));
    }

    @Test
    void defineRejectsTerms() {
        assertThrows(LambdaException.IncompleteParse.class, () -> session.define("λx.x"));
        assertThrows(LambdaException.IncompleteParse.class, () -> session.term("{id}=λx.x"));
    }

    @Test
    void sessionsHaveIndependentIdentities() throws LambdaException {
        var other = new Session();
        assertEquals(0, other.ids.peek());
        var a = assertInstanceOf(Term.Abs.class, session.term("λx.x"));
        var b = assertInstanceOf(Term.Abs.class, other.term("λx.x"));
        assertEquals(a.param().id(), b.param().id());
        assertNotSame(session.shorthands, other.shorthands);
    }

    @Test
    void sessionsDoNotShareDefinitions() throws LambdaException {
        session.define("{id}=λx.x");
        var other = new Session();
        assertThrows(LambdaException.UndefinedShorthand.class, () -> other.parse("{id}"));
    }
}
