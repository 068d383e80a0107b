package dumb.lambdacalc;

import static java.util.Objects.requireNonNull;

/**
 * A named closed term, introduced by {@code {NAME}=term}.
 */
public final class Definition implements Statement {
    public final String name;
    public final Term term;

    private Definition(String name, Term term) {
        this.name = name;
        this.term = term;
    }

    public static Definition of(String name, Term term) throws LambdaException.UnclosedTerm {
        requireNonNull(name);
        requireNonNull(term);
        if (!term.bound()) throw new LambdaException.UnclosedTerm(name, term);
        return new Definition(name, term);
    }

    public String toLambda() {
        return Shorthands.display(name) + "=" + term.toLambda();
    }

    @Override
    public String toString() {
        return "Definition[" + toLambda() + ']';
    }
}
