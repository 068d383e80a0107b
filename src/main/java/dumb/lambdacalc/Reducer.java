package dumb.lambdacalc;

import dumb.lambdacalc.util.Log;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Normal-order beta reduction: the leftmost-outermost redex is always contracted
 * first, so a normal form is reached whenever one exists.
 */
public class Reducer {
    private final IdSource ids;

    public Reducer(IdSource ids) {
        this.ids = requireNonNull(ids);
    }

    /**
     * One reduction step.
     *
     * @return the reduced term, or null if {@code term} is in normal form
     */
    @Nullable
    public Term step(Term term) {
        if (term instanceof Term.Var) {
            return null;
        } else if (term instanceof Term.Abs abs) {
            var body = step(abs.body());
            return body == null ? null : new Term.Abs(abs.param(), body);
        } else if (term instanceof Term.App app) {
            if (app.function() instanceof Term.Abs abs)
                return abs.body().subst(abs.param().id(), app.argument(), ids);
            var function = step(app.function());
            if (function != null) return new Term.App(function, app.argument());
            var argument = step(app.argument());
            return argument == null ? null : new Term.App(app.function(), argument);
        }
        throw Term.unknown(term);
    }

    /**
     * Lazily yields each successive reduction of {@code term}, not including
     * {@code term} itself. May never end; stop pulling to cancel.
     */
    public Iterator<Term> steps(Term term) {
        return new Steps(requireNonNull(term));
    }

    /**
     * Whether {@code term} has no redex left, without contracting anything.
     */
    public static boolean normal(Term term) {
        if (term instanceof Term.Var) {
            return true;
        } else if (term instanceof Term.Abs abs) {
            return normal(abs.body());
        } else if (term instanceof Term.App app) {
            return !(app.function() instanceof Term.Abs) && normal(app.function()) && normal(app.argument());
        }
        throw Term.unknown(term);
    }

    /**
     * Reduces until a normal form or until {@code maxSteps} steps have been taken,
     * whichever comes first. No step past the limit is computed.
     */
    public Result reduce(Term term, int maxSteps) {
        if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must be >= 0: " + maxSteps);
        var out = new ArrayList<Term>();
        var current = term;
        var done = false;
        while (out.size() < maxSteps) {
            var next = step(current);
            if (next == null) {
                done = true;
                break;
            }
            out.add(next);
            current = next;
        }
        var truncated = !done && !normal(current);
        if (truncated)
            Log.debug(() -> "Reduction of " + term.toLambda() + " stopped after " + maxSteps + " steps");
        return new Result(term, out, truncated);
    }

    public record Result(Term input, List<Term> steps, boolean truncated) {
        public Result {
            requireNonNull(input);
            steps = List.copyOf(steps);
        }

        /** The last term reached; the normal form unless truncated. */
        public Term last() {
            return steps.isEmpty() ? input : steps.get(steps.size() - 1);
        }
    }

    private class Steps implements Iterator<Term> {
        private Term current;
        @Nullable
        private Term pending;
        private boolean done;

        Steps(Term start) {
            this.current = start;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !done) {
                pending = step(current);
                done = pending == null;
            }
            return pending != null;
        }

        @Override
        public Term next() {
            if (!hasNext()) throw new NoSuchElementException();
            current = pending;
            pending = null;
            return current;
        }
    }
}
