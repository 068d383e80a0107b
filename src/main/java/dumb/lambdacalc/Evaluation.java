package dumb.lambdacalc;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Outcome of evaluating one line. */
sealed public interface Evaluation permits Evaluation.Defined, Evaluation.Reduced {

    String INPUT_MARKER = "INPUT ";
    String STEP_MARKER = "β ==> ";

    /** Printed form, one element per output line. */
    List<String> lines(boolean showAst);

    record Defined(Definition definition) implements Evaluation {
        public Defined {
            requireNonNull(definition);
        }

        @Override
        public List<String> lines(boolean showAst) {
            return List.of();
        }
    }

    /**
     * @param report null when the step budget ran out before a normal form
     */
    record Reduced(Reducer.Result result, @Nullable Recognizer.Report report, int limit) implements Evaluation {
        public Reduced {
            requireNonNull(result);
        }

        public Term input() {
            return result.input();
        }

        public List<Term> steps() {
            return result.steps();
        }

        public boolean truncated() {
            return result.truncated();
        }

        @Override
        public List<String> lines(boolean showAst) {
            var lines = new ArrayList<String>();
            lines.add(INPUT_MARKER + input().toLambda());
            if (showAst) lines.add(input().toJson().toString(2));
            for (var t : steps()) {
                lines.add(STEP_MARKER + t.toLambda());
                if (showAst) lines.add(t.toJson().toString(2));
            }
            lines.add("");
            if (report == null)
                lines.add("Stopped after " + limit + " reductions without reaching a normal form.");
            else
                lines.addAll(report.lines());
            return lines;
        }
    }
}
