package dumb.lambdacalc;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Names a normal form: as a Church numeral, and as every shorthand it is
 * alpha-equivalent to.
 */
public class Recognizer {
    private final Shorthands shorthands;

    public Recognizer(Shorthands shorthands) {
        this.shorthands = requireNonNull(shorthands);
    }

    public Report recognize(Term term) {
        var names = new ArrayList<String>();
        shorthands.entries().forEach((name, t) -> {
            if (term.alphaEq(t)) names.add(name);
        });
        return new Report(Church.decode(term), names);
    }

    public record Report(OptionalInt numeral, List<String> shorthands) {
        public Report {
            requireNonNull(numeral);
            shorthands = List.copyOf(shorthands);
        }

        public boolean empty() {
            return numeral.isEmpty() && shorthands.isEmpty();
        }

        public List<String> lines() {
            if (empty()) return List.of("No known shorthand representations.");
            var lines = new ArrayList<String>();
            lines.add("Potential shorthand representations:");
            numeral.ifPresent(n -> lines.add("-> As Church numeral " + n));
            shorthands.forEach(name -> lines.add("-> As " + Shorthands.display(name)));
            return lines;
        }
    }
}
