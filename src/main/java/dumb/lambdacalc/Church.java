package dumb.lambdacalc;

import java.util.OptionalInt;

/** Church numerals: {@code λf.λx. f (f (... (f x)))}. */
enum Church {
    ;

    static Term numeral(int n, IdSource ids) {
        if (n < 0) throw new IllegalArgumentException("Church numerals are natural numbers: " + n);
        var f = Term.Var.of("f", ids);
        var x = Term.Var.of("x", ids);
        Term body = new Term.Var(x.name(), x.id(), true);
        for (var i = 0; i < n; i++)
            body = new Term.App(new Term.Var(f.name(), f.id(), true), body);
        return new Term.Abs(f, new Term.Abs(x, body));
    }

    /**
     * @return n if {@code t} has exactly the shape of the n-th numeral, empty otherwise
     */
    static OptionalInt decode(Term t) {
        if (!(t instanceof Term.Abs outer) || !(outer.body() instanceof Term.Abs inner))
            return OptionalInt.empty();
        var f = outer.param().id();
        var x = inner.param().id();
        var n = 0;
        var cur = inner.body();
        while (cur instanceof Term.App app) {
            if (!(app.function() instanceof Term.Var v) || v.id() != f) return OptionalInt.empty();
            n++;
            cur = app.argument();
        }
        return cur instanceof Term.Var v && v.id() == x ? OptionalInt.of(n) : OptionalInt.empty();
    }
}
