package dumb.lambdacalc;

import org.json.JSONObject;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Untyped lambda term. Exactly three shapes exist; consumers that dispatch on the
 * shape end their {@code instanceof} chain with {@link #unknown(Term)}.
 */
sealed public interface Term extends Statement permits Term.Var, Term.Abs, Term.App {

    static IllegalStateException unknown(Term t) {
        return new IllegalStateException("Unknown term shape: " + t.getClass().getName());
    }

    /**
     * Copies {@code t} giving every abstraction inside it a fresh identity. Free
     * variables keep theirs.
     */
    static Term fresh(Term t, IdSource ids) {
        return copy(t, Map.of(), ids);
    }

    private static Term copy(Term t, Map<Long, Var> renames, IdSource ids) {
        if (t instanceof Var v) {
            return renames.getOrDefault(v.id(), v);
        } else if (t instanceof Abs a) {
            var binder = new Var(a.param().name(), ids.next(), a.param().bound());
            var scoped = new HashMap<>(renames);
            scoped.put(a.param().id(), new Var(binder.name(), binder.id(), true));
            return new Abs(binder, copy(a.body(), scoped, ids));
        } else if (t instanceof App app) {
            return new App(copy(app.function(), renames, ids), copy(app.argument(), renames, ids));
        }
        throw unknown(t);
    }

    String toLambda();

    /** True iff every variable leaf has been matched by an enclosing abstraction. */
    boolean bound();

    /**
     * Binding pass of an enclosing abstraction over this subtree.
     */
    Term bind(Var binder) throws LambdaException.Rebinding;

    /**
     * Replaces every variable with identity {@code id} by a fresh copy of
     * {@code replacement}. Enclosing abstractions are rebuilt without binding.
     */
    Term subst(long id, Term replacement, IdSource ids);

    boolean alphaEq(Term other, Map<Long, Long> renames);

    default boolean alphaEq(Term other) {
        return alphaEq(other, new HashMap<>());
    }

    JSONObject toJson();

    record Var(String name, long id, boolean bound) implements Term {
        public Var {
            requireNonNull(name);
        }

        public static Var of(String name, IdSource ids) {
            return new Var(name, ids.next(), false);
        }

        @Override
        public String toLambda() {
            return name;
        }

        @Override
        public Term bind(Var binder) throws LambdaException.Rebinding {
            if (!name.equals(binder.name)) return this;
            if (bound) throw new LambdaException.Rebinding(name);
            return new Var(name, binder.id, true);
        }

        @Override
        public Term subst(long id, Term replacement, IdSource ids) {
            return this.id == id ? fresh(replacement, ids) : this;
        }

        @Override
        public boolean alphaEq(Term other, Map<Long, Long> renames) {
            if (!(other instanceof Var o)) return false;
            var lesser = Math.min(id, o.id);
            var greater = Math.max(id, o.id);
            return Objects.equals(renames.get(lesser), greater);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "variable")
                    .put("name", name)
                    .put("id", id)
                    .put("bound", bound);
        }

        @Override
        public String toString() {
            return name + '#' + id;
        }
    }

    record Abs(Var param, Term body) implements Term {
        public Abs {
            requireNonNull(param);
            requireNonNull(body);
        }

        /**
         * Builds an abstraction and binds the free occurrences of {@code param}'s name
         * in {@code body} to it.
         */
        public static Abs of(Var param, Term body) throws LambdaException.Rebinding {
            return new Abs(param, body.bind(param));
        }

        @Override
        public String toLambda() {
            return "λ" + param.toLambda() + "." + body.toLambda();
        }

        @Override
        public boolean bound() {
            return body.bound();
        }

        @Override
        public Term bind(Var binder) throws LambdaException.Rebinding {
            // the inner abstraction owns its occurrences
            if (param.name().equals(binder.name())) return this;
            var b = body.bind(binder);
            return b == body ? this : new Abs(param, b);
        }

        @Override
        public Term subst(long id, Term replacement, IdSource ids) {
            var b = body.subst(id, replacement, ids);
            return b == body ? this : new Abs(param, b);
        }

        @Override
        public boolean alphaEq(Term other, Map<Long, Long> renames) {
            if (!(other instanceof Abs o)) return false;
            var scoped = new HashMap<>(renames);
            scoped.put(Math.min(param.id(), o.param.id()), Math.max(param.id(), o.param.id()));
            return body.alphaEq(o.body, scoped);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "abstraction")
                    .put("param", param.toJson())
                    .put("body", body.toJson());
        }

        @Override
        public String toString() {
            return toLambda();
        }
    }

    record App(Term function, Term argument) implements Term {
        public App {
            requireNonNull(function);
            requireNonNull(argument);
        }

        @Override
        public String toLambda() {
            var f = function.toLambda();
            var a = argument.toLambda();
            if (function instanceof Abs) f = '(' + f + ')';
            if (!(argument instanceof Var)) a = '(' + a + ')';
            return f + a;
        }

        @Override
        public boolean bound() {
            return function.bound() && argument.bound();
        }

        @Override
        public Term bind(Var binder) throws LambdaException.Rebinding {
            var f = function.bind(binder);
            var a = argument.bind(binder);
            return f == function && a == argument ? this : new App(f, a);
        }

        @Override
        public Term subst(long id, Term replacement, IdSource ids) {
            var f = function.subst(id, replacement, ids);
            var a = argument.subst(id, replacement, ids);
            return f == function && a == argument ? this : new App(f, a);
        }

        @Override
        public boolean alphaEq(Term other, Map<Long, Long> renames) {
            return other instanceof App o
                    && function.alphaEq(o.function, renames)
                    && argument.alphaEq(o.argument, renames);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "application")
                    .put("function", function.toJson())
                    .put("argument", argument.toJson());
        }

        @Override
        public String toString() {
            return toLambda();
        }
    }
}
