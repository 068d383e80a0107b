package dumb.lambdacalc;

/**
 * Everything that can go wrong between a line of text and a reduced term. Raised where
 * detected and never recovered internally; the front end prints {@link #kind()} and
 * the message, then carries on.
 */
public abstract class LambdaException extends Exception {

    protected LambdaException(String message) {
        super(message);
    }

    public String kind() {
        return getClass().getSimpleName() + "Error";
    }

    public static class MalformedInput extends LambdaException {
        private final int col;
        private final String context;

        public MalformedInput(String message) {
            this(message, -1, "");
        }

        public MalformedInput(String message, int col, String context) {
            super(message);
            this.col = col;
            this.context = context;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = col != -1 ? " at col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }

    public static class IncompleteParse extends LambdaException {
        public IncompleteParse(String message) {
            super(message);
        }
    }

    public static class Rebinding extends LambdaException {
        public final String name;

        public Rebinding(String name) {
            super(name + " is already bound");
            this.name = name;
        }
    }

    public static class NotFullyBound extends LambdaException {
        public NotFullyBound(Term term) {
            super("Input is not fully bound: " + term.toLambda());
        }
    }

    public static class UndefinedShorthand extends LambdaException {
        public final String name;

        public UndefinedShorthand(String name) {
            super("undefined shorthand " + Shorthands.display(name));
            this.name = name;
        }
    }

    public static class ReservedName extends LambdaException {
        public final String name;

        public ReservedName(String name) {
            super("Church numerals cannot be redefined: " + Shorthands.display(name));
            this.name = name;
        }
    }

    public static class UnclosedTerm extends LambdaException {
        public final String name;

        public UnclosedTerm(String name, Term term) {
            super("Shorthands may only have fully bound terms: " + Shorthands.display(name) + "=" + term.toLambda());
            this.name = name;
        }
    }
}
