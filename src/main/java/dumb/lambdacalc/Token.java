package dumb.lambdacalc;

import static java.util.Objects.requireNonNull;

sealed public interface Token permits Token.Control, Token.Shorthand, Token.Ident {

    static boolean isNumeral(String name) {
        return !name.isEmpty() && name.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    String text();

    enum Control implements Token {
        LPAREN("("), RPAREN(")"), LAMBDA("λ"), DOT("."), EQUALS("=");

        private final String text;

        Control(String text) {
            this.text = text;
        }

        static Control of(int c) {
            return switch (c) {
                case '(' -> LPAREN;
                case ')' -> RPAREN;
                case 'λ' -> LAMBDA;
                case '.' -> DOT;
                case '=' -> EQUALS;
                default -> null;
            };
        }

        @Override
        public String text() {
            return text;
        }
    }

    /** {@code {NAME}} or a bare numeral; the name is upper-cased. */
    record Shorthand(String name) implements Token {
        public Shorthand {
            requireNonNull(name);
        }

        public boolean numeral() {
            return isNumeral(name);
        }

        @Override
        public String text() {
            return numeral() ? name : Shorthands.display(name);
        }
    }

    record Ident(String name) implements Token {
        public Ident {
            requireNonNull(name);
        }

        @Override
        public String text() {
            return name;
        }
    }
}
