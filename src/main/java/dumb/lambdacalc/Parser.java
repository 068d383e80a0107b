package dumb.lambdacalc;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static dumb.lambdacalc.Token.Control.*;
import static java.util.Objects.requireNonNull;

/**
 * Shift-reduce parser with one token of lookahead. Each step tries, in order:
 * <ol>
 *     <li>{@code ( Term )} to {@code Term}</li>
 *     <li>{@code Term Term} to an application</li>
 *     <li>{@code λ Var . Term} to an abstraction, when the lookahead is {@code )} or end of input</li>
 *     <li>{@code Shorthand = Term} to a definition, at end of input</li>
 *     <li>a shorthand not followed by {@code =} to its term</li>
 * </ol>
 * and shifts otherwise. The abstraction gate is what lets a lambda body extend as far
 * to the right as possible.
 */
public class Parser {
    private final Tokenizer tokens;
    private final Shorthands shorthands;
    private final IdSource ids;
    private final List<Object> stack = new ArrayList<>();
    @Nullable
    private Token lookahead;

    private Parser(Tokenizer tokens, Shorthands shorthands, IdSource ids) {
        this.tokens = requireNonNull(tokens);
        this.shorthands = requireNonNull(shorthands);
        this.ids = requireNonNull(ids);
    }

    public static Statement parse(String text, Shorthands shorthands, IdSource ids) throws LambdaException {
        return new Parser(new Tokenizer(text), shorthands, ids).parse();
    }

    public static Statement parse(String text, IdSource ids) throws LambdaException {
        return parse(text, new Shorthands(), ids);
    }

    private Statement parse() throws LambdaException {
        lookahead = tokens.next();
        while (true) {
            if (matches(LPAREN, Term.class, RPAREN)) {
                pop();
                var t = pop();
                pop();
                stack.add(t);
            } else if (matches(Term.class, Term.class)) {
                var argument = (Term) pop();
                var function = (Term) pop();
                stack.add(new Term.App(function, argument));
            } else if (matches(LAMBDA, Term.Var.class, DOT, Term.class) && (lookahead == null || lookahead == RPAREN)) {
                var body = (Term) pop();
                pop();
                var param = (Term.Var) pop();
                pop();
                stack.add(Term.Abs.of(param, body));
            } else if (matches(Token.Shorthand.class, EQUALS, Term.class) && lookahead == null) {
                var term = (Term) pop();
                pop();
                var s = (Token.Shorthand) pop();
                if (s.numeral()) throw new LambdaException.ReservedName(s.name());
                stack.add(Definition.of(s.name(), term));
            } else if (matches(Token.Shorthand.class) && lookahead != EQUALS) {
                stack.add(resolve((Token.Shorthand) pop()));
            } else {
                if (lookahead == null) break;
                stack.add(shift(lookahead));
                lookahead = tokens.next();
            }
        }
        if (stack.size() == 1 && stack.get(0) instanceof Statement s) return s;
        throw new LambdaException.IncompleteParse("incomplete parse: " + describeStack());
    }

    private Term resolve(Token.Shorthand s) throws LambdaException {
        if (s.numeral()) {
            try {
                return Church.numeral(Integer.parseInt(s.name()), ids);
            } catch (NumberFormatException e) {
                throw new LambdaException.MalformedInput("numeral out of range: " + s.name());
            }
        }
        var term = shorthands.get(s.name())
                .orElseThrow(() -> new LambdaException.UndefinedShorthand(s.name()));
        return Term.fresh(term, ids);
    }

    private Object shift(Token t) {
        return t instanceof Token.Ident i ? Term.Var.of(i.name(), ids) : t;
    }

    /**
     * Whether the top of the stack has the given shape. Each element is either a
     * {@link Token.Control} compared by identity or a class checked with isInstance.
     */
    private boolean matches(Object... shape) {
        var offset = stack.size() - shape.length;
        if (offset < 0) return false;
        for (var i = 0; i < shape.length; i++) {
            var elem = stack.get(offset + i);
            var expected = shape[i];
            var ok = expected instanceof Class<?> c ? c.isInstance(elem) : expected == elem;
            if (!ok) return false;
        }
        return true;
    }

    private Object pop() {
        return stack.remove(stack.size() - 1);
    }

    private String describeStack() {
        if (stack.isEmpty()) return "empty input";
        return stack.stream().map(o -> {
            if (o instanceof Term t) return t.toLambda();
            if (o instanceof Token t) return t.text();
            return o.toString();
        }).collect(Collectors.joining(" ", "[", "]"));
    }
}
