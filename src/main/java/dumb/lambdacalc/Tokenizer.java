package dumb.lambdacalc;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scans one source string into tokens, one per {@link #next()} call.
 */
public class Tokenizer {
    private static final int CONTEXT_RADIUS = 10;
    private final String text;
    private int pos = 0;

    public Tokenizer(String text) {
        this.text = text;
    }

    public static List<Token> tokenize(String text) throws LambdaException.MalformedInput {
        var tokenizer = new Tokenizer(text);
        var tokens = new ArrayList<Token>();
        Token t;
        while ((t = tokenizer.next()) != null)
            tokens.add(t);
        return tokens;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /**
     * @return the next token, or null once the input is used up
     */
    @Nullable
    public Token next() throws LambdaException.MalformedInput {
        skipWhitespace();
        if (pos >= text.length()) return null;

        var c = text.codePointAt(pos);
        var control = Token.Control.of(c);
        if (control != null) {
            pos += Character.charCount(c);
            return control;
        }
        if (c == '{') return shorthand();
        if (c == '}') throw malformed("Unexpected '}'");
        if (isDigit(c)) {
            var start = pos;
            while (pos < text.length() && isDigit(text.charAt(pos))) pos++;
            return new Token.Shorthand(text.substring(start, pos));
        }
        pos += Character.charCount(c);
        return new Token.Ident(new String(Character.toChars(c)));
    }

    private Token shorthand() throws LambdaException.MalformedInput {
        var close = text.indexOf('}', pos + 1);
        if (close < 0) throw malformed("Unterminated shorthand reference");
        if (close == pos + 1) throw malformed("Empty shorthand reference");
        var name = text.substring(pos + 1, close).toUpperCase(Locale.ROOT);
        pos = close + 1;
        return new Token.Shorthand(name);
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            var c = text.codePointAt(pos);
            if (!Character.isWhitespace(c)) return;
            pos += Character.charCount(c);
        }
    }

    private LambdaException.MalformedInput malformed(String message) {
        var from = Math.max(0, pos - CONTEXT_RADIUS);
        var to = Math.min(text.length(), pos + CONTEXT_RADIUS);
        return new LambdaException.MalformedInput("malformed input: " + message, pos, text.substring(from, to));
    }
}
