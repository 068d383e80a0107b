package dumb.lambdacalc;

import dumb.lambdacalc.util.Json;
import dumb.lambdacalc.util.Log;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One evaluation context: its own identity source, abbreviation table and reducer.
 * Not thread-safe; use one session per thread.
 */
public class Session {
    public static final String PRELUDE_RESOURCE = "/prelude.lc";
    private static final String COMMENT_PREFIX = "#";

    public final IdSource ids;
    public final Shorthands shorthands;
    public final Reducer reducer;
    public final Recognizer recognizer;
    public final Configuration config;

    public Session() {
        this(new Configuration());
    }

    public Session(Configuration config) {
        this(config, new IdSource());
    }

    public Session(Configuration config, IdSource ids) {
        this.config = requireNonNull(config);
        this.ids = requireNonNull(ids);
        this.shorthands = new Shorthands();
        this.reducer = new Reducer(ids);
        this.recognizer = new Recognizer(shorthands);
        Log.debug(() -> "Session configuration: " + Json.str(config));
    }

    private static boolean skippable(String line) {
        var s = line.strip();
        return s.isEmpty() || s.startsWith(COMMENT_PREFIX);
    }

    public Statement parse(String text) throws LambdaException {
        return Parser.parse(text, shorthands, ids);
    }

    /**
     * Parses a term; a definition is rejected.
     */
    public Term term(String text) throws LambdaException {
        var s = parse(text);
        if (s instanceof Term t) return t;
        throw new LambdaException.IncompleteParse("expected a term, not a definition: " + text);
    }

    public Definition define(String text) throws LambdaException {
        var s = parse(text);
        if (!(s instanceof Definition d))
            throw new LambdaException.IncompleteParse("expected a definition: " + text);
        register(d);
        return d;
    }

    /**
     * Feeds definitions, one per line. Blank lines and {@code #} comments are skipped.
     */
    public void load(Iterable<String> lines) throws LambdaException {
        for (var line : lines)
            if (!skippable(line)) define(line);
    }

    public void loadPrelude() throws IOException, LambdaException {
        var in = Session.class.getResourceAsStream(PRELUDE_RESOURCE);
        if (in == null) throw new IOException("Missing resource " + PRELUDE_RESOURCE);
        List<String> lines;
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            lines = reader.lines().toList();
        }
        load(lines);
        Log.debug("Loaded " + shorthands.size() + " prelude shorthands");
    }

    /**
     * Parses one line and either registers the definition it holds or reduces the
     * term it holds, within the configured step budget.
     */
    public Evaluation evaluate(String text) throws LambdaException {
        var s = parse(text);
        if (s instanceof Definition d) {
            register(d);
            return new Evaluation.Defined(d);
        }
        var term = (Term) s;
        if (!term.bound()) throw new LambdaException.NotFullyBound(term);
        var result = reducer.reduce(term, config.maxSteps());
        var report = result.truncated() ? null : recognizer.recognize(result.last());
        return new Evaluation.Reduced(result, report, config.maxSteps());
    }

    private void register(Definition d) {
        if (shorthands.contains(d.name)) Log.debug("Redefining " + Shorthands.display(d.name));
        shorthands.define(d);
    }
}
