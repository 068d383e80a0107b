package dumb.lambdacalc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Abbreviation table. Names are stored upper-cased, as the tokenizer produces them,
 * and iterate in definition order.
 */
public class Shorthands {
    private final Map<String, Term> terms = new LinkedHashMap<>();

    public static String display(String name) {
        return '{' + name + '}';
    }

    public void define(Definition d) {
        requireNonNull(d);
        terms.put(d.name, d.term);
    }

    public Optional<Term> get(String name) {
        return Optional.ofNullable(terms.get(name));
    }

    public boolean contains(String name) {
        return terms.containsKey(name);
    }

    public Map<String, Term> entries() {
        return Collections.unmodifiableMap(terms);
    }

    public int size() {
        return terms.size();
    }
}
