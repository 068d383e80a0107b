package dumb.lambdacalc;

/** What a line of input parses to: a term to reduce, or a shorthand definition. */
sealed public interface Statement permits Term, Definition {
}
