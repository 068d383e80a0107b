package dumb.lambdacalc;

import dumb.lambdacalc.util.Log;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static dumb.lambdacalc.util.Log.error;
import static java.util.Objects.requireNonNull;

public class Repl {
    public static final String PROMPT = "λ> ";
    static final String NESTING_ERROR = "StackOverflowError: term is nested too deeply to process";
    private final Session session;
    private final BufferedReader in;
    private final PrintStream out;
    private final boolean prompt;

    public Repl(Session session, BufferedReader in, PrintStream out, boolean prompt) {
        this.session = requireNonNull(session);
        this.in = requireNonNull(in);
        this.out = requireNonNull(out);
        this.prompt = prompt;
    }

    public static void main(String[] args) {
        Path configFile = null;
        Integer maxSteps = null;
        Boolean showAst = null;
        Boolean prelude = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "-n", "--max-steps" -> maxSteps = Integer.parseInt(args[++i]);
                    case "--show-ast" -> showAst = true;
                    case "--no-prelude" -> prelude = false;
                    case "-h", "--help" -> {
                        printUsage();
                        return;
                    }
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                error(String.format("Error parsing argument for %s: %s", args[i - 1], e.getMessage()));
                printUsage();
                System.exit(1);
            }
        }

        Session session;
        try {
            var config = Configuration.load(configFile);
            if (maxSteps != null) config = config.withMaxSteps(maxSteps);
            if (showAst != null) config = config.withShowAst(showAst);
            if (prelude != null) config = config.withPrelude(prelude);
            session = new Session(config);
            if (config.prelude()) session.loadPrelude();
            Log.message("Ready with " + session.shorthands.size() + " shorthands, step budget " + config.maxSteps());
        } catch (IOException | LambdaException | IllegalArgumentException e) {
            error("Startup failed: " + e.getMessage(), e);
            System.exit(1);
            return;
        }

        var stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var stdout = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        try {
            new Repl(session, stdin, stdout, System.console() != null).run();
        } catch (IOException e) {
            error("Error reading input: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: lambdacalc [options]
                  -c, --config <file>     JSON configuration (default: bundled lambdacalc.json)
                  -n, --max-steps <n>     reduction step budget per input
                      --show-ast          print the structure of every term
                      --no-prelude        start without the built-in shorthands
                  -h, --help              show this help""");
    }

    /** The ASCII backslash stands in for λ. */
    static String normalize(String line) {
        return line.replace('\\', 'λ');
    }

    /** Reads and evaluates lines until end of input. */
    public void run() throws IOException {
        while (true) {
            if (prompt) {
                out.print(PROMPT);
                out.flush();
            }
            var line = in.readLine();
            if (line == null) return;
            handle(line);
        }
    }

    /**
     * Evaluates one line and prints the outcome, or the error if it fails.
     */
    void handle(@Nullable String line) {
        if (line == null || line.isBlank()) return;
        try {
            var evaluation = session.evaluate(normalize(line));
            evaluation.lines(session.config.showAst()).forEach(out::println);
        } catch (LambdaException e) {
            out.println(e.kind() + ": " + e.getMessage());
        } catch (StackOverflowError e) {
            Log.debug("Stack exhausted on input of length " + line.length());
            out.println(NESTING_ERROR);
        }
    }
}
