package dumb.lambdacalc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.lambdacalc.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("maxSteps") int maxSteps,
        @JsonProperty("showAst") boolean showAst,
        @JsonProperty("prelude") boolean prelude
) {
    public static final String DEFAULTS_RESOURCE = "/lambdacalc.json";
    public static final int DEFAULT_MAX_STEPS = 1000;
    public static final boolean DEFAULT_SHOW_AST = false;
    public static final boolean DEFAULT_PRELUDE = true;

    public Configuration {
        if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must be >= 0: " + maxSteps);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("maxSteps") Integer maxSteps,
            @JsonProperty("showAst") Boolean showAst,
            @JsonProperty("prelude") Boolean prelude
    ) {
        this(
                maxSteps != null ? maxSteps : DEFAULT_MAX_STEPS,
                showAst != null ? showAst : DEFAULT_SHOW_AST,
                prelude != null ? prelude : DEFAULT_PRELUDE
        );
    }

    public Configuration() {
        this(DEFAULT_MAX_STEPS, DEFAULT_SHOW_AST, DEFAULT_PRELUDE);
    }

    /**
     * Reads {@code file}, or the bundled defaults when it is null.
     */
    public static Configuration load(@Nullable Path file) throws IOException {
        if (file != null) return parse(Files.readString(file, StandardCharsets.UTF_8));
        try (InputStream in = Configuration.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) return new Configuration();
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    public static Configuration parse(String json) throws IOException {
        return Json.obj(json, Configuration.class);
    }

    public Configuration withMaxSteps(int maxSteps) {
        return new Configuration(maxSteps, showAst, prelude);
    }

    public Configuration withShowAst(boolean showAst) {
        return new Configuration(maxSteps, showAst, prelude);
    }

    public Configuration withPrelude(boolean prelude) {
        return new Configuration(maxSteps, showAst, prelude);
    }
}
