package com.glyphforge.infra.config;

import com.glyphforge.api.model.MatchResult;
import com.glyphforge.grid.fill.Connectivity;

import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration for a recognition run.
 *
 * <p><b>Environment Variable Override:</b>
 * {@link #fromEnvironment()} lets every property be overridden via an environment
 * variable, or a system property of the same name, using the pattern
 * {@code GLYPHFORGE_<PROPERTY_NAME>}:
 * <pre>
 * GLYPHFORGE_CONNECTIVITY=8
 * GLYPHFORGE_BOUNDARY_CHARS=+-|
 * GLYPHFORGE_MIN_COMPONENT_SIZE=2
 * GLYPHFORGE_MAX_DEPTH=6
 * GLYPHFORGE_FATAL_TRAPS=true
 * GLYPHFORGE_MAX_GRID_CELLS=250000
 * GLYPHFORGE_TOOLKIT=swing
 * GLYPHFORGE_MERGE_WORD_GAPS=false
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RecognitionConfig config = RecognitionConfig.builder()
 *     .connectivity(Connectivity.EIGHT)
 *     .maxDepth(6)
 *     .build();
 * }</pre>
 */
public final class RecognitionConfig {

    private static final Logger logger = Logger.getLogger(RecognitionConfig.class.getName());

    private static final String ENV_CONNECTIVITY = "GLYPHFORGE_CONNECTIVITY";
    private static final String ENV_BOUNDARY_CHARS = "GLYPHFORGE_BOUNDARY_CHARS";
    private static final String ENV_WHITESPACE_CHARS = "GLYPHFORGE_WHITESPACE_CHARS";
    private static final String ENV_MIN_COMPONENT_SIZE = "GLYPHFORGE_MIN_COMPONENT_SIZE";
    private static final String ENV_MAX_DEPTH = "GLYPHFORGE_MAX_DEPTH";
    private static final String ENV_FATAL_TRAPS = "GLYPHFORGE_FATAL_TRAPS";
    private static final String ENV_MAX_GRID_CELLS = "GLYPHFORGE_MAX_GRID_CELLS";
    private static final String ENV_TOOLKIT = "GLYPHFORGE_TOOLKIT";
    private static final String ENV_MERGE_WORD_GAPS = "GLYPHFORGE_MERGE_WORD_GAPS";

    public static final String DEFAULT_BOUNDARY_CHARS = "+-|/\\*#=";
    public static final String DEFAULT_WHITESPACE_CHARS = " \t";

    private final Connectivity connectivity;
    private final String boundaryChars;
    private final String whitespaceChars;
    private final int minComponentSize;
    private final int maxDepth;
    private final boolean fatalTraps;
    private final int maxGridCells;
    private final String defaultToolkit;
    private final boolean mergeWordGaps;

    private RecognitionConfig(Builder builder) {
        this.connectivity = builder.connectivity;
        this.boundaryChars = builder.boundaryChars;
        this.whitespaceChars = builder.whitespaceChars;
        this.minComponentSize = builder.minComponentSize;
        this.maxDepth = builder.maxDepth;
        this.fatalTraps = builder.fatalTraps;
        this.maxGridCells = builder.maxGridCells;
        this.defaultToolkit = builder.defaultToolkit;
        this.mergeWordGaps = builder.mergeWordGaps;
        validate();
    }

    public static RecognitionConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by {@code GLYPHFORGE_*} environment variables or system properties.
     */
    public static RecognitionConfig fromEnvironment() {
        return builder().applyEnvironment().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.connectivity = connectivity;
        builder.boundaryChars = boundaryChars;
        builder.whitespaceChars = whitespaceChars;
        builder.minComponentSize = minComponentSize;
        builder.maxDepth = maxDepth;
        builder.fatalTraps = fatalTraps;
        builder.maxGridCells = maxGridCells;
        builder.defaultToolkit = defaultToolkit;
        builder.mergeWordGaps = mergeWordGaps;
        return builder;
    }

    private void validate() {
        if (boundaryChars.isEmpty()) {
            throw new IllegalArgumentException("boundaryChars must not be empty");
        }
        for (char c : boundaryChars.toCharArray()) {
            if (whitespaceChars.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Character '" + c + "' is both boundary and whitespace");
            }
        }
        if (minComponentSize < 1) {
            throw new IllegalArgumentException("minComponentSize must be at least 1: " + minComponentSize);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        if (maxGridCells <= 0) {
            throw new IllegalArgumentException("maxGridCells must be positive: " + maxGridCells);
        }
        if (defaultToolkit == null || defaultToolkit.isBlank()) {
            throw new IllegalArgumentException("defaultToolkit must not be blank");
        }
    }

    public Connectivity connectivity() {
        return connectivity;
    }

    public String boundaryChars() {
        return boundaryChars;
    }

    public String whitespaceChars() {
        return whitespaceChars;
    }

    public boolean isBoundary(char c) {
        return boundaryChars.indexOf(c) >= 0;
    }

    public boolean isWhitespace(char c) {
        return whitespaceChars.indexOf(c) >= 0;
    }

    public int minComponentSize() {
        return minComponentSize;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** Fixed; a match needs confidence strictly above this value. */
    public double matchThreshold() {
        return MatchResult.MATCH_THRESHOLD;
    }

    public boolean fatalTraps() {
        return fatalTraps;
    }

    public int maxGridCells() {
        return maxGridCells;
    }

    public String defaultToolkit() {
        return defaultToolkit;
    }

    public boolean mergeWordGaps() {
        return mergeWordGaps;
    }

    @Override
    public String toString() {
        return "RecognitionConfig{connectivity=" + connectivity
            + ", boundaryChars='" + boundaryChars + '\''
            + ", minComponentSize=" + minComponentSize
            + ", maxDepth=" + maxDepth
            + ", fatalTraps=" + fatalTraps
            + ", maxGridCells=" + maxGridCells
            + ", defaultToolkit='" + defaultToolkit + '\''
            + ", mergeWordGaps=" + mergeWordGaps + '}';
    }

    public static final class Builder {
        private Connectivity connectivity = Connectivity.FOUR;
        private String boundaryChars = DEFAULT_BOUNDARY_CHARS;
        private String whitespaceChars = DEFAULT_WHITESPACE_CHARS;
        private int minComponentSize = 1;
        private int maxDepth = 5;
        private boolean fatalTraps = false;
        private int maxGridCells = 1_000_000;
        private String defaultToolkit = "tkinter";
        private boolean mergeWordGaps = true;

        private Builder() {
        }

        public Builder connectivity(Connectivity connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        public Builder boundaryChars(String boundaryChars) {
            this.boundaryChars = boundaryChars;
            return this;
        }

        public Builder whitespaceChars(String whitespaceChars) {
            this.whitespaceChars = whitespaceChars;
            return this;
        }

        public Builder minComponentSize(int minComponentSize) {
            this.minComponentSize = minComponentSize;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder fatalTraps(boolean fatalTraps) {
            this.fatalTraps = fatalTraps;
            return this;
        }

        public Builder maxGridCells(int maxGridCells) {
            this.maxGridCells = maxGridCells;
            return this;
        }

        public Builder defaultToolkit(String defaultToolkit) {
            this.defaultToolkit = defaultToolkit;
            return this;
        }

        public Builder mergeWordGaps(boolean mergeWordGaps) {
            this.mergeWordGaps = mergeWordGaps;
            return this;
        }

        /**
         * Applies {@code GLYPHFORGE_*} overrides. Malformed values are logged and ignored.
         */
        public Builder applyEnvironment() {
            getEnvParsed(ENV_CONNECTIVITY, Integer::parseInt).ifPresent(val -> {
                try {
                    this.connectivity = Connectivity.of(val);
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid value for " + ENV_CONNECTIVITY + ": " + val);
                }
            });
            getEnv(ENV_BOUNDARY_CHARS).ifPresent(val -> this.boundaryChars = val);
            getEnv(ENV_WHITESPACE_CHARS).ifPresent(val -> this.whitespaceChars = val);
            getEnvParsed(ENV_MIN_COMPONENT_SIZE, Integer::parseInt).ifPresent(val -> this.minComponentSize = val);
            getEnvParsed(ENV_MAX_DEPTH, Integer::parseInt).ifPresent(val -> this.maxDepth = val);
            getEnv(ENV_FATAL_TRAPS).ifPresent(val -> this.fatalTraps = Boolean.parseBoolean(val));
            getEnvParsed(ENV_MAX_GRID_CELLS, Integer::parseInt).ifPresent(val -> this.maxGridCells = val);
            getEnv(ENV_TOOLKIT).ifPresent(val -> this.defaultToolkit = val);
            getEnv(ENV_MERGE_WORD_GAPS).ifPresent(val -> this.mergeWordGaps = Boolean.parseBoolean(val));
            return this;
        }

        public RecognitionConfig build() {
            return new RecognitionConfig(this);
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.isEmpty()) {
                value = System.getProperty(key);
            }
            return Optional.ofNullable(value).filter(v -> !v.isEmpty());
        }

        private static <T> Optional<T> getEnvParsed(String key, Function<String, T> parser) {
            return getEnv(key).map(val -> {
                try {
                    return parser.apply(val.trim());
                } catch (NumberFormatException e) {
                    logger.warning("Invalid value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
