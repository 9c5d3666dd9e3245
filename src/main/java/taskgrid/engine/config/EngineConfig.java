package taskgrid.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import taskgrid.engine.dependency.DanglingDependencyPolicy;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Configuration holder for engine policies.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Retry policy
    private boolean autoRetryFailed = false;
    private int maxAttempts = 3;

    // Matcher policy
    private double emptyRequirementScore = 1.0;
    private double minMatchScore = 0.0; // exclusive
    private boolean caseInsensitiveCapabilities = true;

    // Dependency policy
    private DanglingDependencyPolicy danglingDependencyPolicy = DanglingDependencyPolicy.BLOCK;

    // Supervisor settings
    private Duration supervisorInterval = Duration.ofSeconds(30);
    private Duration defaultTaskTimeout = Duration.ZERO; // zero = no timeout

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String autoRetry = System.getenv("TASKGRID_AUTO_RETRY");
        if (autoRetry != null && !autoRetry.isBlank()) {
            config.autoRetryFailed = Boolean.parseBoolean(autoRetry.trim());
        }

        String maxAttempts = System.getenv("TASKGRID_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String minScore = System.getenv("TASKGRID_MIN_MATCH_SCORE");
        if (minScore != null && !minScore.isBlank()) {
            config.minMatchScore = Double.parseDouble(minScore.trim());
        }

        String dangling = System.getenv("TASKGRID_DANGLING_DEPENDENCIES");
        if (dangling != null && !dangling.isBlank()) {
            config.danglingDependencyPolicy = parsePolicy(dangling);
        }

        String timeout = System.getenv("TASKGRID_TASK_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.defaultTaskTimeout = Duration.ofSeconds(Long.parseLong(timeout.trim()));
        }

        return config;
    }

    /**
     * Load settings from an INI file. Sections [ENGINE], [MATCHER] and
     * [SUPERVISOR] are optional; missing keys keep their defaults.
     *
     * @throws IOException if the file cannot be read
     */
    public static EngineConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        EngineConfig config = new EngineConfig();

        Profile.Section engine = ini.get("ENGINE");
        Profile.Section matcher = ini.get("MATCHER");
        Profile.Section supervisor = ini.get("SUPERVISOR");

        String v;
        if ((v = opt(engine, "auto_retry")) != null) config.autoRetryFailed = Boolean.parseBoolean(v);
        if ((v = opt(engine, "max_attempts")) != null) config.maxAttempts = Integer.parseInt(v);
        if ((v = opt(engine, "dangling_dependencies")) != null) config.danglingDependencyPolicy = parsePolicy(v);

        if ((v = opt(matcher, "empty_requirement_score")) != null) config.emptyRequirementScore = Double.parseDouble(v);
        if ((v = opt(matcher, "min_score")) != null) config.minMatchScore = Double.parseDouble(v);
        if ((v = opt(matcher, "case_insensitive")) != null) config.caseInsensitiveCapabilities = Boolean.parseBoolean(v);

        if ((v = opt(supervisor, "interval_seconds")) != null) config.supervisorInterval = Duration.ofSeconds(Long.parseLong(v));
        if ((v = opt(supervisor, "task_timeout_seconds")) != null) config.defaultTaskTimeout = Duration.ofSeconds(Long.parseLong(v));

        config.validate();
        return config;
    }

    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static DanglingDependencyPolicy parsePolicy(String value) {
        try {
            return DanglingDependencyPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown dangling dependency policy: " + value, e);
        }
    }

    /**
     * Reject values no policy can work with.
     */
    public EngineConfig validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (emptyRequirementScore < 0 || emptyRequirementScore > 1) {
            throw new IllegalArgumentException("emptyRequirementScore must be within [0, 1]");
        }
        if (minMatchScore < 0 || minMatchScore >= 1) {
            throw new IllegalArgumentException("minMatchScore must be within [0, 1)");
        }
        if (supervisorInterval.isNegative() || supervisorInterval.isZero()) {
            throw new IllegalArgumentException("supervisorInterval must be positive");
        }
        if (defaultTaskTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTaskTimeout must not be negative");
        }
        return this;
    }

    // Getters
    public boolean autoRetryFailed() {
        return autoRetryFailed;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public double emptyRequirementScore() {
        return emptyRequirementScore;
    }

    public double minMatchScore() {
        return minMatchScore;
    }

    public boolean caseInsensitiveCapabilities() {
        return caseInsensitiveCapabilities;
    }

    public DanglingDependencyPolicy danglingDependencyPolicy() {
        return danglingDependencyPolicy;
    }

    public Duration supervisorInterval() {
        return supervisorInterval;
    }

    public Duration defaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    // Fluent setters for testing/customization
    public EngineConfig withAutoRetry(boolean autoRetry) {
        this.autoRetryFailed = autoRetry;
        return this;
    }

    public EngineConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public EngineConfig withEmptyRequirementScore(double score) {
        this.emptyRequirementScore = score;
        return this;
    }

    public EngineConfig withMinMatchScore(double score) {
        this.minMatchScore = score;
        return this;
    }

    public EngineConfig withCaseInsensitiveCapabilities(boolean caseInsensitive) {
        this.caseInsensitiveCapabilities = caseInsensitive;
        return this;
    }

    public EngineConfig withDanglingDependencyPolicy(DanglingDependencyPolicy policy) {
        this.danglingDependencyPolicy = policy;
        return this;
    }

    public EngineConfig withSupervisorInterval(Duration interval) {
        this.supervisorInterval = interval;
        return this;
    }

    public EngineConfig withDefaultTaskTimeout(Duration timeout) {
        this.defaultTaskTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "autoRetry=" + autoRetryFailed +
                ", maxAttempts=" + maxAttempts +
                ", minMatchScore=" + minMatchScore +
                ", danglingDependencies=" + danglingDependencyPolicy +
                ", taskTimeout=" + defaultTaskTimeout +
                '}';
    }
}
