package maestro.coordinator.config;

import maestro.coordinator.error.ConfigException;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/maestro;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 3000;
    private String serverHost = "0.0.0.0";

    // Event settings
    private int eventParallelism = 4;

    // Concurrency settings
    private int lockStripes = 64;

    // Work queue settings
    private Duration defaultClaimTimeout = Duration.ofSeconds(30);
    private Duration maxClaimTimeout = Duration.ofMinutes(10);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static CoordinatorConfig fromEnv(Map<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = env.get("MAESTRO_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String host = env.get("MAESTRO_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        config.serverPort = intValue(env, "MAESTRO_PORT", config.serverPort);
        config.databasePoolSize = intValue(env, "MAESTRO_DB_POOL_SIZE", config.databasePoolSize);
        config.eventParallelism = intValue(env, "MAESTRO_EVENT_PARALLELISM", config.eventParallelism);

        config.defaultClaimTimeout = Duration.ofMillis(
                intValue(env, "MAESTRO_CLAIM_TIMEOUT_MS", (int) config.defaultClaimTimeout.toMillis()));
        config.maxClaimTimeout = Duration.ofMillis(
                intValue(env, "MAESTRO_MAX_CLAIM_TIMEOUT_MS", (int) config.maxClaimTimeout.toMillis()));

        return config;
    }

    private static int intValue(Map<String, String> env, String name, int fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new ConfigException(name + " must be positive, got " + value);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " is not a number: '" + raw + "'", e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int eventParallelism() {
        return eventParallelism;
    }

    public int lockStripes() {
        return lockStripes;
    }

    public Duration defaultClaimTimeout() {
        return defaultClaimTimeout;
    }

    public Duration maxClaimTimeout() {
        return maxClaimTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withEventParallelism(int parallelism) {
        this.eventParallelism = parallelism;
        return this;
    }

    public CoordinatorConfig withDefaultClaimTimeout(Duration timeout) {
        this.defaultClaimTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMaxClaimTimeout(Duration timeout) {
        this.maxClaimTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", eventParallelism=" + eventParallelism +
                ", maxClaimTimeout=" + maxClaimTimeout +
                '}';
    }
}
