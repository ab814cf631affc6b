package apprunner.balancer.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration holder for balancer settings.
 * All settings have sensible defaults.
 */
public final class BalancerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:mem:apprunner;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Worker pool
    private List<String> workers = new ArrayList<>();
    private Duration workerTimeout = Duration.ofSeconds(10);
    private boolean retryOnBusy = true;

    // Registry housekeeping
    private Duration registryTtl = Duration.ofMinutes(30);
    private Duration registryMaxAge = Duration.ofHours(24);
    private Duration registryReaperInterval = Duration.ofMinutes(1);

    private BalancerConfig() {
    }

    public static BalancerConfig defaults() {
        return new BalancerConfig();
    }

    public static BalancerConfig fromEnv() {
        BalancerConfig config = new BalancerConfig();

        // Override from environment variables
        String dbUrl = System.getenv("APPRUNNER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("APPRUNNER_BALANCER_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String workers = System.getenv("APPRUNNER_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workers = parseWorkers(workers);
        }

        String timeout = System.getenv("APPRUNNER_WORKER_TIMEOUT_MS");
        if (timeout != null && !timeout.isBlank()) {
            config.workerTimeout = Duration.ofMillis(Long.parseLong(timeout));
        }

        String retry = System.getenv("APPRUNNER_RETRY_ON_BUSY");
        if (retry != null && !retry.isBlank()) {
            config.retryOnBusy = Boolean.parseBoolean(retry.trim());
        }

        String ttl = System.getenv("APPRUNNER_REGISTRY_TTL_SEC");
        if (ttl != null && !ttl.isBlank()) {
            config.registryTtl = Duration.ofSeconds(Long.parseLong(ttl));
        }

        return config;
    }

    static List<String> parseWorkers(String value) {
        List<String> parsed = new ArrayList<>();
        for (String part : value.split(",")) {
            String url = part.trim();
            if (url.isEmpty()) {
                continue;
            }
            while (url.endsWith("/")) {
                url = url.substring(0, url.length() - 1);
            }
            parsed.add(url);
        }
        return parsed;
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

    /** Worker base URLs; each doubles as the worker's id */
    public List<String> workers() {
        return List.copyOf(workers);
    }

    public Duration workerTimeout() {
        return workerTimeout;
    }

    public boolean retryOnBusy() {
        return retryOnBusy;
    }

    public Duration registryTtl() {
        return registryTtl;
    }

    public Duration registryMaxAge() {
        return registryMaxAge;
    }

    public Duration registryReaperInterval() {
        return registryReaperInterval;
    }

    // Fluent setters for testing/customization
    public BalancerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public BalancerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public BalancerConfig withWorkers(List<String> workers) {
        this.workers = new ArrayList<>(workers);
        return this;
    }

    public BalancerConfig withWorkerTimeout(Duration timeout) {
        this.workerTimeout = timeout;
        return this;
    }

    public BalancerConfig withRetryOnBusy(boolean retryOnBusy) {
        this.retryOnBusy = retryOnBusy;
        return this;
    }

    public BalancerConfig withRegistryTtl(Duration ttl) {
        this.registryTtl = ttl;
        return this;
    }

    public BalancerConfig withRegistryMaxAge(Duration maxAge) {
        this.registryMaxAge = maxAge;
        return this;
    }

    @Override
    public String toString() {
        return "BalancerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workers=" + workers +
                ", retryOnBusy=" + retryOnBusy +
                ", registryTtl=" + registryTtl +
                '}';
    }
}
