package apprunner.worker.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for worker settings.
 * All settings have sensible defaults.
 */
public final class WorkerConfig {

    // Server settings
    private String serverHost = "0.0.0.0";
    private int serverPort = 8081;
    private String workerId = null; // defaults to http://<host>:<port>

    // Filesystem
    private Path projectsIni = Path.of("projects", "projects.ini");
    private Path resultsDir = Path.of("results");
    private Path workDir = Path.of("work");
    private boolean inMemoryResults = false;

    // Housekeeping
    private Duration resultTtl = Duration.ofMinutes(30);
    private Duration runDeadline = Duration.ofMinutes(10); // zero disables the watchdog
    private Duration housekeepingInterval = Duration.ofSeconds(30);

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        WorkerConfig config = new WorkerConfig();

        String host = System.getenv("APPRUNNER_WORKER_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("APPRUNNER_WORKER_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String id = System.getenv("APPRUNNER_WORKER_ID");
        if (id != null && !id.isBlank()) {
            config.workerId = id;
        }

        String ini = System.getenv("APPRUNNER_PROJECTS_INI");
        if (ini != null && !ini.isBlank()) {
            config.projectsIni = Path.of(ini);
        }

        String results = System.getenv("APPRUNNER_RESULTS_DIR");
        if (results != null && !results.isBlank()) {
            config.resultsDir = Path.of(results);
        }

        String work = System.getenv("APPRUNNER_WORK_DIR");
        if (work != null && !work.isBlank()) {
            config.workDir = Path.of(work);
        }

        String store = System.getenv("APPRUNNER_RESULT_STORE");
        if (store != null && !store.isBlank()) {
            config.inMemoryResults = "memory".equalsIgnoreCase(store.trim());
        }

        String ttl = System.getenv("APPRUNNER_RESULT_TTL_SEC");
        if (ttl != null && !ttl.isBlank()) {
            config.resultTtl = Duration.ofSeconds(Long.parseLong(ttl));
        }

        String deadline = System.getenv("APPRUNNER_RUN_DEADLINE_SEC");
        if (deadline != null && !deadline.isBlank()) {
            config.runDeadline = Duration.ofSeconds(Long.parseLong(deadline));
        }

        return config;
    }

    // Getters
    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public String workerId() {
        if (workerId != null) {
            return workerId;
        }
        String host = "0.0.0.0".equals(serverHost) ? "localhost" : serverHost;
        return "http://" + host + ":" + serverPort;
    }

    public Path projectsIni() {
        return projectsIni;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    public Path workDir() {
        return workDir;
    }

    public boolean inMemoryResults() {
        return inMemoryResults;
    }

    public Duration resultTtl() {
        return resultTtl;
    }

    public Duration runDeadline() {
        return runDeadline;
    }

    public boolean hasRunDeadline() {
        return !runDeadline.isZero() && !runDeadline.isNegative();
    }

    public Duration housekeepingInterval() {
        return housekeepingInterval;
    }

    // Fluent setters for testing/customization
    public WorkerConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public WorkerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public WorkerConfig withWorkerId(String id) {
        this.workerId = id;
        return this;
    }

    public WorkerConfig withProjectsIni(Path ini) {
        this.projectsIni = ini;
        return this;
    }

    public WorkerConfig withResultsDir(Path dir) {
        this.resultsDir = dir;
        return this;
    }

    public WorkerConfig withWorkDir(Path dir) {
        this.workDir = dir;
        return this;
    }

    public WorkerConfig withInMemoryResults(boolean inMemory) {
        this.inMemoryResults = inMemory;
        return this;
    }

    public WorkerConfig withResultTtl(Duration ttl) {
        this.resultTtl = ttl;
        return this;
    }

    public WorkerConfig withRunDeadline(Duration deadline) {
        this.runDeadline = deadline;
        return this;
    }

    public WorkerConfig withHousekeepingInterval(Duration interval) {
        this.housekeepingInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "workerId='" + workerId() + '\'' +
                ", serverPort=" + serverPort +
                ", projectsIni=" + projectsIni +
                ", resultsDir=" + (inMemoryResults ? "<memory>" : resultsDir) +
                ", workDir=" + workDir +
                ", resultTtl=" + resultTtl +
                ", runDeadline=" + runDeadline +
                '}';
    }
}
