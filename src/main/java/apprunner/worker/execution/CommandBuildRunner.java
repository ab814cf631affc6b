package apprunner.worker.execution;

import apprunner.worker.project.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the project's configured build command, then its run command, as child
 * processes inside the staged directory.
 *
 * Output of each step is redirected to a log file next to the sources so that
 * waiting stays interruptible; aborting the calling thread kills the process tree.
 */
public class CommandBuildRunner implements BuildRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandBuildRunner.class);

    /** Longest output kept for diagnostics */
    static final int MAX_OUTPUT_CHARS = 64 * 1024;

    @Override
    public BuildOutcome run(StagedProject staged) throws IOException, InterruptedException {
        Project project = staged.project();

        StepResult build = execute(project.buildCommand(), staged.directory(), "build",
                project.successMarker().stream().toList());
        Optional<String> buildFailure = checkBuild(project, build);
        if (buildFailure.isPresent()) {
            return BuildOutcome.failure(buildFailure.get());
        }

        if (project.runCommand().isPresent()) {
            StepResult run = execute(project.runCommand().get(), staged.directory(), "run",
                    project.failureMarker().stream().toList());
            Optional<String> runFailure = checkRun(project, run);
            if (runFailure.isPresent()) {
                return BuildOutcome.failure(runFailure.get());
            }
        }

        Path artifact = staged.artifactPath();
        if (!Files.isRegularFile(artifact)) {
            return BuildOutcome.failure("Run failed for project " + project.name()
                    + "; no artifact at " + project.artifact());
        }
        return BuildOutcome.success(artifact);
    }

    static Optional<String> checkBuild(Project project, StepResult build) {
        boolean markerOk = project.successMarker()
                .map(build::saw)
                .orElse(true);
        if (build.exitCode() != 0 || !markerOk) {
            return Optional.of("Build failed for project " + project.name() + "; result:\n" + build.output());
        }
        return Optional.empty();
    }

    static Optional<String> checkRun(Project project, StepResult run) {
        boolean failureSeen = project.failureMarker()
                .map(run::saw)
                .orElse(false);
        if (run.exitCode() != 0 || failureSeen) {
            return Optional.of("Run failed for project " + project.name() + "; result:\n" + run.output());
        }
        return Optional.empty();
    }

    StepResult execute(String command, Path directory, String step, List<String> markers)
            throws IOException, InterruptedException {
        Path logFile = directory.resolve(".apprunner-" + step + ".log");
        ProcessBuilder pb = new ProcessBuilder(shell(command))
                .directory(directory.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile());

        log.info("Running {} step in {}: {}", step, directory, command);
        long start = System.currentTimeMillis();
        Process process = pb.start();
        try {
            int exitCode = process.waitFor();
            log.info("{} step exited with {} after {}ms", step, exitCode, System.currentTimeMillis() - start);
            return scan(logFile, exitCode, markers);
        } catch (InterruptedException e) {
            log.warn("{} step interrupted, destroying process {}", step, process.pid());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw e;
        }
    }

    private static List<String> shell(String command) {
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            return List.of("cmd", "/c", command);
        }
        return List.of("/bin/sh", "-c", command);
    }

    /**
     * Reads the whole log once: every marker is looked for on every line, and
     * only the last {@link #MAX_OUTPUT_CHARS} characters are kept for diagnostics.
     */
    static StepResult scan(Path file, int exitCode, List<String> markers) throws IOException {
        if (!Files.exists(file)) {
            return new StepResult(exitCode, "", Set.of());
        }
        Set<String> seen = new HashSet<>();
        Deque<String> tail = new ArrayDeque<>();
        int tailChars = 0;
        boolean truncated = false;

        // InputStreamReader substitutes malformed bytes instead of failing
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                for (String marker : markers) {
                    if (line.contains(marker)) {
                        seen.add(marker);
                    }
                }
                if (line.length() > MAX_OUTPUT_CHARS) {
                    line = line.substring(line.length() - MAX_OUTPUT_CHARS);
                    truncated = true;
                }
                tail.addLast(line);
                tailChars += line.length() + 1;
                while (tailChars > MAX_OUTPUT_CHARS && tail.size() > 1) {
                    tailChars -= tail.removeFirst().length() + 1;
                    truncated = true;
                }
            }
        }

        String output = String.join("\n", tail);
        return new StepResult(exitCode, truncated ? "[output truncated]\n" + output : output, seen);
    }

    /**
     * Exit code, tail of the combined output, and the markers found anywhere in it.
     */
    record StepResult(int exitCode, String output, Set<String> markersSeen) {

        boolean saw(String marker) {
            return markersSeen.contains(marker);
        }
    }
}
