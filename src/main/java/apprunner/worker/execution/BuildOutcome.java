package apprunner.worker.execution;

import java.nio.file.Path;

/**
 * Result of building and running a staged project.
 *
 * @param success    true when both steps passed and the artifact exists
 * @param artifact   screenshot file on success, null otherwise
 * @param diagnostic failure text on failure, null otherwise
 */
public record BuildOutcome(boolean success, Path artifact, String diagnostic) {

    public static BuildOutcome success(Path artifact) {
        return new BuildOutcome(true, artifact, null);
    }

    public static BuildOutcome failure(String diagnostic) {
        return new BuildOutcome(false, null, diagnostic);
    }
}
