package apprunner.worker.execution;

import apprunner.worker.project.Project;

import java.nio.file.Path;

/**
 * A throwaway copy of a project prepared for one ticket.
 *
 * @param ticket    ticket the copy belongs to
 * @param project   golden project it was copied from
 * @param directory root of the copy: {@code <workDir>/<ticket>/<project>}
 */
public record StagedProject(String ticket, Project project, Path directory) {

    public Path artifactPath() {
        return directory.resolve(project.artifact());
    }
}
