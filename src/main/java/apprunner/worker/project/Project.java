package apprunner.worker.project;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A golden project the worker can build: its sources plus how to build, run
 * and collect the screenshot artifact.
 */
public final class Project {

    private final String name;
    private final Path root;
    private final String editorFile;
    private final String buildCommand;
    private final String runCommand;
    private final String artifact;
    private final String successMarker;
    private final String failureMarker;

    private Project(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.root = Objects.requireNonNull(builder.root, "path is required");
        this.editorFile = builder.editorFile;
        this.buildCommand = Objects.requireNonNull(builder.buildCommand, "build_command is required");
        this.runCommand = builder.runCommand;
        this.artifact = Objects.requireNonNull(builder.artifact, "artifact is required");
        this.successMarker = builder.successMarker;
        this.failureMarker = builder.failureMarker;
    }

    public String name() {
        return name;
    }

    /** Directory holding the pristine project sources */
    public Path root() {
        return root;
    }

    /** File shown in the editor, relative to the root */
    public Optional<String> editorFile() {
        return Optional.ofNullable(editorFile);
    }

    public String buildCommand() {
        return buildCommand;
    }

    public Optional<String> runCommand() {
        return Optional.ofNullable(runCommand);
    }

    /** Screenshot file produced by the run, relative to the root */
    public String artifact() {
        return artifact;
    }

    public Optional<String> successMarker() {
        return Optional.ofNullable(successMarker);
    }

    public Optional<String> failureMarker() {
        return Optional.ofNullable(failureMarker);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Project{name='" + name + "', root=" + root + '}';
    }

    public static final class Builder {
        private String name;
        private Path root;
        private String editorFile;
        private String buildCommand;
        private String runCommand;
        private String artifact;
        private String successMarker;
        private String failureMarker;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder editorFile(String editorFile) {
            this.editorFile = editorFile;
            return this;
        }

        public Builder buildCommand(String buildCommand) {
            this.buildCommand = buildCommand;
            return this;
        }

        public Builder runCommand(String runCommand) {
            this.runCommand = runCommand;
            return this;
        }

        public Builder artifact(String artifact) {
            this.artifact = artifact;
            return this;
        }

        public Builder successMarker(String successMarker) {
            this.successMarker = successMarker;
            return this;
        }

        public Builder failureMarker(String failureMarker) {
            this.failureMarker = failureMarker;
            return this;
        }

        public Project build() {
            return new Project(this);
        }
    }
}
