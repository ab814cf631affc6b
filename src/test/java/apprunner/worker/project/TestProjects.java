package apprunner.worker.project;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds small golden projects on disk for tests.
 */
public final class TestProjects {

    public static final String EDITOR_FILE = "app/a.xml";
    public static final String ORIGINAL_CONTENTS = "<layout/>\n";

    private TestProjects() {
    }

    /**
     * Project "Example" with {@code app/a.xml}, a {@code .git} directory and a {@code .gradle} cache.
     */
    public static Project example(Path parent) throws IOException {
        Path root = parent.resolve("Example");
        Files.createDirectories(root.resolve("app"));
        Files.writeString(root.resolve(EDITOR_FILE), ORIGINAL_CONTENTS);
        Files.writeString(root.resolve("build.gradle"), "// build\n");
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve(".git/HEAD"), "ref: refs/heads/main\n");
        Files.createDirectories(root.resolve(".gradle"));
        Files.writeString(root.resolve(".gradle/cache.bin"), "cache");

        return Project.builder()
                .name("Example")
                .root(root)
                .editorFile(EDITOR_FILE)
                .buildCommand("true")
                .artifact("result.jpg")
                .build();
    }

    public static ProjectCatalog catalog(Path parent) throws IOException {
        return new ProjectCatalog(List.of(example(parent)));
    }
}
