package apprunner.worker.project;

import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.error.ProjectNotFoundException;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects known to this worker, loaded from an INI file with one section per project:
 *
 * <pre>
 * [Example]
 * path = projects/Example
 * editor_file = app/src/main/res/layout/activity_main.xml
 * build_command = ./gradlew installDebug
 * run_command = ./gradlew connectedAndroidTest
 * artifact = result.jpg
 * success_marker = BUILD SUCCESSFUL
 * failure_marker = FAILURES!!!
 * </pre>
 *
 * Relative paths are resolved against the INI file's directory.
 */
public final class ProjectCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProjectCatalog.class);

    private final Map<String, Project> projects;

    public ProjectCatalog(Collection<Project> projects) {
        Map<String, Project> byName = new LinkedHashMap<>();
        for (Project project : projects) {
            byName.put(project.name(), project);
        }
        this.projects = Collections.unmodifiableMap(byName);
    }

    public static ProjectCatalog empty() {
        return new ProjectCatalog(List.of());
    }

    public static ProjectCatalog load(Path iniFile) {
        try {
            Ini ini = new Ini(iniFile.toFile());
            Path base = iniFile.toAbsolutePath().getParent();
            Map<String, Project> byName = new LinkedHashMap<>();

            for (Profile.Section section : ini.values()) {
                Project project = Project.builder()
                        .name(section.getName())
                        .root(base.resolve(required(section, "path")).normalize())
                        .editorFile(opt(section, "editor_file"))
                        .buildCommand(required(section, "build_command"))
                        .runCommand(opt(section, "run_command"))
                        .artifact(required(section, "artifact"))
                        .successMarker(opt(section, "success_marker"))
                        .failureMarker(opt(section, "failure_marker"))
                        .build();
                byName.put(project.name(), project);
            }

            log.info("Loaded {} project(s) from {}: {}", byName.size(), iniFile, byName.keySet());
            return new ProjectCatalog(byName.values());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read project catalog " + iniFile, e);
        }
    }

    public Optional<Project> find(String name) {
        return Optional.ofNullable(projects.get(name));
    }

    public Project get(String name) {
        return find(name).orElseThrow(() -> ProjectNotFoundException.forProject(name));
    }

    public Collection<Project> all() {
        return projects.values();
    }

    /**
     * Read the editable source file of a project.
     */
    public ProjectResponse editorSource(String name) {
        Project project = get(name);
        String editorFile = project.editorFile()
                .orElseThrow(() -> new ProjectNotFoundException("Project " + name + " has no editor file"));
        Path file = project.root().resolve(editorFile);
        try {
            return new ProjectResponse(editorFile, project.name(), Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static String required(Profile.Section section, String key) {
        String value = opt(section, key);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Project [" + section.getName() + "] is missing required key '" + key + "'");
        }
        return value;
    }

    private static String opt(Profile.Section section, String key) {
        String value = section.get(key);
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
