package apprunner.worker.execution;

import apprunner.common.model.Patch;
import apprunner.worker.project.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Prepares per-ticket copies of golden projects and applies patches to them.
 * Layout: {@code <workDir>/<ticket>/<project>/}.
 */
public class WorkspaceStager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStager.class);

    /** Build caches and VCS metadata are not copied */
    private static final Set<String> SKIPPED_DIRS = Set.of(".git", ".gradle");

    private final Path workDir;

    public WorkspaceStager(Path workDir) {
        this.workDir = workDir;
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create work directory " + workDir, e);
        }
    }

    public Path workDir() {
        return workDir;
    }

    /**
     * Copy the project sources into a fresh directory for the ticket.
     */
    public StagedProject stage(String ticket, Project project) throws IOException {
        Path target = workDir.resolve(ticket).resolve(project.name());
        if (Files.exists(target)) {
            deleteRecursively(target);
        }
        Path source = project.root();
        if (!Files.isDirectory(source)) {
            throw new IOException("Project directory does not exist: " + source);
        }

        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && SKIPPED_DIRS.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                return FileVisitResult.CONTINUE;
            }
        });

        log.debug("Staged project {} for ticket {} at {}", project.name(), ticket, target);
        return new StagedProject(ticket, project, target);
    }

    /**
     * Apply patches in order; a later patch to the same file replaces an earlier one.
     *
     * @throws IllegalArgumentException if a patch escapes the project or targets a missing file
     */
    public void applyPatches(StagedProject staged, List<Patch> patches) throws IOException {
        for (Patch patch : patches) {
            Path target = resolvePatchTarget(staged, patch.filename());
            Files.writeString(target, patch.contents());
            log.debug("Patched {} ({} chars) for ticket {}", target, patch.contents().length(), staged.ticket());
        }
    }

    /**
     * Resolve a patch filename inside the staged copy. Filenames may be relative
     * to the project root, or carry a {@code /<project>/} infix (as sent by the
     * editor), in which case everything after the infix is used.
     */
    Path resolvePatchTarget(StagedProject staged, String filename) {
        String relative = filename.replace('\\', '/');
        String infix = "/" + staged.project().name() + "/";
        int at = relative.indexOf(infix);
        if (at >= 0) {
            relative = relative.substring(at + infix.length());
        }
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }

        Path root = staged.directory().toAbsolutePath().normalize();
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Patch target escapes project: " + filename);
        }
        if (!Files.isRegularFile(target)) {
            throw new IllegalArgumentException("Unable to apply patch; no file named " + filename);
        }
        return target;
    }

    /**
     * Remove the ticket's staging directory. Missing directories are ignored.
     */
    public void cleanup(String ticket) {
        Path dir = workDir.resolve(ticket);
        try {
            if (Files.exists(dir)) {
                deleteRecursively(dir);
                log.debug("Removed workspace {}", dir);
            }
        } catch (IOException e) {
            log.warn("Failed to remove workspace {}: {}", dir, e.getMessage());
        }
    }

    /** Tickets that currently have a staging directory */
    public List<String> stagedTickets() {
        List<String> tickets = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(workDir)) {
            dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .forEach(tickets::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list work directory " + workDir, e);
        }
        return tickets;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
