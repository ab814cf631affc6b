package apprunner.worker.execution;

import apprunner.common.model.Patch;
import apprunner.worker.project.Project;
import apprunner.worker.project.TestProjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceStagerTest {

    @TempDir
    Path dir;

    private Project project;
    private WorkspaceStager stager;

    @BeforeEach
    void setUp() throws Exception {
        project = TestProjects.example(dir.resolve("golden"));
        stager = new WorkspaceStager(dir.resolve("work"));
    }

    @Test
    @DisplayName("Staging copies sources but skips VCS metadata and build caches")
    void stageCopiesSources() throws Exception {
        StagedProject staged = stager.stage("t1", project);

        assertEquals(dir.resolve("work").resolve("t1").resolve("Example"), staged.directory());
        assertEquals(TestProjects.ORIGINAL_CONTENTS, Files.readString(staged.directory().resolve(TestProjects.EDITOR_FILE)));
        assertTrue(Files.exists(staged.directory().resolve("build.gradle")));
        assertFalse(Files.exists(staged.directory().resolve(".git")));
        assertFalse(Files.exists(staged.directory().resolve(".gradle")));
        assertEquals(List.of("t1"), stager.stagedTickets());
    }

    @Test
    void patchesNeverTouchTheGoldenCopy() throws Exception {
        StagedProject staged = stager.stage("t1", project);
        stager.applyPatches(staged, List.of(new Patch(TestProjects.EDITOR_FILE, "<patched/>")));

        assertEquals("<patched/>", Files.readString(staged.directory().resolve(TestProjects.EDITOR_FILE)));
        assertEquals(TestProjects.ORIGINAL_CONTENTS, Files.readString(project.root().resolve(TestProjects.EDITOR_FILE)));
    }

    @Test
    void lastPatchToSameFileWins() throws Exception {
        StagedProject staged = stager.stage("t1", project);
        stager.applyPatches(staged, List.of(
                new Patch(TestProjects.EDITOR_FILE, "<first/>"),
                new Patch(TestProjects.EDITOR_FILE, "<second/>")));

        assertEquals("<second/>", Files.readString(staged.directory().resolve(TestProjects.EDITOR_FILE)));
    }

    @Test
    @DisplayName("Filenames carrying a /<project>/ infix are rehomed into the staged copy")
    void projectInfixIsStripped() throws Exception {
        StagedProject staged = stager.stage("t1", project);

        Path target = stager.resolvePatchTarget(staged, "/home/editor/projects/Example/app/a.xml");
        assertEquals(staged.directory().resolve("app/a.xml").toAbsolutePath().normalize(), target);
    }

    @Test
    void escapingPatchIsRejected() throws Exception {
        StagedProject staged = stager.stage("t1", project);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> stager.applyPatches(staged, List.of(new Patch("../../outside.txt", "x"))));
        assertTrue(e.getMessage().startsWith("Patch target escapes project"), e.getMessage());
    }

    @Test
    void patchToMissingFileIsRejected() throws Exception {
        StagedProject staged = stager.stage("t1", project);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> stager.applyPatches(staged, List.of(new Patch("app/missing.xml", "x"))));
        assertEquals("Unable to apply patch; no file named app/missing.xml", e.getMessage());
    }

    @Test
    void restagingStartsFromAFreshCopy() throws Exception {
        StagedProject staged = stager.stage("t1", project);
        stager.applyPatches(staged, List.of(new Patch(TestProjects.EDITOR_FILE, "<patched/>")));

        StagedProject again = stager.stage("t1", project);
        assertEquals(TestProjects.ORIGINAL_CONTENTS, Files.readString(again.directory().resolve(TestProjects.EDITOR_FILE)));
    }

    @Test
    void cleanupRemovesTicketDirectory() throws Exception {
        stager.stage("t1", project);

        stager.cleanup("t1");
        stager.cleanup("t1");

        assertFalse(Files.exists(dir.resolve("work").resolve("t1")));
        assertTrue(stager.stagedTickets().isEmpty());
    }

    @Test
    void missingProjectDirectoryFailsStaging() {
        Project ghost = Project.builder()
                .name("Ghost")
                .root(dir.resolve("nowhere"))
                .buildCommand("true")
                .artifact("out.png")
                .build();

        assertThrows(IOException.class, () -> stager.stage("t1", ghost));
    }
}
