package org.dxworks.coqu.workspace;

import org.dxworks.coqu.CoquConfig;
import org.dxworks.coqu.model.cobol.CopybookStatus;
import org.dxworks.coqu.model.cobol.LoadedProgram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WorkspaceTest {

    @TempDir
    Path sources;

    @TempDir
    Path cacheDir;

    private Workspace workspace;
    private Path main;
    private Path sub;

    @BeforeEach
    void setUp() throws Exception {
        workspace = new Workspace(CoquConfig.with(List.of(), cacheDir, true));
        main = write("main.cbl",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. MAINPGM.",
                "       PROCEDURE DIVISION.",
                "       MAIN-PARA.",
                "           CALL 'SUBPGM' USING WS-AREA",
                "           CALL 'LOGGER'",
                "           GOBACK.");
        sub = write("sub.cbl",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. SUBPGM.",
                "       PROCEDURE DIVISION.",
                "       SUB-PARA.",
                "           CALL 'LOGGER'.",
                "       SUB-EXIT.",
                "           EXIT.");
    }

    private Path write(String name, String... lines) throws Exception {
        Path file = sources.resolve(name);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, String.join("\n", lines) + "\n");
    }

    @Test
    void programsAreKeyedByUpperCaseFileName() throws Exception {
        workspace.load(main);

        assertEquals(1, workspace.size());
        assertTrue(workspace.contains("main"));
        assertTrue(workspace.contains("MAIN"));
        assertEquals("MAINPGM", workspace.get("Main").orElseThrow().getProgramId());
        assertFalse(workspace.get("OTHER").isPresent());
    }

    @Test
    void loadingTheSameFileTwiceKeepsTheFirstResult() throws Exception {
        LoadedProgram first = workspace.load(main);
        LoadedProgram again = workspace.load(main);
        LoadedProgram forced = workspace.load(main, true);

        assertSame(first, again);
        assertNotSame(first, forced);
        assertFalse(forced.isFromCache());
        assertSame(forced, workspace.get("MAIN").orElseThrow());
    }

    @Test
    void directoryLoadingMatchesTheGlob() throws Exception {
        write("notes.txt", "not cobol");
        write("nested/deep.cbl",
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. DEEP.");

        List<LoadedProgram> flat = workspace.loadDirectory(sources);
        assertEquals(List.of("main", "sub"), flat.stream().map(LoadedProgram::getName).collect(Collectors.toList()));

        List<LoadedProgram> all = workspace.loadDirectory(sources, "*.cbl", true);
        assertEquals(3, all.size());
        assertEquals(List.of("MAIN", "SUB", "DEEP"), workspace.listPrograms());
        assertTrue(workspace.loadDirectory(sources.resolve("absent")).isEmpty());
    }

    @Test
    void unloadAndReload() throws Exception {
        workspace.load(main);
        workspace.load(sub);

        assertTrue(workspace.unload("sub"));
        assertFalse(workspace.unload("sub"));
        assertFalse(workspace.reload("SUB").isPresent());

        LoadedProgram reloaded = workspace.reload("main").orElseThrow();
        assertFalse(reloaded.isFromCache());
        assertEquals(3, workspace.getCache().orElseThrow().stats().getSaves());

        assertEquals(1, workspace.unloadAll());
        assertEquals(0, workspace.size());
    }

    @Test
    void reloadAllDropsProgramsWhoseFileIsGone() throws Exception {
        workspace.load(main);
        workspace.load(sub);
        Files.delete(sub);

        List<LoadedProgram> reloaded = workspace.reloadAll();

        assertEquals(1, reloaded.size());
        assertEquals(List.of("MAIN"), workspace.listPrograms());
    }

    @Test
    void statsCountLinesAndCacheHits() throws Exception {
        LoadedProgram first = workspace.load(main);
        LoadedProgram second = workspace.load(sub);

        WorkspaceStats stats = workspace.stats();
        assertEquals(2, stats.getProgramCount());
        assertEquals(first.getProgram().lines + second.getProgram().lines, stats.getTotalLines());
        assertTrue(stats.getTotalLines() >= 14);
        assertEquals(0, stats.getCachedCount());
        assertEquals(0, stats.getCopybookPathCount());

        workspace.unloadAll();
        workspace.load(main);
        assertEquals(1, workspace.stats().getCachedCount());
    }

    @Test
    void callersAndCallGraphSpanAllLoadedPrograms() throws Exception {
        workspace.load(main);
        workspace.load(sub);

        assertEquals("SUBPGM", workspace.findProgramById("subpgm").orElseThrow().getProgramId());
        assertFalse(workspace.findProgramById("NOPE").isPresent());

        assertEquals(List.of(new CallSite("MAIN", "MAIN-PARA"), new CallSite("SUB", "SUB-PARA")),
                workspace.findCallers("logger"));
        assertEquals(List.of(new CallSite("MAIN", "MAIN-PARA")), workspace.findCallers("SUBPGM"));

        assertEquals(Map.of("MAINPGM", List.of("LOGGER", "SUBPGM"), "SUBPGM", List.of("LOGGER")),
                workspace.callGraph());

        List<String> iterated = new ArrayList<>();
        for (LoadedProgram program : workspace) {
            iterated.add(program.getProgramId());
        }
        assertEquals(List.of("MAINPGM", "SUBPGM"), iterated);
    }

    @Test
    void addedCopybookPathsApplyToLaterLoads() throws Exception {
        Path copylib = Files.createDirectories(sources.resolve("copylib"));
        Files.writeString(copylib.resolve("custrec.cpy"), "       01  CUST-REC PIC X(10).\n");
        Path program = write("uses.cbl",
                "       DATA DIVISION.",
                "       WORKING-STORAGE SECTION.",
                "           COPY CUSTREC.");

        assertEquals(CopybookStatus.UNRESOLVED, workspace.load(program).getProgram().copybookRefs.get(0).status);

        assertTrue(workspace.addCopybookPath(copylib));
        assertFalse(workspace.addCopybookPath(copylib));
        assertFalse(workspace.addCopybookPath(sources.resolve("uses.cbl")));
        assertEquals(List.of(copylib), workspace.getCopybookPaths());

        LoadedProgram reloaded = workspace.reload("USES").orElseThrow();
        assertEquals(CopybookStatus.RESOLVED, reloaded.getProgram().copybookRefs.get(0).status);
        assertEquals(1, workspace.stats().getCopybookPathCount());
    }
}
