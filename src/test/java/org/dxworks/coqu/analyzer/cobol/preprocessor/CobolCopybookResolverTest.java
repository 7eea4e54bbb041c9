package org.dxworks.coqu.analyzer.cobol.preprocessor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CobolCopybookResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void includingFileDirectoryComesBeforeSearchPaths() throws Exception {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Path lib = Files.createDirectories(tempDir.resolve("lib"));
        Path main = Files.writeString(src.resolve("main.cbl"), "");
        Path local = Files.writeString(src.resolve("custrec.cpy"), "local");
        Files.writeString(lib.resolve("custrec.cpy"), "library");

        CobolCopybookResolver resolver = new CobolCopybookResolver(List.of(lib));

        assertEquals(Optional.of(local), resolver.resolve("CUSTREC", main));
        assertEquals(Optional.of(lib.resolve("custrec.cpy")), resolver.resolve("CUSTREC", null));
    }

    @Test
    void searchPathsAreTriedInOrder() throws Exception {
        Path first = Files.createDirectories(tempDir.resolve("first"));
        Path second = Files.createDirectories(tempDir.resolve("second"));
        Files.writeString(second.resolve("ACCOUNT.cpy"), "second");

        CobolCopybookResolver resolver = new CobolCopybookResolver(
                List.of(tempDir.resolve("missing"), first, second));

        assertEquals(Optional.of(second.resolve("ACCOUNT.cpy")), resolver.resolve("ACCOUNT", null));

        Files.writeString(first.resolve("account.cpy"), "first");
        assertEquals(Optional.of(first.resolve("account.cpy")), resolver.resolve("ACCOUNT", null));
    }

    @Test
    void fallsBackToCaseInsensitiveListing() throws Exception {
        Path lib = Files.createDirectories(tempDir.resolve("lib"));
        Path mixed = Files.writeString(lib.resolve("CustRec.Cpy"), "");
        Files.writeString(lib.resolve("custrec.txt"), "");

        Optional<Path> resolved = new CobolCopybookResolver(List.of(lib)).resolve("custrec", null);

        assertTrue(resolved.isPresent());
        assertTrue(Files.isSameFile(mixed, resolved.get()));
    }

    @Test
    void quotedAndPunctuatedNamesAreNormalized() throws Exception {
        Path lib = Files.createDirectories(tempDir.resolve("lib"));
        Path copybook = Files.writeString(lib.resolve("datecalc.cpy"), "");

        CobolCopybookResolver resolver = new CobolCopybookResolver(List.of(lib));

        assertEquals(Optional.of(copybook), resolver.resolve("'DATECALC'", null));
        assertEquals(Optional.of(copybook), resolver.resolve("DATECALC.", null));
        assertEquals(Optional.empty(), resolver.resolve("NOPE", null));
        assertEquals(Optional.empty(), resolver.resolve("  ", null));
    }

    @Test
    void extensionlessCopybooksResolve() throws Exception {
        Path lib = Files.createDirectories(tempDir.resolve("lib"));
        Path copybook = Files.writeString(lib.resolve("ERRCODES"), "");

        assertEquals(Optional.of(copybook), new CobolCopybookResolver(List.of(lib)).resolve("errcodes", null));
    }

    @Test
    void normalizeCopybookTokenStripsQuotesPunctuationAndDirectories() {
        assertEquals("CUSTREC", CobolCopybookResolver.normalizeCopybookToken(" 'CUSTREC' "));
        assertEquals("CUSTREC", CobolCopybookResolver.normalizeCopybookToken("CUSTREC."));
        assertEquals("CUSTREC", CobolCopybookResolver.normalizeCopybookToken("copy\\lib\\CUSTREC"));
        assertEquals("", CobolCopybookResolver.normalizeCopybookToken(null));
    }

    @Test
    void pickWinnerPrefersTheShortestThenSmallestPath() {
        Path winner = CobolCopybookResolver.pickWinner(List.of(
                Paths.get("/lib/nested/CUSTREC.cpy"),
                Paths.get("/lib/custrec.cpy"),
                Paths.get("/lib/CUSTREC.cpy"),
                Paths.get("/lib/custrec.cpy")));

        assertEquals(Paths.get("/lib/CUSTREC.cpy"), winner);
    }
}
