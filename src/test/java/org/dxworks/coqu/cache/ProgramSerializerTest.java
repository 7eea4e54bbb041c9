package org.dxworks.coqu.cache;

import org.dxworks.coqu.TestUtils;
import org.dxworks.coqu.model.cobol.COBOLProgram;
import org.dxworks.coqu.model.cobol.CopybookRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProgramSerializerTest {

    @TempDir
    Path tempDir;

    private final ProgramSerializer serializer = new ProgramSerializer();
    private COBOLProgram program;

    @BeforeEach
    void setUp() throws Exception {
        program = TestUtils.buildSample("basic-program.cbl");
        CopybookRef ref = new CopybookRef("CUSTREC", 12, null, "==A== BY ==B==");
        ref.markResolved(Paths.get("/copylib/custrec.cpy"));
        program.copybookRefs.add(ref);
    }

    @Test
    void roundTripKeepsEverythingButTheSourceLines() throws Exception {
        byte[] bytes = serializer.serialize(program);

        assertArrayEquals("COQU".getBytes(StandardCharsets.US_ASCII), Arrays.copyOf(bytes, 4));
        COBOLProgram restored = serializer.deserialize(bytes).orElseThrow();
        assertEquals(program, restored);
        assertEquals(program.index, restored.index);
        assertNull(restored.sourceLines);
        assertEquals("BASICPGM", restored.programId);
    }

    @Test
    void foreignOrDamagedBytesAreRejected() throws Exception {
        byte[] good = serializer.serialize(program);
        byte[] badMagic = good.clone();
        badMagic[0] = 'X';

        assertEquals(Optional.empty(), serializer.deserialize(null));
        assertEquals(Optional.empty(), serializer.deserialize(new byte[0]));
        assertEquals(Optional.empty(), serializer.deserialize(badMagic));
        assertEquals(Optional.empty(), serializer.deserialize(Arrays.copyOf(good, good.length / 2)));
        assertEquals(Optional.empty(), serializer.deserialize(new byte[]{'C', 'O', 'Q', 'U', 0x01, 0x02}));
    }

    @Test
    void otherFormatVersionsAreRejected() throws Exception {
        byte[] future = new ProgramSerializer(ProgramSerializer.VERSION + 1).serialize(program);

        assertEquals(Optional.empty(), serializer.deserialize(future));
    }

    @Test
    void saveWritesAtomicallyAndLoadReadsBack() throws Exception {
        Path file = tempDir.resolve("nested").resolve("entry.coqu");

        assertTrue(serializer.save(program, file));
        assertEquals(Optional.of(program), serializer.load(file));
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void loadingAMissingFileIsEmpty() {
        assertFalse(serializer.load(tempDir.resolve("absent.coqu")).isPresent());
    }
}
