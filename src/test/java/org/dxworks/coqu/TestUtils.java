package org.dxworks.coqu;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.dxworks.coqu.analyzer.cobol.COBOLProgramBuilder;
import org.dxworks.coqu.analyzer.cobol.index.StructuralIndexer;
import org.dxworks.coqu.cache.SourceHasher;
import org.dxworks.coqu.model.cobol.COBOLProgram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class TestUtils {
    public static final String SAMPLES_BASE_PATH = "src/test/resources/samples/cobol/";

    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static Path sample(String fileName) {
        return Paths.get(SAMPLES_BASE_PATH + fileName);
    }

    public static String readSample(String fileName) throws IOException {
        return Files.readString(sample(fileName));
    }

    /**
     * Indexes and builds a sample without preprocessing it.
     */
    public static COBOLProgram buildSample(String fileName) throws IOException {
        String source = readSample(fileName);
        return new COBOLProgramBuilder().build(source, new StructuralIndexer().index(source), List.of(),
                SAMPLES_BASE_PATH + fileName, SourceHasher.sha256Hex(source.getBytes(StandardCharsets.UTF_8)));
    }
}
