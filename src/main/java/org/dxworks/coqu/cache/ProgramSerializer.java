package org.dxworks.coqu.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import org.dxworks.coqu.model.cobol.COBOLProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Binary form of a {@link COBOLProgram}: the {@code COQU} magic followed by a CBOR map
 * {@code {version, data}}. Anything else, or another version, reads as absent.
 */
public final class ProgramSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramSerializer.class);

    static final byte[] MAGIC = "COQU".getBytes(StandardCharsets.US_ASCII);
    public static final int VERSION = 1;

    private static final ObjectMapper CBOR_MAPPER = new ObjectMapper(new CBORFactory());

    private final int version;

    public ProgramSerializer() {
        this(VERSION);
    }

    // other versions only exist to produce files this build must refuse
    ProgramSerializer(int version) {
        this.version = version;
    }

    public byte[] serialize(COBOLProgram program) throws IOException {
        ObjectNode envelope = CBOR_MAPPER.createObjectNode();
        envelope.put("version", version);
        envelope.set("data", CBOR_MAPPER.valueToTree(program));

        byte[] body = CBOR_MAPPER.writeValueAsBytes(envelope);
        byte[] out = Arrays.copyOf(MAGIC, MAGIC.length + body.length);
        System.arraycopy(body, 0, out, MAGIC.length, body.length);
        return out;
    }

    public Optional<COBOLProgram> deserialize(byte[] bytes) {
        if (bytes == null || bytes.length <= MAGIC.length
                || !Arrays.equals(bytes, 0, MAGIC.length, MAGIC, 0, MAGIC.length)) {
            return Optional.empty();
        }
        try {
            JsonNode envelope = CBOR_MAPPER.readTree(Arrays.copyOfRange(bytes, MAGIC.length, bytes.length));
            if (envelope == null || !envelope.isObject()) return Optional.empty();

            int found = envelope.path("version").asInt(0);
            if (found != version) {
                LOG.debug("Cache envelope version {} does not match {}", found, version);
                return Optional.empty();
            }
            JsonNode data = envelope.get("data");
            if (data == null || data.isNull() || data.isEmpty()) return Optional.empty();

            return Optional.ofNullable(CBOR_MAPPER.treeToValue(data, COBOLProgram.class));
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("Unreadable cache envelope: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes through a temporary file in the target directory and moves it into place,
     * so readers never see a half-written file.
     */
    public boolean save(COBOLProgram program, Path file) {
        Path tmp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            byte[] bytes = serialize(program);
            tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to save program cache to {}: {}", file, e.getMessage());
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    LOG.debug("Could not remove temporary file {}", tmp, cleanup);
                }
            }
            return false;
        }
    }

    public Optional<COBOLProgram> load(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return deserialize(Files.readAllBytes(file));
        } catch (IOException e) {
            LOG.warn("Failed to read program cache from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
