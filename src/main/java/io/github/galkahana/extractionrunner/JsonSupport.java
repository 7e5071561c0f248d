package io.github.galkahana.extractionrunner;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for checkpoint and result files. Instants are written as ISO-8601 strings.
 */
final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonSupport() {
    }

    /**
     * ObjectMapper is thread-safe once configured, so a single instance is shared.
     */
    static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Write {@code value} to a sibling {@code .tmp} file, then move it over {@code target}, so that readers and a
     * crash mid-write only ever see the previous or the new content.
     * <p>
     * Uses stream I/O rather than an interruptible channel, so a write from a thread whose interrupt flag is set
     * still completes.
     */
    static void writeAtomically(Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path temp = tempFileOf(target);
        MAPPER.writeValue(temp.toFile(), value);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static Path tempFileOf(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }
}
