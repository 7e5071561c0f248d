package io.github.galkahana.extractionrunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Keeps the destination a single valid JSON array: every append reads the array, adds the result and rewrites it.
 * Simple and always readable, but quadratic in the number of results. See {@link JsonLinesResultSink} for large runs.
 * <p>
 * Rewrites go through a temporary file and an atomic move, so a crash mid-append keeps the previous array.
 */
public class JsonArrayResultSink implements ResultSink {

    private static final TypeReference<List<JsonNode>> ARRAY = new TypeReference<>() {};

    private final ObjectMapper mapper = JsonSupport.mapper();

    @Override
    public void initialize(Path destination) throws IOException {
        createParent(destination);
        JsonSupport.writeAtomically(destination, List.of());
    }

    @Override
    public void append(Path destination, TaskResult result) throws IOException {
        List<JsonNode> items = Files.exists(destination)
                ? new ArrayList<>(mapper.readValue(destination.toFile(), ARRAY))
                : new ArrayList<>();
        items.add(mapper.valueToTree(result));
        JsonSupport.writeAtomically(destination, items);
    }

    /**
     * Read every result back from a destination written by this sink.
     */
    public List<TaskResult> readAll(Path destination) throws IOException {
        return mapper.readValue(destination.toFile(), new TypeReference<List<TaskResult>>() {});
    }

    static void createParent(Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
