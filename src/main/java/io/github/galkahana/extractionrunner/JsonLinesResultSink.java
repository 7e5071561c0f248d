package io.github.galkahana.extractionrunner;

import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Append-only log with one JSON object per line. Each append costs one small write, whatever the size of the run.
 */
public class JsonLinesResultSink implements ResultSink {

    private final ObjectMapper mapper = JsonSupport.mapper();
    private final ObjectWriter lineWriter = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void initialize(Path destination) throws IOException {
        JsonArrayResultSink.createParent(destination);
        Files.write(destination, new byte[0]);
    }

    @Override
    public void append(Path destination, TaskResult result) throws IOException {
        byte[] line = (lineWriter.writeValueAsString(result) + "\n").getBytes(StandardCharsets.UTF_8);
        // Not a channel, must still write when the worker's interrupt flag is set
        try (FileOutputStream out = new FileOutputStream(destination.toFile(), true)) {
            out.write(line);
            out.getFD().sync();
        }
    }

    public List<TaskResult> readAll(Path destination) throws IOException {
        List<TaskResult> results = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(destination, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) results.add(mapper.readValue(line, TaskResult.class));
            }
        }
        return results;
    }
}
