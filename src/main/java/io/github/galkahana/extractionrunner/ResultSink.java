package io.github.galkahana.extractionrunner;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Destination collecting one result per completed task.
 * Implementations are not thread-safe: the executor serializes every call on a single lock.
 */
public interface ResultSink {

    /**
     * Create the destination, or truncate it to an empty collection.
     */
    void initialize(Path destination) throws IOException;

    /**
     * Durably add one result to the destination.
     */
    void append(Path destination, TaskResult result) throws IOException;
}
