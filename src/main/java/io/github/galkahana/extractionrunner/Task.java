package io.github.galkahana.extractionrunner;

import java.util.Objects;

/**
 * One remote document to fetch and extract.
 *
 * @param id Opaque identity in the remote repository. Also the checkpoint key
 * @param displayName Human readable name, passed to the extraction client
 * @param contentType Content type hint (e.g. {@code application/pdf}), may be null
 */
public record Task(String id, String displayName, String contentType) {

    public Task {
        Objects.requireNonNull(id, "id");
        if (displayName == null) displayName = id;
    }
}
