package io.github.galkahana.extractionrunner;

/**
 * Already-authenticated client of the document extraction service.
 * Same concurrency constraints as {@link RepositoryClient}.
 */
@FunctionalInterface
public interface ExtractionClient {

    /**
     * Extract structured data from one document.
     * A parse or validation problem is reported as a {@link TaskStatus#FAILED} result, transport errors are thrown.
     *
     * @param content Raw document bytes
     * @param displayName Document name
     * @return Extraction result. Its task id is filled in by the caller
     */
    TaskResult extract(byte[] content, String displayName) throws Exception;
}
