package io.github.galkahana.extractionrunner;

/**
 * Already-authenticated client of the remote document repository.
 * Must be safe to call from several workers at once, otherwise supply it through {@link WorkerLocal#perWorker}.
 */
@FunctionalInterface
public interface RepositoryClient {

    /**
     * Download the content of one document.
     *
     * @param task The task whose document should be downloaded
     * @return Raw document bytes
     * @throws Exception On any transport or repository error. Throttling errors should mention
     *                   "rate limit", "429" or "too many requests" so they back off longer
     */
    byte[] fetch(Task task) throws Exception;
}
