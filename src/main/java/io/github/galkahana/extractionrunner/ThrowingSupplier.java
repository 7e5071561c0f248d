package io.github.galkahana.extractionrunner;

/**
 * Type definition for a fallible operation wrapped by {@link RetryPolicy}.
 *
 * @param <T> Result type
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
    T get() throws Exception;
}
