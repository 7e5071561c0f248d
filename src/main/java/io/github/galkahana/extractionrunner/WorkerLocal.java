package io.github.galkahana.extractionrunner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Supplies a client to the calling worker: either one shared instance, or one instance per worker thread,
 * created lazily on first use and cached for the lifetime of that thread.
 * <p>
 * Use {@link #perWorker} for clients that must not share a connection across threads.
 *
 * @param <C> Client type
 */
@Slf4j
public final class WorkerLocal<C> implements Supplier<C>, AutoCloseable {

    private final Supplier<C> factory;
    private final ThreadLocal<C> local;
    private final C shared;
    private final List<C> created = new CopyOnWriteArrayList<>();

    private WorkerLocal(Supplier<C> factory, C shared) {
        this.factory = factory;
        this.shared = shared;
        this.local = factory == null ? null : ThreadLocal.withInitial(this::create);
    }

    /**
     * Hand the same, thread-safe, instance to every worker.
     */
    public static <C> WorkerLocal<C> shared(C instance) {
        if (instance == null) throw new IllegalArgumentException("instance must not be null");
        return new WorkerLocal<>(null, instance);
    }

    /**
     * Create one instance per worker thread with {@code factory}.
     */
    public static <C> WorkerLocal<C> perWorker(Supplier<C> factory) {
        if (factory == null) throw new IllegalArgumentException("factory must not be null");
        return new WorkerLocal<>(factory, null);
    }

    @Override
    public C get() {
        return local == null ? shared : local.get();
    }

    /**
     * @return Instances created so far by a per-worker provider, empty for a shared one
     */
    public List<C> createdInstances() {
        return new ArrayList<>(created);
    }

    /**
     * Close every created instance that is {@link AutoCloseable}. A shared instance is owned by the caller and
     * left open.
     */
    @Override
    public void close() {
        for (C instance : created) {
            if (instance instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close worker client {}: {}", instance, e.getMessage());
                }
            }
        }
        created.clear();
    }

    private C create() {
        C instance = factory.get();
        created.add(instance);
        log.debug("Created client for worker {}", Thread.currentThread().getName());
        return instance;
    }
}
