package io.hashdb.storage;

import io.hashdb.storage.flush.FlushBatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Puts a deadline on reads from a slower store.
 * <p>
 * Reads run on a small daemon pool; a read that does not finish within the timeout is
 * cancelled and reported as DurableStoreException, so a cache miss never blocks a
 * Get/Set indefinitely. Commits come from the flush writer and pass straight through.
 */
public final class DeadlineDurableStore implements DurableStore {

    private final DurableStore delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public DeadlineDurableStore(DurableStore delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "durable-read-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public long[] readNode(String key) {
        return call(() -> delegate.readNode(key), "node read " + key);
    }

    @Override
    public byte[] readProgram(String key) {
        return call(() -> delegate.readProgram(key), "program read " + key);
    }

    @Override
    public void commit(FlushBatch batch) {
        delegate.commit(batch);
    }

    @Override
    public String stateRoot() {
        return delegate.stateRoot();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        delegate.close();
    }

    private <T> T call(Callable<T> read, String what) {
        Future<T> f = executor.submit(read);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new DurableStoreException(what + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DurableStoreException dse) {
                throw dse;
            }
            throw new DurableStoreException(what + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DurableStoreException(what + " interrupted", e);
        }
    }
}
