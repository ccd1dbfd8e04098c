package io.hashdb.storage.flush;

import io.hashdb.storage.DurableStore;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background writer that moves closed flush batches into the durable store.
 * <p>
 * Each tick:
 *  - optionally closes the accumulating batch when it holds writes (auto flush),
 *  - pulls the oldest unacknowledged batch, commits it, acknowledges it,
 *  - repeats until nothing is left to store.
 * <p>
 * A single-threaded scheduler guarantees batches are committed in flush id order and
 * that at most one commit runs at a time. A failed commit is logged and retried on the
 * next tick; the batch stays STORING in the meantime.
 */
public final class DurableWriter {
    private static final Logger log = Logger.getLogger(DurableWriter.class.getName());

    private final FlushPipeline pipeline;
    private final DurableStore store;
    private final Duration interval;
    private final boolean autoFlush;
    private final ScheduledExecutorService scheduler;

    public DurableWriter(FlushPipeline pipeline, DurableStore store, Duration interval, boolean autoFlush) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.store = Objects.requireNonNull(store, "store");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.autoFlush = autoFlush;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "durable-writer");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long millis = Math.max(1L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::tickSafe, millis, millis, TimeUnit.MILLISECONDS);
        log.info("durable writer started: interval=" + millis + "ms autoFlush=" + autoFlush);
    }

    /** Stop ticking, then drain whatever is already closed so a clean shutdown loses nothing. */
    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
            return;
        }
        tickSafe();
    }

    /**
     * Store every batch that is ready right now.
     *
     * @return number of batches committed
     */
    public int runOnce() {
        if (autoFlush && pipeline.hasStagedWrites()) {
            pipeline.flush();
        }
        int stored = 0;
        while (true) {
            FlushData data = pipeline.getFlushData(0);
            FlushBatch batch = data.batch();
            if (batch == null) {
                return stored;
            }
            store.commit(batch);
            pipeline.acknowledge(batch.flushId());
            stored++;
        }
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            int n = runOnce();
            if (n > 0) {
                log.fine("durable writer stored " + n + " batch(es)");
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "durable writer tick failed; retrying next tick", e);
        }
    }
}
