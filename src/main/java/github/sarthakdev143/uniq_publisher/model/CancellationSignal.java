package github.sarthakdev143.uniq_publisher.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch-scoped cancellation flag. Work already started is allowed to finish; nothing new starts once
 * this is set.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
