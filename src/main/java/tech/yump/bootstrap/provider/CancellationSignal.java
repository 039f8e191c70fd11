package tech.yump.bootstrap.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for token provider launches.
 *
 * <p>Cancelling runs every registered callback once. A {@link #child()} is cancelled together
 * with its parent, and detaches from the parent when closed.
 */
@Slf4j
public final class CancellationSignal implements AutoCloseable {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile Registration parentRegistration;

    /**
     * Handle for a registered callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        child.parentRegistration = onCancel(child::cancel);
        return child;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        // Whoever removes a callback runs it, so a concurrent onCancel never loses or doubles one.
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runQuietly(callback);
            }
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback run on cancellation; runs it immediately when already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runQuietly(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Detaches this signal from its parent. Does not cancel it.
     */
    @Override
    public void close() {
        Registration registration = parentRegistration;
        if (registration != null) {
            registration.close();
            parentRegistration = null;
        }
    }
}
