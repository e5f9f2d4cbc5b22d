package com.questrail.mdoc.transport;

import com.questrail.mdoc.internal.time.Cancellable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * CancellationToken
 * =============================================================================
 * Explicit cancellation signal passed to blocking transport operations.
 *
 * <p>Cancelling runs every registered callback exactly once, on the cancelling
 * thread. Callbacks registered after cancellation run immediately. Transports
 * register their {@code close()} so that cancelling a session drives its
 * transport to {@link TransportState#CLOSED}.</p>
 */
public final class CancellationToken
{
    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            callback.run();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if this token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Registers {@code callback} to run on cancellation.
     *
     * @return a handle that unregisters the callback
     */
    public Cancellable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        return callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> false;
    }
}
