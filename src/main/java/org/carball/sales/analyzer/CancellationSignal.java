package org.carball.sales.analyzer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by long-running analyses between units of work.
 */
public class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared no-op signal cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
