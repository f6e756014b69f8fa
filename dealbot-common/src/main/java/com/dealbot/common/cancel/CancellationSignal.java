package com.dealbot.common.cancel;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Cooperative cancellation shared between the orchestrator and the long operations it starts.
 * Children are cancelled together with their parent; cancelling a child leaves the parent alone.
 *
 * A child stays registered on its parent until it fires or is closed. Long-lived parents therefore
 * require every child to be closed once its work is done, typically with try-with-resources.
 */
@Slf4j
public class CancellationSignal implements AutoCloseable {

    private static final ScheduledThreadPoolExecutor TIMERS = timers();

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);

    private volatile Registration parentRegistration = Registration.NOOP;
    private volatile ScheduledFuture<?> timer;

    /**
     * Handle returned by {@link #onCancel}. Closing it removes the listener; closing twice is harmless.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        Registration NOOP = () -> { };

        @Override
        void close();
    }

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /** A signal that never fires unless cancelled explicitly. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        child.parentRegistration = onCancel(child::cancel);
        return child;
    }

    /**
     * Child signal that cancels itself once {@code timeout} elapses.
     */
    public CancellationSignal childWithTimeout(Duration timeout) {
        CancellationSignal child = child();
        child.timer = TIMERS.schedule(
            () -> child.cancel("timed out after " + timeout.toMillis() + "ms"),
            timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (child.isCancelled()) {
            child.detach();
        }
        return child;
    }

    public void cancel(String why) {
        String effective = why != null ? why : "cancelled";
        if (!reason.compareAndSet(null, effective)) {
            return;
        }
        cancelledLatch.countDown();
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(effective);
            } catch (RuntimeException e) {
                log.warn("[CANCEL] Listener failed | reason={} | error={}", effective, e.getMessage());
            }
        }
        listeners.clear();
        detach();
    }

    /**
     * Detaches this signal from its parent and stops its timer without cancelling it.
     */
    @Override
    public void close() {
        detach();
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * Registers a listener. If the signal has already fired the listener runs immediately.
     */
    public Registration onCancel(Consumer<String> listener) {
        AtomicBoolean fired = new AtomicBoolean();
        Consumer<String> once = why -> {
            if (fired.compareAndSet(false, true)) {
                listener.accept(why);
            }
        };
        listeners.add(once);
        String current = reason.get();
        if (current != null) {
            listeners.remove(once);
            once.accept(current);
            return Registration.NOOP;
        }
        return () -> listeners.remove(once);
    }

    int listenerCount() {
        return listeners.size();
    }

    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw new CancelledException(current);
        }
    }

    /**
     * Sleeps for {@code delay} unless the signal fires first.
     *
     * @throws CancelledException if cancelled before or during the wait
     */
    public void sleep(Duration delay) {
        throwIfCancelled();
        try {
            if (cancelledLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted");
        }
    }

    private void detach() {
        parentRegistration.close();
        parentRegistration = Registration.NOOP;
        ScheduledFuture<?> pending = timer;
        if (pending != null) {
            pending.cancel(false);
            timer = null;
        }
    }

    private static ScheduledThreadPoolExecutor timers() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "cancellation-timer");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
