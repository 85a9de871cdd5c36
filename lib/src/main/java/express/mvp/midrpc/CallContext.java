package express.mvp.midrpc;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal and optional deadline carried by every client operation.
 *
 * <p>Every point where a client operation can block (waiting for a rate-limit token, a session
 * permit, a response, a job event, or a backoff sleep) races against its context. When the
 * context is cancelled or its deadline passes, the wait is abandoned immediately with a {@link
 * CallCancelledException}. Thread interruption is treated the same way, and the thread's
 * interrupt flag is restored.
 *
 * <h2>Derivation</h2>
 *
 * <p>Contexts form a tree. A child created with {@link #withTimeout(Duration)}, {@link
 * #withDeadline(Instant)} or {@link #withCancel()} is cancelled whenever its parent is, and its
 * deadline is never later than the parent's.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CallContext ctx = CallContext.background().withTimeout(Duration.ofMinutes(2));
 * JsonNode pools = client.call(ctx, "pool.query", null);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Contexts are thread-safe and may be shared between threads; {@link #cancel()} may be called
 * from any thread.
 */
public final class CallContext {

    private static final CallContext BACKGROUND = new CallContext(null, Long.MAX_VALUE, false);

    /** Granularity for waits on primitives that cannot observe the cancellation future. */
    private static final long SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final CallContext parent;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final Set<CallContext> children = ConcurrentHashMap.newKeySet();
    private final Set<Registration> hooks = ConcurrentHashMap.newKeySet();
    private volatile CallCancelledException cause;

    private CallContext(CallContext parent, long deadlineNanos, boolean hasDeadline) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
        // background is never cancelled, so its children need no link back to it
        this.parent = parent == BACKGROUND ? null : parent;
        if (this.parent != null) {
            this.parent.children.removeIf(CallContext::isDone);
            this.parent.children.add(this);
            CallCancelledException inherited = this.parent.cause;
            if (inherited != null) {
                cancel(inherited);
            }
        }
    }

    /**
     * Returns the root context: never cancelled and without a deadline.
     *
     * @return the background context
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    /**
     * Derives a cancellable child context with the same deadline.
     *
     * @return a new child context
     */
    public CallContext withCancel() {
        return new CallContext(this, deadlineNanos, hasDeadline);
    }

    /**
     * Derives a child context whose deadline is at most {@code timeout} from now.
     *
     * @param timeout the maximum time remaining
     * @return a new child context
     */
    public CallContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long candidate = System.nanoTime() + timeout.toNanos();
        if (hasDeadline && deadlineNanos - candidate < 0) {
            candidate = deadlineNanos;
        }
        return new CallContext(this, candidate, true);
    }

    /**
     * Derives a child context that expires at a wall-clock instant. The instant is converted to
     * a timeout once, so later clock adjustments do not move the deadline.
     *
     * @param deadline the wall-clock deadline
     * @return a new child context
     */
    public CallContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Duration left = Duration.between(Instant.now(), deadline);
        return withTimeout(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Cancels this context and every context derived from it, and detaches it from its parent.
     * Has no effect on the background context or on an already-cancelled context.
     *
     * <p>A context that is no longer needed should be cancelled even when its work succeeded,
     * so that its parent stops tracking it.
     */
    public void cancel() {
        cancel(new CallCancelledException("call cancelled", false));
    }

    private void cancel(CallCancelledException reason) {
        if (this == BACKGROUND) {
            return;
        }
        synchronized (done) {
            if (cause != null) {
                return;
            }
            cause = reason;
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (CallContext child : children) {
            child.cancel(reason);
        }
        children.clear();
        for (Registration hook : hooks) {
            hook.fire();
        }
        hooks.clear();
        done.complete(null);
    }

    /**
     * Returns whether the context was cancelled or its deadline has passed.
     *
     * @return true if operations using this context should stop
     */
    public boolean isDone() {
        return cause != null || (hasDeadline && System.nanoTime() - deadlineNanos >= 0);
    }

    /**
     * Returns whether this context carries a deadline.
     *
     * @return true if a deadline is set
     */
    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * Returns the time left before the deadline.
     *
     * @return remaining time (never negative), or empty if there is no deadline
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime())));
    }

    /**
     * Throws if the context is done.
     *
     * @throws CallCancelledException if cancelled or expired
     */
    public void checkActive() {
        CallCancelledException c = cause;
        if (c != null) {
            throw new CallCancelledException(c.getMessage(), c.isDeadlineExceeded());
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            throw expired();
        }
    }

    /**
     * Sleeps for the given duration unless the context ends first.
     *
     * @param duration how long to sleep
     * @throws CallCancelledException if the context ends before the sleep completes
     */
    public void sleep(Duration duration) {
        checkActive();
        long waitNanos = duration.toNanos();
        if (waitNanos <= 0) {
            return;
        }
        boolean cappedByDeadline = false;
        if (hasDeadline) {
            long left = deadlineNanos - System.nanoTime();
            if (left < waitNanos) {
                waitNanos = Math.max(0, left);
                cappedByDeadline = true;
            }
        }
        try {
            done.get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (cappedByDeadline) {
                throw expired();
            }
            return;
        } catch (InterruptedException e) {
            throw interrupted(e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("cancellation signal failed", e);
        }
        checkActive();
    }

    /**
     * Waits for a future to complete unless the context ends first.
     *
     * <p>If the future completed exceptionally, its cause is rethrown unchanged when it is
     * unchecked, otherwise wrapped in a {@link ClientException}.
     *
     * @param future the future to wait on
     * @param <T> the result type
     * @return the future's value
     * @throws CallCancelledException if the context ends first
     */
    public <T> T await(CompletableFuture<T> future) {
        checkActive();
        CompletableFuture<?> race =
                this == BACKGROUND ? future : CompletableFuture.anyOf(future, done);
        try {
            if (hasDeadline) {
                race.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            } else {
                race.get();
            }
        } catch (TimeoutException e) {
            if (!future.isDone()) {
                throw expired();
            }
        } catch (InterruptedException e) {
            throw interrupted(e);
        } catch (ExecutionException e) {
            // the future failed; unwrapped below
        }
        if (!future.isDone()) {
            checkActive();
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new CallCancelledException("operation cancelled", e);
        }
    }

    /**
     * Takes an element from the queue, waiting at most {@code max} (or until the context ends).
     *
     * @param queue the queue to poll
     * @param max maximum wait, or {@code null} to wait until the context ends
     * @param <E> element type
     * @return the element, or {@code null} if {@code max} elapsed first
     * @throws CallCancelledException if the context ends first
     */
    public <E> E poll(BlockingQueue<E> queue, Duration max) {
        long limit = max == null ? Long.MAX_VALUE : System.nanoTime() + max.toNanos();
        while (true) {
            checkActive();
            long now = System.nanoTime();
            if (max != null && now - limit >= 0) {
                return null;
            }
            long slice = SLICE_NANOS;
            if (max != null) {
                slice = Math.min(slice, limit - now);
            }
            try {
                E e = queue.poll(slice, TimeUnit.NANOSECONDS);
                if (e != null) {
                    return e;
                }
            } catch (InterruptedException ex) {
                throw interrupted(ex);
            }
        }
    }

    /**
     * Puts an element into a bounded queue, waiting for space unless the context ends first.
     *
     * @param queue the queue
     * @param element the element to insert
     * @param <E> element type
     * @throws CallCancelledException if the context ends first
     */
    public <E> void put(BlockingQueue<E> queue, E element) {
        while (true) {
            checkActive();
            try {
                if (queue.offer(element, SLICE_NANOS, TimeUnit.NANOSECONDS)) {
                    return;
                }
            } catch (InterruptedException ex) {
                throw interrupted(ex);
            }
        }
    }

    /**
     * Acquires one permit from the semaphore unless the context ends first.
     *
     * @param semaphore the semaphore
     * @throws CallCancelledException if the context ends first
     */
    public void acquire(Semaphore semaphore) {
        while (true) {
            checkActive();
            try {
                if (semaphore.tryAcquire(SLICE_NANOS, TimeUnit.NANOSECONDS)) {
                    return;
                }
            } catch (InterruptedException ex) {
                throw interrupted(ex);
            }
        }
    }

    /**
     * Registers a callback run once when the context is cancelled. Deadline expiry alone does not
     * trigger it; blocking waits observe deadlines themselves. If the context is already
     * cancelled the callback runs immediately on the calling thread.
     *
     * <p>The returned registration must be closed once the guarded work is over, otherwise the
     * callback (and whatever it captures) stays reachable for the life of the context.
     *
     * @param action the callback
     * @return a handle that withdraws the callback
     */
    public Registration onCancel(Runnable action) {
        Objects.requireNonNull(action, "action");
        Registration registration = new Registration(this, action);
        if (this == BACKGROUND) {
            return registration;
        }
        hooks.add(registration);
        if (cause != null && hooks.remove(registration)) {
            registration.fire();
        }
        return registration;
    }

    /** Number of live child contexts still linked to this one. */
    int childCount() {
        return children.size();
    }

    /** Number of cancel callbacks still registered. */
    int hookCount() {
        return hooks.size();
    }

    private CallCancelledException expired() {
        return new CallCancelledException("deadline exceeded", true);
    }

    private static CallCancelledException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new CallCancelledException("interrupted while waiting", e);
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new ClientException(String.valueOf(cause.getMessage()), cause);
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}. Closing it withdraws the callback; closing
     * after the callback has run is harmless.
     */
    public static final class Registration implements AutoCloseable {

        private final CallContext owner;
        private final AtomicBoolean pending = new AtomicBoolean(true);
        private volatile Runnable action;

        private Registration(CallContext owner, Runnable action) {
            this.owner = owner;
            this.action = action;
        }

        private void fire() {
            if (pending.compareAndSet(true, false)) {
                Runnable a = action;
                action = null;
                a.run();
            }
        }

        @Override
        public void close() {
            if (pending.compareAndSet(true, false)) {
                action = null;
                owner.hooks.remove(this);
            }
        }
    }

    @Override
    public String toString() {
        if (cause != null) {
            return "CallContext[cancelled]";
        }
        return hasDeadline
                ? "CallContext[remaining=" + remaining().orElse(Duration.ZERO).toMillis() + "ms]"
                : "CallContext[background]";
    }
}
