package express.mvp.midrpc.ratelimit;

import express.mvp.midrpc.CallCancelledException;
import express.mvp.midrpc.CallContext;
import java.time.Duration;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket with a burst of one, sized in calls per minute.
 *
 * <p>With a burst of one the bucket degenerates to a minimum spacing between admissions: the
 * first call passes immediately, each following one waits until {@code 60s / callsPerMinute}
 * after the previous admission. Each caller reserves its slot under a lock and then sleeps
 * outside it, so waiting is cancellable through the {@link CallContext}; a caller that gives up
 * returns its slot.
 */
public final class TokenBucket {

    public static final int DEFAULT_CALLS_PER_MINUTE = 300;

    private final long intervalNanos;
    private final LongSupplier clock;
    private final Object lock = new Object();

    private final NavigableSet<Long> pending = new TreeSet<>();
    private long nextFreeNanos;
    private long lastGrantedNanos;
    private boolean started;
    private boolean granted;

    /**
     * Creates a bucket.
     *
     * @param callsPerMinute admission rate; values {@code <= 0} select {@link
     *     #DEFAULT_CALLS_PER_MINUTE}
     */
    public TokenBucket(int callsPerMinute) {
        this(callsPerMinute, System::nanoTime);
    }

    TokenBucket(int callsPerMinute, LongSupplier clock) {
        this.intervalNanos = intervalFor(callsPerMinute).toNanos();
        this.clock = clock;
    }

    /**
     * Converts a rate into the minimum spacing between admissions.
     *
     * @param callsPerMinute admission rate; values {@code <= 0} select the default
     * @return the spacing
     */
    public static Duration intervalFor(int callsPerMinute) {
        int rate = callsPerMinute <= 0 ? DEFAULT_CALLS_PER_MINUTE : callsPerMinute;
        return Duration.ofNanos(TimeUnit.MINUTES.toNanos(1) / rate);
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }

    /**
     * Waits for a token.
     *
     * <p>A wait that cannot finish before the context's deadline fails at once. A wait abandoned
     * because the context ended gives its slot back, so later callers are not delayed by it.
     *
     * @param ctx call context; cancelling it abandons the wait
     * @throws express.mvp.midrpc.CallCancelledException if the context ends first
     */
    public void acquire(CallContext ctx) {
        ctx.checkActive();
        long now = clock.getAsLong();
        long slot = reserveAt(now);
        long wait = slot - now;
        if (wait <= 0) {
            return;
        }
        Optional<Duration> left = ctx.remaining();
        if (left.isPresent() && left.get().toNanos() < wait) {
            release(slot);
            throw new CallCancelledException(
                    "rate limit wait of " + TimeUnit.NANOSECONDS.toMillis(wait)
                            + "ms would exceed the deadline",
                    true);
        }
        try {
            ctx.sleep(Duration.ofNanos(wait));
        } catch (CallCancelledException e) {
            release(slot);
            throw e;
        }
        admitted(slot);
    }

    /**
     * Reserves the next admission slot.
     *
     * @return nanoseconds to wait before the slot starts, 0 if it is available now
     */
    long reserve() {
        long now = clock.getAsLong();
        return reserveAt(now) - now;
    }

    /** Slots reserved with a wait whose caller has neither been admitted nor given up. */
    int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private long reserveAt(long now) {
        synchronized (lock) {
            long slot = !started || now - nextFreeNanos >= 0 ? now : nextFreeNanos;
            started = true;
            nextFreeNanos = slot + intervalNanos;
            if (slot == now) {
                grant(slot);
            } else {
                pending.add(slot);
            }
            return slot;
        }
    }

    private void admitted(long slot) {
        synchronized (lock) {
            if (pending.remove(slot)) {
                grant(slot);
            }
        }
    }

    private void grant(long slot) {
        if (!granted || slot - lastGrantedNanos > 0) {
            lastGrantedNanos = slot;
        }
        granted = true;
    }

    /** Gives an abandoned slot back: the next free slot follows the latest one still in use. */
    private void release(long slot) {
        synchronized (lock) {
            if (!pending.remove(slot)) {
                return;
            }
            if (pending.isEmpty() && !granted) {
                started = false;
                return;
            }
            long last = pending.isEmpty() ? lastGrantedNanos : pending.last();
            if (granted && lastGrantedNanos - last > 0) {
                last = lastGrantedNanos;
            }
            nextFreeNanos = last + intervalNanos;
        }
    }
}
