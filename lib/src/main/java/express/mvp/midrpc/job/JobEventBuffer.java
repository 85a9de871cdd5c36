package express.mvp.midrpc.job;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Fixed-capacity FIFO of recent terminal job events.
 *
 * <p>A job may finish between the call that started it returning and its waiter subscribing. The
 * buffer keeps the last {@link #DEFAULT_CAPACITY} terminal events so a late subscriber can still
 * find its result. When full, the oldest event is evicted.
 *
 * <p>Not thread-safe: owned by the socket transport's owner thread.
 */
public final class JobEventBuffer {

    public static final int DEFAULT_CAPACITY = 100;

    private final ArrayDeque<JobEvent> events;
    private final int capacity;

    public JobEventBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public JobEventBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    /**
     * Records a terminal event; non-terminal events are ignored.
     *
     * @param event the event
     */
    public void add(JobEvent event) {
        if (!event.state().isTerminal()) {
            return;
        }
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    /**
     * Finds the most recent terminal event for a job.
     *
     * @param jobId job id
     * @return the event, or {@code null}
     */
    public JobEvent find(long jobId) {
        Iterator<JobEvent> it = events.descendingIterator();
        while (it.hasNext()) {
            JobEvent e = it.next();
            if (e.jobId() == jobId) {
                return e;
            }
        }
        return null;
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
