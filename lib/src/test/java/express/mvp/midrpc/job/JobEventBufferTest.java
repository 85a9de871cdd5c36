package express.mvp.midrpc.job;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JobEventBuffer")
class JobEventBufferTest {

    private static JobEvent success(long id) {
        return new JobEvent(id, JobState.SUCCESS, IntNode.valueOf((int) id), null);
    }

    @Test
    @DisplayName("keeps terminal events for late subscribers")
    void keepsTerminal() {
        JobEventBuffer buffer = new JobEventBuffer();
        buffer.add(success(1));
        buffer.add(new JobEvent(2, JobState.FAILED, null, "boom"));

        assertEquals(JobState.SUCCESS, buffer.find(1).state());
        assertEquals("boom", buffer.find(2).error());
        assertNull(buffer.find(3));
    }

    @Test
    @DisplayName("ignores non-terminal events")
    void ignoresProgress() {
        JobEventBuffer buffer = new JobEventBuffer();
        buffer.add(new JobEvent(1, JobState.RUNNING, null, null));
        buffer.add(JobEvent.disconnected(1));

        assertEquals(0, buffer.size());
        assertNull(buffer.find(1));
    }

    @Test
    @DisplayName("evicts the oldest event beyond capacity")
    void evictsOldest() {
        JobEventBuffer buffer = new JobEventBuffer();
        for (long id = 1; id <= JobEventBuffer.DEFAULT_CAPACITY + 1; id++) {
            buffer.add(success(id));
        }

        assertEquals(JobEventBuffer.DEFAULT_CAPACITY, buffer.size());
        assertNull(buffer.find(1));
        assertNotNull(buffer.find(2));
        assertNotNull(buffer.find(JobEventBuffer.DEFAULT_CAPACITY + 1));
    }

    @Test
    @DisplayName("returns the newest event for a repeated id")
    void newestWins() {
        JobEventBuffer buffer = new JobEventBuffer(4);
        buffer.add(new JobEvent(1, JobState.FAILED, null, "first"));
        buffer.add(success(1));

        assertEquals(JobState.SUCCESS, buffer.find(1).state());
    }

    @Test
    @DisplayName("rejects a non-positive capacity")
    void rejectsBadCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new JobEventBuffer(0));
    }
}
