package express.mvp.midrpc.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.EOFException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
@DisplayName("ConnectionStateMachine")
class ConnectionStateMachineTest {

    private final ConnectionStateMachine machine = new ConnectionStateMachine("wss://nas.local");

    private void walk(ConnectionState... path) {
        for (ConnectionState next : path) {
            assertTrue(machine.transitionTo(next), machine + " -> " + next);
        }
    }

    @Test
    @DisplayName("a fresh socket is NEW, neither active nor closing")
    void fresh() {
        assertSame(ConnectionState.NEW, machine.getState());
        assertFalse(machine.isActive());
        assertFalse(machine.isClosedOrClosing());
        assertEquals("wss://nas.local [New]", machine.toString());
    }

    @Nested
    @DisplayName("transition table")
    class Table {

        @ParameterizedTest(name = "{0} -> {1} allowed={2}")
        @CsvSource({
            "NEW, CONNECTING, true",
            "NEW, CLOSED, true",
            "NEW, CONNECTED, false",
            "CONNECTING, CONNECTED, true",
            "CONNECTING, DISCONNECTED, true",
            "CONNECTING, CLOSED, false",
            "CONNECTED, DISCONNECTED, true",
            "CONNECTED, CLOSING, true",
            "CONNECTED, CLOSED, false",
            "CONNECTED, CONNECTED, false",
            "DISCONNECTED, CONNECTING, true",
            "DISCONNECTED, CLOSED, true",
            "DISCONNECTED, CONNECTED, false",
            "CLOSING, CLOSED, true",
            "CLOSING, CONNECTING, false"
        })
        void allowed(ConnectionState from, ConnectionState to, boolean allowed) {
            assertEquals(allowed, ConnectionStateMachine.isValidTransition(from, to));
        }

        @ParameterizedTest
        @EnumSource(ConnectionState.class)
        @DisplayName("nothing leaves CLOSED")
        void closedIsFinal(ConnectionState target) {
            assertFalse(ConnectionStateMachine.isValidTransition(ConnectionState.CLOSED, target));
        }
    }

    @Test
    @DisplayName("a socket can drop and redial repeatedly")
    void redialLoop() {
        walk(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
        assertTrue(machine.isActive());
        for (int i = 0; i < 3; i++) {
            walk(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, ConnectionState.CONNECTED);
        }
        walk(ConnectionState.CLOSING);
        assertTrue(machine.isClosedOrClosing());
        assertFalse(machine.isActive());
    }

    @Test
    @DisplayName("a rejected move leaves the state untouched")
    void rejected() {
        walk(ConnectionState.CONNECTING, ConnectionState.CONNECTED);

        assertFalse(machine.transitionTo(ConnectionState.CLOSED));
        assertSame(ConnectionState.CONNECTED, machine.getState());
    }

    @Nested
    @DisplayName("listeners")
    class Listeners {

        @Test
        @DisplayName("see each accepted move with its cause")
        void seeMoves() {
            List<String> seen = new ArrayList<>();
            List<Throwable> causes = new ArrayList<>();
            machine.addListener(
                    (from, to, cause) -> {
                        seen.add(from + "->" + to);
                        causes.add(cause);
                    });
            EOFException reset = new EOFException("connection reset by peer");

            machine.transitionTo(ConnectionState.CONNECTING);
            machine.transitionTo(ConnectionState.CLOSED);
            machine.transitionTo(ConnectionState.DISCONNECTED, reset);

            assertEquals(List.of("New->Connecting", "Connecting->Disconnected"), seen);
            assertNull(causes.get(0));
            assertSame(reset, causes.get(1));
        }

        @Test
        @DisplayName("a failing listener does not stop the others")
        void failingListener() {
            List<ConnectionState> seen = new ArrayList<>();
            machine.addListener(
                    (from, to, cause) -> {
                        throw new IllegalStateException("boom");
                    });
            machine.addListener((from, to, cause) -> seen.add(to));

            assertTrue(machine.transitionTo(ConnectionState.CONNECTING));
            assertEquals(List.of(ConnectionState.CONNECTING), seen);
        }

        @Test
        @DisplayName("stop hearing once removed")
        void removed() {
            List<ConnectionState> seen = new ArrayList<>();
            ConnectionStateListener listener = (from, to, cause) -> seen.add(to);
            machine.addListener(listener);
            machine.transitionTo(ConnectionState.CONNECTING);

            assertTrue(machine.removeListener(listener));
            assertFalse(machine.removeListener(listener));
            machine.transitionTo(ConnectionState.CONNECTED);

            assertEquals(List.of(ConnectionState.CONNECTING), seen);
        }
    }
}
