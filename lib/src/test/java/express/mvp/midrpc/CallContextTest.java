package express.mvp.midrpc;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CallContext")
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class CallContextTest {

    @Nested
    @DisplayName("Derivation")
    class Derivation {

        @Test
        @DisplayName("background is never done")
        void background() {
            CallContext ctx = CallContext.background();
            ctx.cancel();
            assertFalse(ctx.isDone());
            assertFalse(ctx.hasDeadline());
            assertTrue(ctx.remaining().isEmpty());
        }

        @Test
        @DisplayName("cancelling a parent cancels its children")
        void parentCancelsChild() {
            CallContext parent = CallContext.background().withCancel();
            CallContext child = parent.withTimeout(Duration.ofMinutes(1));

            parent.cancel();

            assertTrue(child.isDone());
            CallCancelledException e = assertThrows(CallCancelledException.class, child::checkActive);
            assertFalse(e.isDeadlineExceeded());
        }

        @Test
        @DisplayName("a child deadline never exceeds the parent's")
        void childDeadlineCapped() {
            CallContext parent = CallContext.background().withTimeout(Duration.ofSeconds(1));
            CallContext child = parent.withTimeout(Duration.ofHours(1));

            assertTrue(child.remaining().orElseThrow().compareTo(Duration.ofSeconds(1)) <= 0);
        }

        @Test
        @DisplayName("cancelling a child leaves the parent active")
        void childDoesNotCancelParent() {
            CallContext parent = CallContext.background().withCancel();
            CallContext child = parent.withCancel();

            child.cancel();

            assertTrue(child.isDone());
            assertFalse(parent.isDone());
        }

        @Test
        @DisplayName("a wall-clock deadline becomes a timeout")
        void withDeadline() {
            CallContext ctx = CallContext.background().withDeadline(Instant.now().plusSeconds(60));
            Duration left = ctx.remaining().orElseThrow();

            assertTrue(left.compareTo(Duration.ofSeconds(60)) <= 0);
            assertTrue(left.compareTo(Duration.ofSeconds(50)) > 0);
            assertTrue(CallContext.background().withDeadline(Instant.now().minusSeconds(1)).isDone());
        }
    }

    @Nested
    @DisplayName("Blocking helpers")
    class Blocking {

        @Test
        @DisplayName("sleep past the deadline reports expiry")
        void sleepExpires() {
            CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(30));

            CallCancelledException e =
                    assertThrows(CallCancelledException.class, () -> ctx.sleep(Duration.ofSeconds(10)));

            assertTrue(e.isDeadlineExceeded());
        }

        @Test
        @DisplayName("sleep returns early on cancel")
        void sleepCancelled() throws Exception {
            CallContext ctx = CallContext.background().withCancel();
            CountDownLatch started = new CountDownLatch(1);
            AtomicReference<Throwable> thrown = new AtomicReference<>();

            Thread t =
                    new Thread(
                            () -> {
                                started.countDown();
                                try {
                                    ctx.sleep(Duration.ofMinutes(1));
                                } catch (CallCancelledException e) {
                                    thrown.set(e);
                                }
                            });
            t.start();
            assertTrue(started.await(1, TimeUnit.SECONDS));
            ctx.cancel();
            t.join(2_000);

            assertFalse(t.isAlive());
            assertInstanceOf(CallCancelledException.class, thrown.get());
        }

        @Test
        @DisplayName("await returns the value or rethrows the failure unchanged")
        void awaitUnwraps() {
            CallContext ctx = CallContext.background();
            assertEquals("ok", ctx.await(CompletableFuture.completedFuture("ok")));

            ClientException failure = new ClientException("boom");
            CompletableFuture<String> failed = new CompletableFuture<>();
            failed.completeExceptionally(failure);

            assertSame(failure, assertThrows(ClientException.class, () -> ctx.await(failed)));
        }

        @Test
        @DisplayName("await gives up at the deadline")
        void awaitDeadline() {
            CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(30));

            CallCancelledException e =
                    assertThrows(
                            CallCancelledException.class,
                            () -> ctx.await(new CompletableFuture<String>()));

            assertTrue(e.isDeadlineExceeded());
        }

        @Test
        @DisplayName("poll returns null when the wait elapses")
        void pollTimesOut() {
            BlockingQueue<String> queue = new ArrayBlockingQueue<>(1);
            assertNull(CallContext.background().poll(queue, Duration.ofMillis(20)));

            queue.add("x");
            assertEquals("x", CallContext.background().poll(queue, null));
        }

        @Test
        @DisplayName("acquire and put observe cancellation")
        void acquireAndPutCancelled() {
            CallContext ctx = CallContext.background().withCancel();
            ctx.cancel();

            assertThrows(CallCancelledException.class, () -> ctx.acquire(new Semaphore(0)));
            assertThrows(
                    CallCancelledException.class,
                    () -> ctx.put(new ArrayBlockingQueue<String>(1), "x"));
        }

        @Test
        @DisplayName("interrupt becomes cancellation and keeps the flag")
        void interrupt() {
            Thread.currentThread().interrupt();
            try {
                assertThrows(
                        CallCancelledException.class,
                        () -> CallContext.background().sleep(Duration.ofSeconds(5)));
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("onCancel runs on cancel")
        void onCancel() {
            CallContext ctx = CallContext.background().withCancel();
            CountDownLatch ran = new CountDownLatch(1);
            ctx.onCancel(ran::countDown);

            ctx.cancel();

            assertEquals(0, ran.getCount());
        }

        @Test
        @DisplayName("onCancel on an already cancelled context runs at once")
        void onCancelAfterCancel() {
            CallContext ctx = CallContext.background().withCancel();
            ctx.cancel();
            CountDownLatch ran = new CountDownLatch(1);

            ctx.onCancel(ran::countDown);

            assertEquals(0, ran.getCount());
            assertEquals(0, ctx.hookCount());
        }

        @Test
        @DisplayName("a closed registration never runs and is forgotten")
        void registrationClosed() {
            CallContext ctx = CallContext.background().withCancel();
            CountDownLatch ran = new CountDownLatch(1);

            try (CallContext.Registration registration = ctx.onCancel(ran::countDown)) {
                assertEquals(1, ctx.hookCount());
            }
            ctx.cancel();

            assertEquals(1, ran.getCount());
            assertEquals(0, ctx.hookCount());
        }
    }

    @Nested
    @DisplayName("Bookkeeping")
    class Bookkeeping {

        @Test
        @DisplayName("background keeps no link to its children")
        void backgroundHoldsNothing() {
            CallContext background = CallContext.background();
            for (int i = 0; i < 10_000; i++) {
                background.withTimeout(Duration.ofMillis(1)).cancel();
                background.withCancel();
                background.onCancel(() -> { }).close();
            }

            assertEquals(0, background.childCount());
            assertEquals(0, background.hookCount());
        }

        @Test
        @DisplayName("cancelled children detach from a long-lived parent")
        void cancelledChildrenDetach() {
            CallContext parent = CallContext.background().withCancel();
            for (int i = 0; i < 10_000; i++) {
                CallContext child = parent.withTimeout(Duration.ofMinutes(1));
                child.onCancel(() -> { });
                child.cancel();
            }

            assertEquals(0, parent.childCount());
            assertFalse(parent.isDone());
        }

        @Test
        @DisplayName("expired children are pruned when the next child is derived")
        void expiredChildrenPruned() {
            CallContext parent = CallContext.background().withCancel();
            for (int i = 0; i < 100; i++) {
                parent.withTimeout(Duration.ZERO);
            }

            CallContext live = parent.withTimeout(Duration.ofMinutes(1));

            assertEquals(1, parent.childCount());
            parent.cancel();
            assertTrue(live.isDone());
            assertEquals(0, parent.childCount());
        }

        @Test
        @DisplayName("a child derived from a cancelled parent starts cancelled")
        void childOfCancelled() {
            CallContext parent = CallContext.background().withCancel();
            parent.cancel();

            CallContext child = parent.withCancel();

            assertTrue(child.isDone());
            assertEquals(0, parent.childCount());
        }
    }
}
