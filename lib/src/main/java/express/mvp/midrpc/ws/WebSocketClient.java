package express.mvp.midrpc.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.midrpc.CallCancelledException;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.ClientException;
import express.mvp.midrpc.MiddlewareClient;
import express.mvp.midrpc.Version;
import express.mvp.midrpc.WriteFileParams;
import express.mvp.midrpc.error.ErrorCodes;
import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.error.MiddlewareError;
import express.mvp.midrpc.error.RetryClassifier;
import express.mvp.midrpc.error.RetryPolicy;
import express.mvp.midrpc.error.SocketRetryClassifier;
import express.mvp.midrpc.job.Job;
import express.mvp.midrpc.job.JobEvent;
import express.mvp.midrpc.job.JobEventBuffer;
import express.mvp.midrpc.job.JobFailures;
import express.mvp.midrpc.job.JobIds;
import express.mvp.midrpc.job.JobPoller;
import express.mvp.midrpc.job.JobState;
import express.mvp.midrpc.job.LogReader;
import express.mvp.midrpc.lifecycle.ConnectionState;
import express.mvp.midrpc.lifecycle.ConnectionStateListener;
import express.mvp.midrpc.lifecycle.ConnectionStateMachine;
import express.mvp.midrpc.rpc.Json;
import express.mvp.midrpc.rpc.JsonRpcCodes;
import express.mvp.midrpc.rpc.JsonRpcException;
import express.mvp.midrpc.rpc.JsonRpcRequest;
import express.mvp.midrpc.rpc.JsonRpcResponse;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent-socket transport: JSON-RPC 2.0 over one authenticated WebSocket.
 *
 * <h2>Owner Thread</h2>
 *
 * <p>One dedicated thread owns the socket and every piece of mutable connection state: the
 * pending-request table, job subscriptions, the recent-event buffer, the request id counter and
 * the liveness ping. Callers and the socket reader never touch that state; they post messages to
 * a bounded mailbox, and callers wait on a per-request future. Socket callbacks carry the
 * connection they came from, so traffic from a replaced connection is ignored.
 *
 * <h2>Connection</h2>
 *
 * <p>The socket is dialed lazily by the first request, authenticated with {@code auth.login_ex}
 * and subscribed to {@code core.get_jobs} updates. When it drops, every pending request fails
 * with a retriable {@link JsonRpcCodes#INTERNAL} error, job waiters receive one synthetic {@link
 * JobState#DISCONNECTED} event, and the next request redials. After a redial, waiters that saw
 * the disconnect receive one {@link JobState#RECONNECTED} event.
 *
 * <h2>Job Completion</h2>
 *
 * <p>{@link #callAndWait} subscribes to the job's events. Terminal events are also kept in a
 * small buffer so a job that finishes before its waiter subscribes is still observed. While the
 * socket is down the waiter polls the job's state, and gives up with {@code ETIMEDOUT} if no
 * connection comes back within {@link WebSocketConfig#getReconnectTimeout()}.
 *
 * <h2>Fallback</h2>
 *
 * <p>Version probing, file reads and removals go through the fallback client (normally {@link
 * express.mvp.midrpc.ssh.SshClient}). This client owns the fallback and closes it.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * WebSocketConfig config = WebSocketConfig.builder()
 *     .host("nas.local").username("admin").apiKey(key)
 *     .fallback(new SshClient(sshConfig))
 *     .build();
 * try (WebSocketClient client = new WebSocketClient(config)) {
 *     client.connect(ctx);
 *     client.callAndWait(ctx, "pool.dataset.create", Map.of("name", "tank/apps"));
 * }
 * }</pre>
 */
public final class WebSocketClient implements MiddlewareClient {

    private static final Logger LOGGER = Logger.getLogger(WebSocketClient.class.getName());

    static final String API_PATH = "/api/current";
    static final String AUTH_ID = "auth";
    static final String SUBSCRIBE_ID = "job-sub";
    static final String JOB_COLLECTION = "core.get_jobs";

    private static final int SUBSCRIBER_CAPACITY = 10;
    private static final long IDLE_POLL_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final WebSocketConfig config;
    private final RpcConnector connector;
    private final boolean ownsConnector;
    private final MiddlewareClient fallback;
    private final BlockingQueue<Message> mailbox;
    private final Semaphore inFlight;
    private final JobPoller poller;
    private final LogReader logReader;
    private final RetryPolicy outageBackoff;
    private final RetryClassifier classifier = new SocketRetryClassifier();
    private final ConnectionStateMachine state;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private final Thread owner;

    private volatile Version version;

    // Owner-thread state. Only runLoop and the methods it calls touch these.
    private RpcConnection conn;
    private final Map<String, CompletableFuture<JsonNode>> pending = new HashMap<>();
    private final Map<Long, BlockingQueue<JobEvent>> jobSubs = new HashMap<>();
    private final JobEventBuffer recentEvents = new JobEventBuffer();
    private long nextId;
    private boolean notifiedDisconnect;
    private boolean awaitingPong;
    private long nextPingAt;
    private long pongDeadline;

    /**
     * Creates a client that dials with Netty.
     *
     * @param config transport settings
     */
    public WebSocketClient(WebSocketConfig config) {
        this(config, new NettyRpcConnector(), true);
    }

    /**
     * Creates a client with a custom connector. The connector is not closed by this client.
     *
     * @param config transport settings
     * @param connector opens socket connections
     */
    public WebSocketClient(WebSocketConfig config, RpcConnector connector) {
        this(config, connector, false);
    }

    @SuppressFBWarnings(
            value = {"SC_START_IN_CTOR", "CT_CONSTRUCTOR_THROW"},
            justification = "The owner thread only reads fields assigned before start().")
    private WebSocketClient(WebSocketConfig config, RpcConnector connector, boolean ownsConnector) {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.ownsConnector = ownsConnector;
        this.fallback = config.getFallback();
        this.mailbox = new ArrayBlockingQueue<>(config.getMailboxCapacity());
        this.inFlight = new Semaphore(config.getMaxConcurrent(), true);
        this.logReader =
                (ctx, path) -> new String(fallback.readFile(ctx, path), StandardCharsets.UTF_8);
        this.poller = new JobPoller(this::call, null, logReader);
        this.outageBackoff =
                RetryPolicy.builder()
                        .initialDelay(Duration.ofSeconds(1))
                        .maxDelay(Duration.ofSeconds(30))
                        .classifier(classifier)
                        .build();
        this.state = new ConnectionStateMachine("ws://" + config.getHost());
        this.owner = new Thread(this::runLoop, "midrpc-ws-owner-" + config.getHost());
        this.owner.setDaemon(true);
        this.owner.start();
    }

    @Override
    public void connect(CallContext ctx) {
        fallback.connect(ctx);
        Version v = fallback.version();
        version = v;
        LOGGER.info("WebSocket client for " + config.getHost() + " ready, middleware version " + v);
    }

    @Override
    public Version version() {
        Version v = version;
        if (v == null) {
            throw new IllegalStateException("version() called before connect()");
        }
        return v;
    }

    /** Returns the lifecycle state of the underlying socket. */
    public ConnectionState connectionState() {
        return state.getState();
    }

    /**
     * Registers a listener for socket state changes. Listeners run on the owner thread and must
     * not block.
     *
     * @param listener the listener
     */
    public void addConnectionStateListener(ConnectionStateListener listener) {
        state.addListener(listener);
    }

    /**
     * Unregisters a listener added with {@link #addConnectionStateListener}.
     *
     * @param listener the listener
     * @return true if it was registered
     */
    public boolean removeConnectionStateListener(ConnectionStateListener listener) {
        return state.removeListener(listener);
    }

    @Override
    public JsonNode call(CallContext ctx, String method, Object params) {
        ensureOpen();
        ArrayNode args = Json.positional(params);
        ctx.acquire(inFlight);
        CompletableFuture<JsonNode> reply = new CompletableFuture<>();
        reply.whenComplete((r, t) -> inFlight.release());
        try {
            ctx.put(mailbox, new Request(method, args, reply));
        } catch (RuntimeException e) {
            reply.cancel(false);
            throw e;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("call " + method);
        }
        try {
            return ctx.await(reply);
        } catch (CallCancelledException e) {
            reply.cancel(false);
            throw e;
        } catch (JsonRpcException e) {
            throw e.toMiddlewareError();
        }
    }

    @Override
    public JsonNode callAndWait(CallContext ctx, String method, Object params) {
        JsonNode result = call(ctx, method, params);
        if (!JobIds.isJobId(result)) {
            return result;
        }
        long jobId = JobIds.parse(result);
        Duration timeout = ctx.remaining().orElse(config.getJobTimeout());
        CallContext waitCtx = ctx.hasDeadline() ? ctx : ctx.withTimeout(timeout);

        BlockingQueue<JobEvent> sink = new ArrayBlockingQueue<>(SUBSCRIBER_CAPACITY);
        try {
            subscribe(waitCtx, jobId, sink);
            return awaitJob(waitCtx, jobId, sink);
        } catch (CallCancelledException e) {
            if (e.isDeadlineExceeded()) {
                throw ErrorParser.timeoutError(jobId, timeout);
            }
            throw e;
        } finally {
            unsubscribe(jobId, sink);
            if (waitCtx != ctx) {
                waitCtx.cancel();
            }
        }
    }

    /**
     * Registers {@code sink} for the events of one job. A terminal event already buffered is
     * delivered at once; during an outage a {@link JobState#DISCONNECTED} event is queued.
     */
    void subscribe(CallContext ctx, long jobId, BlockingQueue<JobEvent> sink) {
        ensureOpen();
        ctx.put(mailbox, new Subscribe(jobId, sink));
    }

    /** Best effort: a full mailbox leaves the subscription until the job's terminal event. */
    void unsubscribe(long jobId, BlockingQueue<JobEvent> sink) {
        if (!mailbox.offer(new Unsubscribe(jobId, sink)) && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Mailbox full, job " + jobId + " subscription left to expire");
        }
    }

    private JsonNode awaitJob(CallContext ctx, long jobId, BlockingQueue<JobEvent> sink) {
        long windowDeadline = 0;
        boolean outage = false;
        while (true) {
            Duration wait = null;
            if (outage) {
                long left = windowDeadline - System.nanoTime();
                if (left <= 0) {
                    throw ErrorParser.reconnectTimeoutError(jobId, config.getReconnectTimeout());
                }
                wait = Duration.ofNanos(left);
            }
            JobEvent event = ctx.poll(sink, wait);
            if (event == null) {
                throw ErrorParser.reconnectTimeoutError(jobId, config.getReconnectTimeout());
            }
            switch (event.state()) {
                case SUCCESS -> {
                    return event.result() != null ? event.result() : NullNode.getInstance();
                }
                case FAILED, ABORTED -> throw JobFailures.toError(ctx, event.toJob(), logReader);
                case DISCONNECTED -> {
                    if (!outage) {
                        outage = true;
                        windowDeadline = System.nanoTime() + config.getReconnectTimeout().toNanos();
                        LOGGER.info("Connection lost while waiting for job " + jobId
                                + ", polling until it is re-established");
                    }
                    Job job = pollThroughOutage(ctx, jobId, windowDeadline);
                    if (job.state().isTerminal()) {
                        return resolve(ctx, job);
                    }
                }
                case RECONNECTED -> {
                    Job job = poller.fetch(ctx, jobId);
                    if (job.state().isTerminal()) {
                        return resolve(ctx, job);
                    }
                    outage = false;
                }
                default -> {
                    if (LOGGER.isLoggable(Level.FINEST)) {
                        LOGGER.finest("Job " + jobId + " is " + event.state());
                    }
                }
            }
        }
    }

    private Job pollThroughOutage(CallContext ctx, long jobId, long windowDeadline) {
        int attempt = 0;
        while (true) {
            try {
                return poller.fetch(ctx, jobId);
            } catch (CallCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!classifier.isRetriable(e)) {
                    throw e;
                }
                long left = windowDeadline - System.nanoTime();
                if (left <= 0) {
                    throw ErrorParser.reconnectTimeoutError(jobId, config.getReconnectTimeout());
                }
                long delay =
                        Math.min(outageBackoff.delayFor(attempt++), TimeUnit.NANOSECONDS.toMillis(left));
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Polling job " + jobId + " failed (" + e.getMessage()
                            + "), retrying in " + delay + "ms");
                }
                ctx.sleep(Duration.ofMillis(delay));
            }
        }
    }

    private JsonNode resolve(CallContext ctx, Job job) {
        JsonNode result = poller.resolve(ctx, job);
        return result != null ? result : NullNode.getInstance();
    }

    @Override
    public void writeFile(CallContext ctx, String path, WriteFileParams params) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("mode", params.mode());
        options.put("uid", params.uidOrUnchanged());
        options.put("gid", params.gidOrUnchanged());
        String content = Base64.getEncoder().encodeToString(params.content());
        call(ctx, "filesystem.file_receive", List.of(path, content, options));
    }

    @Override
    public byte[] readFile(CallContext ctx, String path) {
        return fallback.readFile(ctx, path);
    }

    @Override
    public void deleteFile(CallContext ctx, String path) {
        fallback.deleteFile(ctx, path);
    }

    @Override
    public void removeDir(CallContext ctx, String path) {
        fallback.removeDir(ctx, path);
    }

    @Override
    public void removeAll(CallContext ctx, String path) {
        fallback.removeAll(ctx, path);
    }

    @Override
    public boolean fileExists(CallContext ctx, String path) {
        try {
            call(ctx, "filesystem.stat", path);
            return true;
        } catch (MiddlewareError e) {
            if (isNotFound(e)) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void chown(CallContext ctx, String path, int uid, int gid) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("path", path);
        params.put("uid", uid);
        params.put("gid", gid);
        callAndWait(ctx, "filesystem.chown", params);
    }

    @Override
    public void chmodRecursive(CallContext ctx, String path, int mode) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("path", path);
        params.put("mode", String.format("%04o", mode));
        params.put("options", Map.of("recursive", true));
        callAndWait(ctx, "filesystem.setperm", params);
    }

    @Override
    public void mkdirAll(CallContext ctx, String path, int mode) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("path", path);
        params.put("options", Map.of("mode", String.format("%04o", mode)));
        call(ctx, "filesystem.mkdir", params);
    }

    /**
     * Stops the owner thread, fails outstanding requests, closes the socket and the fallback
     * client.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!mailbox.offer(new Close(), 5, TimeUnit.SECONDS)) {
                LOGGER.warning("Owner mailbox full on close, interrupting owner thread");
                owner.interrupt();
            }
            terminated.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.log(Level.WARNING, "Owner thread did not stop cleanly", e);
        } finally {
            if (ownsConnector) {
                connector.close();
            }
            fallback.close();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("client is closed");
        }
    }

    static boolean isNotFound(MiddlewareError e) {
        if (e.hasCode(ErrorCodes.ENOENT)) {
            return true;
        }
        return e.getCause() instanceof JsonRpcException rpc
                && rpc.error().errno() == JsonRpcCodes.ENOENT;
    }

    URI endpoint() {
        String scheme = config.isTls() ? "wss" : "ws";
        return URI.create(scheme + "://" + config.getHost() + ":" + config.getPort() + API_PATH);
    }

    // ---------------------------------------------------------------------------------------
    // Owner thread
    // ---------------------------------------------------------------------------------------

    private void runLoop() {
        try {
            while (true) {
                Message message;
                try {
                    message = mailbox.poll(pollTimeoutNanos(), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    shutdown();
                    return;
                }
                if (message instanceof Close) {
                    shutdown();
                    return;
                }
                if (message != null) {
                    try {
                        dispatch(message);
                    } catch (RuntimeException e) {
                        LOGGER.log(
                                Level.WARNING,
                                "Failed to handle " + message.getClass().getSimpleName(),
                                e);
                    }
                }
                keepAlive();
            }
        } catch (RuntimeException | Error e) {
            LOGGER.log(Level.SEVERE, "WebSocket owner thread failed", e);
            shutdown();
            throw e;
        } finally {
            terminated.complete(null);
        }
    }

    private void dispatch(Message message) {
        if (message instanceof Request r) {
            onRequest(r);
        } else if (message instanceof Inbound in) {
            if (in.conn() == conn) {
                onInbound(in.text());
            }
        } else if (message instanceof Pong p) {
            if (p.conn() == conn) {
                awaitingPong = false;
            }
        } else if (message instanceof ConnectionLost lost) {
            if (lost.conn() == conn) {
                disconnect(lost.cause());
            }
        } else if (message instanceof Subscribe s) {
            onSubscribe(s);
        } else if (message instanceof Unsubscribe u) {
            jobSubs.remove(u.jobId(), u.sink());
        }
    }

    private void onRequest(Request r) {
        if (r.reply().isDone()) {
            return;
        }
        if (conn == null) {
            try {
                openConnection();
            } catch (RuntimeException e) {
                r.reply().completeExceptionally(e);
                return;
            }
        }
        String id = "req-" + nextId++;
        String frame = JsonRpcRequest.of(id, r.method(), r.params()).toJson();
        pending.put(id, r.reply());
        try {
            conn.send(frame);
        } catch (RuntimeException e) {
            disconnect(e);
        }
    }

    private void openConnection() {
        Version v = version;
        if (v == null) {
            throw new IllegalStateException("connect() must be called before issuing requests");
        }
        if (!v.atLeast(25, 0)) {
            throw new ClientException(
                    "WebSocket transport requires middleware 25.0 or later (detected version: "
                            + v + "); use the SSH transport instead");
        }
        state.transitionTo(ConnectionState.CONNECTING);
        URI endpoint = endpoint();
        RpcConnection c = null;
        try {
            c = connector.open(endpoint, config);
            authenticate(c);
            subscribeJobs(c);
        } catch (RuntimeException e) {
            if (c != null) {
                c.close();
            }
            state.transitionTo(ConnectionState.DISCONNECTED, e);
            LOGGER.warning("WebSocket connection to " + endpoint + " failed: " + e.getMessage());
            throw e;
        }
        final RpcConnection opened = c;
        c.start(new RpcConnectionListener() {
            @Override
            public void onText(String text) {
                post(new Inbound(opened, text));
            }

            @Override
            public void onPong() {
                post(new Pong(opened));
            }

            @Override
            public void onClosed(Throwable cause) {
                post(new ConnectionLost(opened, cause));
            }
        });
        conn = c;
        state.transitionTo(ConnectionState.CONNECTED);
        awaitingPong = false;
        nextPingAt = System.nanoTime() + config.getPingInterval().toNanos();
        LOGGER.info("WebSocket connected to " + endpoint);

        if (notifiedDisconnect && !jobSubs.isEmpty()) {
            fanOut(JobState.RECONNECTED);
        }
        notifiedDisconnect = false;
    }

    private void authenticate(RpcConnection c) {
        Map<String, Object> credentials = new LinkedHashMap<>();
        credentials.put("mechanism", "API_KEY_PLAIN");
        credentials.put("username", config.getUsername());
        credentials.put("api_key", config.getApiKey());
        JsonRpcResponse resp = exchange(c, AUTH_ID, "auth.login_ex", List.of(credentials));
        if (resp.isError()) {
            throw new ClientException("authentication failed: " + resp.error().describe());
        }
        String outcome = resp.result() == null ? "" : resp.result().path("response_type").asText("");
        if (!"SUCCESS".equals(outcome)) {
            throw new ClientException("authentication failed: response_type=" + outcome);
        }
    }

    private void subscribeJobs(RpcConnection c) {
        JsonRpcResponse resp = exchange(c, SUBSCRIBE_ID, "core.subscribe", List.of(JOB_COLLECTION));
        if (resp.isError()) {
            throw new ClientException("job subscription failed: " + resp.error().describe());
        }
    }

    private JsonRpcResponse exchange(RpcConnection c, String id, String method, Object params) {
        c.send(JsonRpcRequest.of(id, method, params).toJson());
        long deadline = System.nanoTime() + config.getConnectTimeout().toNanos();
        while (true) {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                throw new ClientException("timed out waiting for " + method + " response");
            }
            JsonRpcResponse resp = JsonRpcResponse.parse(c.receive(Duration.ofNanos(left)));
            if (id.equals(resp.id())) {
                return resp;
            }
        }
    }

    private void onInbound(String text) {
        JsonRpcResponse resp;
        try {
            resp = JsonRpcResponse.parse(text);
        } catch (ClientException e) {
            LOGGER.fine("Ignoring malformed frame: " + e.getMessage());
            return;
        }
        if (resp.id() != null) {
            CompletableFuture<JsonNode> reply = pending.remove(resp.id());
            if (reply == null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Ignoring response for unknown request " + resp.id());
                }
                return;
            }
            if (!resp.isError()) {
                reply.complete(resp.result() != null ? resp.result() : NullNode.getInstance());
                return;
            }
            JsonRpcException error = new JsonRpcException(resp.error());
            if (resp.error().reasonContains(ErrorCodes.ENOTAUTHENTICATED)) {
                disconnect(error);
            }
            reply.completeExceptionally(error);
            return;
        }
        if ("collection_update".equals(resp.method()) && resp.params() != null) {
            onCollectionUpdate(resp.params());
        }
    }

    private void onCollectionUpdate(JsonNode params) {
        if (!JOB_COLLECTION.equals(params.path("collection").asText())) {
            return;
        }
        long jobId = params.path("id").asLong();
        JsonNode fields = params.path("fields");
        JsonNode error = fields.path("error");
        JobEvent event =
                new JobEvent(
                        jobId,
                        JobState.fromWire(fields.path("state").asText(null)),
                        fields.get("result"),
                        error.isTextual() ? error.asText() : null);

        if (event.state().isTerminal()) {
            recentEvents.add(event);
            BlockingQueue<JobEvent> sink = jobSubs.remove(jobId);
            if (sink != null) {
                deliverTerminal(sink, event);
            }
            return;
        }
        BlockingQueue<JobEvent> sink = jobSubs.get(jobId);
        if (sink != null) {
            sink.offer(event);
        }
    }

    private void onSubscribe(Subscribe s) {
        JobEvent recent = recentEvents.find(s.jobId());
        if (recent != null) {
            deliverTerminal(s.sink(), recent);
            return;
        }
        jobSubs.put(s.jobId(), s.sink());
        if (notifiedDisconnect) {
            s.sink().offer(JobEvent.disconnected(s.jobId()));
        }
    }

    /** A terminal event must not be lost, so the oldest queued event gives way if needed. */
    private static void deliverTerminal(BlockingQueue<JobEvent> sink, JobEvent event) {
        if (sink.offer(event)) {
            return;
        }
        sink.poll();
        if (!sink.offer(event)) {
            LOGGER.warning("Dropped terminal event for job " + event.jobId());
        }
    }

    private void fanOut(JobState synthetic) {
        for (Map.Entry<Long, BlockingQueue<JobEvent>> e : jobSubs.entrySet()) {
            JobEvent event =
                    synthetic == JobState.DISCONNECTED
                            ? JobEvent.disconnected(e.getKey())
                            : JobEvent.reconnected(e.getKey());
            e.getValue().offer(event);
        }
    }

    private void disconnect(Throwable cause) {
        if (conn != null) {
            conn.close();
            conn = null;
            state.transitionTo(ConnectionState.DISCONNECTED, cause);
            LOGGER.warning("WebSocket connection to " + config.getHost() + " lost: "
                    + (cause != null ? cause.getMessage() : "unknown cause"));
        }
        awaitingPong = false;
        failPending(cause);
        if (!notifiedDisconnect) {
            fanOut(JobState.DISCONNECTED);
            notifiedDisconnect = true;
        }
    }

    private void failPending(Throwable cause) {
        if (pending.isEmpty()) {
            return;
        }
        String reason = cause != null ? cause.getMessage() : "connection closed";
        List<CompletableFuture<JsonNode>> replies = new ArrayList<>(pending.values());
        pending.clear();
        for (CompletableFuture<JsonNode> reply : replies) {
            reply.completeExceptionally(
                    JsonRpcException.connectionLost("connection lost: " + reason, cause));
        }
    }

    private void keepAlive() {
        if (conn == null || config.getPingInterval().isZero()) {
            return;
        }
        long now = System.nanoTime();
        if (awaitingPong) {
            if (now - pongDeadline >= 0) {
                disconnect(new ClientException("no pong within " + config.getPingTimeout()));
            }
            return;
        }
        if (now - nextPingAt >= 0) {
            try {
                conn.ping();
            } catch (RuntimeException e) {
                disconnect(e);
                return;
            }
            awaitingPong = true;
            pongDeadline = now + config.getPingTimeout().toNanos();
            nextPingAt = now + config.getPingInterval().toNanos();
        }
    }

    private long pollTimeoutNanos() {
        if (conn == null || config.getPingInterval().isZero()) {
            return IDLE_POLL_NANOS;
        }
        long target = awaitingPong ? pongDeadline : nextPingAt;
        return Math.max(0, Math.min(target - System.nanoTime(), IDLE_POLL_NANOS));
    }

    private void shutdown() {
        if (state.getState() == ConnectionState.NEW) {
            state.transitionTo(ConnectionState.CLOSED);
        } else {
            state.transitionTo(ConnectionState.CLOSING);
        }
        if (conn != null) {
            conn.close();
            conn = null;
        }
        ClientException closedError = new ClientException("client is closed");
        for (CompletableFuture<JsonNode> reply : pending.values()) {
            reply.completeExceptionally(closedError);
        }
        pending.clear();
        if (!notifiedDisconnect) {
            fanOut(JobState.DISCONNECTED);
            notifiedDisconnect = true;
        }
        jobSubs.clear();
        Message leftover;
        while ((leftover = mailbox.poll()) != null) {
            if (leftover instanceof Request r) {
                r.reply().completeExceptionally(closedError);
            }
        }
        state.transitionTo(ConnectionState.CLOSED);
        LOGGER.info("WebSocket client for " + config.getHost() + " closed");
    }

    /** Posts from a socket callback; gives up once the client is closed. */
    private void post(Message message) {
        try {
            while (!closed.get()) {
                if (mailbox.offer(message, 100, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.fine("Interrupted while posting " + message.getClass().getSimpleName());
        }
    }

    private interface Message {}

    private record Request(String method, ArrayNode params, CompletableFuture<JsonNode> reply)
            implements Message {}

    private record Inbound(RpcConnection conn, String text) implements Message {}

    private record Pong(RpcConnection conn) implements Message {}

    private record ConnectionLost(RpcConnection conn, Throwable cause) implements Message {}

    private record Subscribe(long jobId, BlockingQueue<JobEvent> sink) implements Message {}

    private record Unsubscribe(long jobId, BlockingQueue<JobEvent> sink) implements Message {}

    private record Close() implements Message {}
}
