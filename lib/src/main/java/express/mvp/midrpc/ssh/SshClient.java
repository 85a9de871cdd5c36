package express.mvp.midrpc.ssh;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.ClientException;
import express.mvp.midrpc.MiddlewareClient;
import express.mvp.midrpc.Version;
import express.mvp.midrpc.WriteFileParams;
import express.mvp.midrpc.error.ErrorCodes;
import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.error.MiddlewareError;
import express.mvp.midrpc.job.JobIds;
import express.mvp.midrpc.job.JobPoller;
import express.mvp.midrpc.job.JobPollerConfig;
import express.mvp.midrpc.rpc.Json;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Shell-command transport: every call runs {@code sudo midclt call ...} over SSH.
 *
 * <h2>Connection</h2>
 *
 * <p>The SSH session is opened lazily by the first operation, under a lock so concurrent first
 * calls share one session. A session that drops is discarded and the next operation reconnects.
 * {@link #connect(CallContext)} additionally queries {@code system.info} and caches the version.
 *
 * <h2>Concurrency</h2>
 *
 * <p>A semaphore with {@link SshConfig#getMaxSessions()} permits bounds concurrent remote
 * commands. Waiting for a permit is cancellable through the call context.
 *
 * <h2>Job Completion</h2>
 *
 * <p>Middleware 25.0 and newer accept {@code midclt call -j}, which blocks remotely until the job
 * ends and prints its result last. Older versions are handled by issuing a plain call and polling
 * the returned job id with {@link JobPoller}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (SshClient client = new SshClient(config)) {
 *     client.connect(CallContext.background());
 *     JsonNode pools = client.call(CallContext.background(), "pool.query", null);
 * }
 * }</pre>
 */
public final class SshClient implements MiddlewareClient {

    private static final Logger LOGGER = Logger.getLogger(SshClient.class.getName());

    private static final Pattern ANSI = Pattern.compile("\\x1b\\[[0-9;]*[a-zA-Z]|\\x1b\\][^\\x07]*\\x07");

    private final SshConfig config;
    private final RemoteShellConnector connector;
    private final Semaphore sessions;
    private final ReentrantLock connectLock = new ReentrantLock();
    private final JobPoller poller;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile RemoteShell shell;
    private volatile Version version;

    /**
     * Creates a client that connects with JSch.
     *
     * @param config connection settings
     */
    public SshClient(SshConfig config) {
        this(config, new JschShellConnector(), JobPollerConfig.defaults());
    }

    /**
     * Creates a client with a custom connector and poll schedule.
     *
     * @param config connection settings
     * @param connector opens shell sessions
     * @param pollerConfig poll schedule used for versions without remote job waiting
     */
    public SshClient(SshConfig config, RemoteShellConnector connector, JobPollerConfig pollerConfig) {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.sessions = new Semaphore(config.getMaxSessions(), true);
        this.poller = new JobPoller(this::call, pollerConfig);
    }

    @Override
    public void connect(CallContext ctx) {
        ensureShell(ctx);
        JsonNode info = call(ctx, "system.info", null);
        String raw = info.path("version").asText("");
        try {
            version = Version.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new ClientException("cannot determine middleware version from system.info", e);
        }
        LOGGER.info("Connected to " + config.getHost() + ", middleware version " + raw);
    }

    @Override
    public Version version() {
        Version v = version;
        if (v == null) {
            throw new IllegalStateException("version() called before connect()");
        }
        return v;
    }

    @Override
    public JsonNode call(CallContext ctx, String method, Object params) {
        String command = CommandBuilder.call(method, params, false);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("call " + method);
        }
        CommandResult result = run(ctx, command);
        String out = result.stdoutText().strip();
        if (out.isEmpty()) {
            return NullNode.getInstance();
        }
        return Json.read(out);
    }

    @Override
    public JsonNode callAndWait(CallContext ctx, String method, Object params) {
        Version v = version;
        if (v == null) {
            connect(ctx);
            v = version;
        }

        if (v.atLeast(25, 0)) {
            String command = CommandBuilder.call(method, params, true);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("call -j " + method);
            }
            CommandResult result = run(ctx, command);
            return lastJsonLine(stripAnsi(result.stdoutText()));
        }

        JsonNode result = call(ctx, method, params);
        if (!JobIds.isJobId(result)) {
            return result;
        }
        return poller.await(ctx, JobIds.parse(result), jobTimeout(ctx));
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
        return run(ctx, CommandBuilder.sudo("cat", path)).stdout();
    }

    @Override
    public void deleteFile(CallContext ctx, String path) {
        run(ctx, CommandBuilder.sudo("rm", path));
    }

    @Override
    public void removeDir(CallContext ctx, String path) {
        run(ctx, CommandBuilder.sudo("rmdir", path));
    }

    @Override
    public void removeAll(CallContext ctx, String path) {
        run(ctx, CommandBuilder.sudo("rm", "-rf", path));
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
        run(ctx, CommandBuilder.sudo("mkdir", "-p", "-m", String.format("%04o", mode), path));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connectLock.lock();
        try {
            RemoteShell s = shell;
            shell = null;
            if (s != null) {
                s.close();
                LOGGER.info("SSH session to " + config.getHost() + " closed");
            }
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Runs one remote command under a session permit.
     *
     * @throws MiddlewareError parsed from the output if the command exits non-zero
     */
    CommandResult run(CallContext ctx, String command) {
        ctx.acquire(sessions);
        try {
            RemoteShell s = ensureShell(ctx);
            CommandResult result;
            try {
                result = s.exec(ctx, command);
            } catch (ClientException e) {
                discardIfDropped(s);
                throw e;
            }
            if (!result.isSuccess()) {
                throw ErrorParser.parse(
                        "Process exited with status " + result.exitStatus() + ": "
                                + stripAnsi(result.failureOutput()));
            }
            return result;
        } finally {
            sessions.release();
        }
    }

    private RemoteShell ensureShell(CallContext ctx) {
        RemoteShell s = shell;
        if (s != null && s.isConnected()) {
            return s;
        }
        connectLock.lock();
        try {
            if (closed.get()) {
                throw new IllegalStateException("client is closed");
            }
            s = shell;
            if (s != null && s.isConnected()) {
                return s;
            }
            if (s != null) {
                LOGGER.info("SSH session to " + config.getHost() + " dropped, reconnecting");
                s.close();
            }
            ctx.checkActive();
            s = connector.connect(config);
            shell = s;
            return s;
        } finally {
            connectLock.unlock();
        }
    }

    private void discardIfDropped(RemoteShell s) {
        if (s.isConnected()) {
            return;
        }
        connectLock.lock();
        try {
            if (shell == s) {
                shell = null;
                s.close();
            }
        } finally {
            connectLock.unlock();
        }
    }

    private Duration jobTimeout(CallContext ctx) {
        return ctx.remaining().orElse(config.getJobTimeout());
    }

    static boolean isNotFound(MiddlewareError e) {
        return e.hasCode(ErrorCodes.ENOENT)
                || (e.raw() != null && e.raw().contains("No such file or directory"));
    }

    static String stripAnsi(String text) {
        return ANSI.matcher(text).replaceAll("");
    }

    /**
     * Picks the job result out of {@code midclt call -j} output, which prints progress lines
     * before the result.
     */
    static JsonNode lastJsonLine(String output) {
        String[] lines = output.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node = Json.tryRead(line);
            if (node != null) {
                return node;
            }
        }
        String trimmed = output.strip();
        return trimmed.isEmpty() ? NullNode.getInstance() : Json.read(trimmed);
    }
}
