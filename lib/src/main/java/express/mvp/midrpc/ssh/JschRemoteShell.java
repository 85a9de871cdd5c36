package express.mvp.midrpc.ssh;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.ClientException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/** {@link RemoteShell} backed by one JSch session; each command runs on its own exec channel. */
final class JschRemoteShell implements RemoteShell {

    private static final Logger LOGGER = Logger.getLogger(JschRemoteShell.class.getName());

    private static final Duration POLL_INTERVAL = Duration.ofMillis(10);

    private final Session session;

    JschRemoteShell(Session session) {
        this.session = session;
    }

    @Override
    public CommandResult exec(CallContext ctx, String command) {
        ChannelExec channel;
        try {
            channel = (ChannelExec) session.openChannel("exec");
        } catch (JSchException e) {
            throw new ClientException("failed to open exec channel: " + e.getMessage(), e);
        }

        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        channel.setCommand(command);
        channel.setErrStream(stderr, true);
        try (CallContext.Registration ignored = ctx.onCancel(channel::disconnect)) {
            InputStream in = channel.getInputStream();
            channel.connect();
            drain(ctx, in, channel::isClosed, stdout);
            ctx.checkActive();
            int status = channel.getExitStatus();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Command exited with status " + status);
            }
            return new CommandResult(
                    status, stdout.toByteArray(), stderr.toString(StandardCharsets.UTF_8));
        } catch (IOException | JSchException e) {
            ctx.checkActive();
            throw new ClientException("remote command failed: " + e.getMessage(), e);
        } finally {
            channel.disconnect();
        }
    }

    /**
     * Copies the command's output until the channel closes, reading only what is already
     * buffered so that the context's deadline is checked between reads.
     *
     * @throws express.mvp.midrpc.CallCancelledException if the context ends first
     */
    static void drain(CallContext ctx, InputStream in, BooleanSupplier closed, OutputStream out)
            throws IOException {
        byte[] buf = new byte[8192];
        while (true) {
            int ready = in.available();
            if (ready > 0) {
                int n = in.read(buf, 0, Math.min(ready, buf.length));
                if (n < 0) {
                    return;
                }
                out.write(buf, 0, n);
                continue;
            }
            if (closed.getAsBoolean()) {
                if (in.available() > 0) {
                    continue;
                }
                return;
            }
            ctx.sleep(POLL_INTERVAL);
        }
    }

    @Override
    public boolean isConnected() {
        return session.isConnected();
    }

    @Override
    public void close() {
        session.disconnect();
    }
}
