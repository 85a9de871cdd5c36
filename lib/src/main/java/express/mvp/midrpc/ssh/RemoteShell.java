package express.mvp.midrpc.ssh;

import express.mvp.midrpc.CallContext;

/**
 * An authenticated shell session able to run commands.
 *
 * <p>Implementations must support concurrent {@link #exec} calls; the caller bounds concurrency.
 */
public interface RemoteShell extends AutoCloseable {

    /**
     * Runs a command and collects its output. A non-zero exit status is returned, not thrown.
     *
     * @param ctx call context; cancelling it aborts the command
     * @param command the command line
     * @return the result
     * @throws express.mvp.midrpc.ClientException if the session failed
     */
    CommandResult exec(CallContext ctx, String command);

    /**
     * Checks whether the underlying session is still usable.
     *
     * @return false once the session dropped
     */
    boolean isConnected();

    @Override
    void close();
}
