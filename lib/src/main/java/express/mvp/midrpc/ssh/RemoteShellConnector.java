package express.mvp.midrpc.ssh;

/** Opens {@link RemoteShell} sessions. */
@FunctionalInterface
public interface RemoteShellConnector {

    /**
     * Connects and authenticates.
     *
     * @param config connection settings
     * @return an open session
     * @throws express.mvp.midrpc.error.MiddlewareError {@code ECONNREFUSED} or {@code EHOSTKEY}
     */
    RemoteShell connect(SshConfig config);
}
