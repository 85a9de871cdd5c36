package express.mvp.midrpc.ssh;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import express.mvp.midrpc.error.ErrorParser;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Opens SSH sessions with JSch using public-key authentication and a pinned host key.
 *
 * <p>Each {@link #connect} creates an independent {@link JSch} instance holding only the
 * configured identity, so keys never leak between clients.
 */
public final class JschShellConnector implements RemoteShellConnector {

    private static final Logger LOGGER = Logger.getLogger(JschShellConnector.class.getName());

    @Override
    public RemoteShell connect(SshConfig config) {
        JSch jsch = new JSch();
        FingerprintHostKeyRepository hostKeys =
                new FingerprintHostKeyRepository(config.getHostKeyFingerprint());
        Session session = null;
        try {
            jsch.addIdentity(
                    "midrpc-" + config.getUser(),
                    config.getPrivateKey().getBytes(StandardCharsets.UTF_8),
                    null,
                    null);
            jsch.setHostKeyRepository(hostKeys);

            session = jsch.getSession(config.getUser(), config.getHost(), config.getPort());
            session.setConfig("StrictHostKeyChecking", "yes");
            session.setConfig("PreferredAuthentications", "publickey");
            session.setServerAliveInterval(30_000);
            session.connect((int) config.getConnectTimeout().toMillis());
        } catch (JSchException e) {
            if (session != null) {
                session.disconnect();
            }
            if (hostKeys.rejected()) {
                throw ErrorParser.hostKeyError(
                                config.getHost(), hostKeys.expected(), hostKeys.presented())
                        .withCause(e);
            }
            throw ErrorParser.connectionError(config.getHost(), config.getPort(), e);
        }
        LOGGER.info(
                "SSH session established to " + config.getHost() + ":" + config.getPort()
                        + " as " + config.getUser());
        return new JschRemoteShell(session);
    }
}
