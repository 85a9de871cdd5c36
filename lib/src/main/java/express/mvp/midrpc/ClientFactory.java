package express.mvp.midrpc;

import express.mvp.midrpc.error.ShellRetryClassifier;
import express.mvp.midrpc.error.SocketRetryClassifier;
import express.mvp.midrpc.ratelimit.RateLimitedClient;
import express.mvp.midrpc.ssh.SshClient;
import express.mvp.midrpc.ssh.SshConfig;
import express.mvp.midrpc.ws.WebSocketClient;
import express.mvp.midrpc.ws.WebSocketConfig;

/**
 * Assembles ready-to-use clients: a transport wrapped in {@link RateLimitedClient} with the
 * classifier matching that transport.
 */
public final class ClientFactory {

    private ClientFactory() {}

    /**
     * Creates a shell-command client.
     *
     * @param ssh connection settings
     * @param client rate limit and retry bound
     * @return the decorated client, not yet connected
     */
    public static MiddlewareClient ssh(SshConfig ssh, ClientConfig client) {
        return new RateLimitedClient(new SshClient(ssh), client, new ShellRetryClassifier());
    }

    /**
     * Creates a persistent-socket client. Its fallback is taken from {@code ws} and is closed
     * with it.
     *
     * @param ws socket settings
     * @param client rate limit and retry bound
     * @return the decorated client, not yet connected
     */
    public static MiddlewareClient websocket(WebSocketConfig ws, ClientConfig client) {
        return new RateLimitedClient(new WebSocketClient(ws), client, new SocketRetryClassifier());
    }

    /**
     * Creates a persistent-socket client whose fallback is a shell-command client.
     *
     * @param ws socket settings without a fallback
     * @param ssh fallback connection settings
     * @param client rate limit and retry bound
     * @return the decorated client, not yet connected
     */
    public static MiddlewareClient websocket(
            WebSocketConfig.Builder ws, SshConfig ssh, ClientConfig client) {
        return websocket(ws.fallback(new SshClient(ssh)).build(), client);
    }
}
