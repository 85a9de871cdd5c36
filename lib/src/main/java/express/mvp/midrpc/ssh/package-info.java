/**
 * Shell-command transport over SSH.
 *
 * <p>{@link express.mvp.midrpc.ssh.SshClient} turns each call into a {@code sudo midclt call}
 * command built by {@link express.mvp.midrpc.ssh.CommandBuilder}. Sessions are opened by a
 * {@link express.mvp.midrpc.ssh.RemoteShellConnector}; the default one uses JSch and pins the
 * server's host key by fingerprint.
 */
package express.mvp.midrpc.ssh;
