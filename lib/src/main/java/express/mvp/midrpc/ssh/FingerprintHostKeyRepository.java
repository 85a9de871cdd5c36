package express.mvp.midrpc.ssh;

import com.jcraft.jsch.HostKey;
import com.jcraft.jsch.HostKeyRepository;
import com.jcraft.jsch.UserInfo;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Host key repository that accepts exactly one key, identified by its SHA-256 fingerprint.
 *
 * <p>Fingerprints use the OpenSSH form {@code SHA256:<unpadded base64>}, as printed by {@code
 * ssh-keygen -lf}. Any other key is reported as {@link #CHANGED}, which makes JSch abort the
 * handshake when {@code StrictHostKeyChecking} is {@code yes}. Nothing is ever added.
 */
public final class FingerprintHostKeyRepository implements HostKeyRepository {

    private static final String PREFIX = "SHA256:";

    private final String expected;
    private volatile String presented;

    /**
     * Creates a repository pinned to a fingerprint.
     *
     * @param fingerprint expected fingerprint, with or without the {@code SHA256:} prefix
     */
    public FingerprintHostKeyRepository(String fingerprint) {
        this.expected = normalize(fingerprint);
    }

    /**
     * Computes the OpenSSH SHA-256 fingerprint of a public key blob.
     *
     * @param key the key blob as sent by the server
     * @return {@code SHA256:<base64>}
     */
    public static String fingerprint(byte[] key) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key);
            return PREFIX + Base64.getEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String normalize(String fingerprint) {
        String f = fingerprint.strip();
        if (f.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            f = f.substring(PREFIX.length());
        }
        while (f.endsWith("=")) {
            f = f.substring(0, f.length() - 1);
        }
        return PREFIX + f;
    }

    @Override
    public int check(String host, byte[] key) {
        String actual = fingerprint(key);
        presented = actual;
        return MessageDigest.isEqual(
                        actual.getBytes(StandardCharsets.US_ASCII),
                        expected.getBytes(StandardCharsets.US_ASCII))
                ? OK
                : CHANGED;
    }

    /** Returns the pinned fingerprint in normalized form. */
    public String expected() {
        return expected;
    }

    /**
     * Returns the fingerprint of the last key the server presented.
     *
     * @return the fingerprint, or {@code null} if no handshake reached key verification
     */
    public String presented() {
        return presented;
    }

    /** Checks whether the last presented key was rejected. */
    public boolean rejected() {
        String p = presented;
        return p != null && !p.equals(expected);
    }

    @Override
    public void add(HostKey hostkey, UserInfo ui) {
        // Pinned: never learns keys.
    }

    @Override
    public void remove(String host, String type) {
        // Pinned.
    }

    @Override
    public void remove(String host, String type, byte[] key) {
        // Pinned.
    }

    @Override
    public String getKnownHostsRepositoryID() {
        return "pinned-fingerprint";
    }

    @Override
    public HostKey[] getHostKey() {
        return new HostKey[0];
    }

    @Override
    public HostKey[] getHostKey(String host, String type) {
        return new HostKey[0];
    }
}
