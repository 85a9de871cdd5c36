package express.mvp.midrpc.error;

/** Symbolic error codes used by the middleware and by client-side errors. */
public final class ErrorCodes {

    /** Code assigned when the raw text carries no bracketed code. */
    public static final String UNKNOWN = "UNKNOWN";

    public static final String EINVAL = "EINVAL";
    public static final String ENOENT = "ENOENT";
    public static final String EEXIST = "EEXIST";
    public static final String EFAULT = "EFAULT";
    public static final String ENOTEMPTY = "ENOTEMPTY";
    public static final String EAGAIN = "EAGAIN";
    public static final String EBUSY = "EBUSY";
    public static final String ETIMEDOUT = "ETIMEDOUT";
    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String EHOSTKEY = "EHOSTKEY";
    public static final String ENOTAUTHENTICATED = "ENOTAUTHENTICATED";

    private ErrorCodes() {
        // Constants
    }
}
