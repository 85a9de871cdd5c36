package express.mvp.midrpc.rpc;

/** JSON-RPC error codes the middleware uses. */
public final class JsonRpcCodes {

    /** Client-side code for connection-level failures of a request. */
    public static final int INTERNAL = -1;

    /** The server limits concurrent calls per connection. */
    public static final int TOO_MANY_CONCURRENT_CALLS = -32000;

    /** The called method raised; details are in {@code error.data}. */
    public static final int CALL_ERROR = -32001;

    /** errno values carried in {@code error.data.error}. */
    public static final int ENOENT = 2;

    public static final int EAGAIN = 11;
    public static final int EBUSY = 16;

    private JsonRpcCodes() {
        // Constants
    }
}
