package express.mvp.midrpc.job;

import express.mvp.midrpc.CallContext;
import java.util.List;

/** Reads a remote text file, used to fetch logs that explain a failed job. */
@FunctionalInterface
public interface LogReader {

    /**
     * Reads a file.
     *
     * @param ctx call context
     * @param path absolute remote path
     * @return the content
     */
    String read(CallContext ctx, String path);

    /**
     * Reads logs through {@code filesystem.file_get_contents}.
     *
     * @param caller remote caller
     * @return the reader
     */
    static LogReader viaRpc(RpcCaller caller) {
        return (ctx, path) ->
                caller.call(ctx, "filesystem.file_get_contents", List.of(path)).asText();
    }
}
