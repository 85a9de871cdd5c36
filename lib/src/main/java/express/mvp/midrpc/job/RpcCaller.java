package express.mvp.midrpc.job;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.midrpc.CallContext;

/** A single remote call, usually a transport's {@code call} method. */
@FunctionalInterface
public interface RpcCaller {

    JsonNode call(CallContext ctx, String method, Object params);
}
