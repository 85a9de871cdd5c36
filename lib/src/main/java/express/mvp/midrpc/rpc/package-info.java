/**
 * JSON-RPC 2.0 envelopes, error codes and the shared Jackson mapper used by both transports.
 */
package express.mvp.midrpc.rpc;
