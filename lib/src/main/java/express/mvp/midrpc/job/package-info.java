/**
 * Job completion protocol.
 *
 * <p>Long-running middleware operations return a job id. The caller learns the outcome either by
 * polling ({@link express.mvp.midrpc.job.JobPoller}) or, on the socket transport, from pushed
 * {@link express.mvp.midrpc.job.JobEvent}s with a {@link express.mvp.midrpc.job.JobEventBuffer}
 * covering the window between the call returning and the waiter subscribing.
 */
package express.mvp.midrpc.job;
