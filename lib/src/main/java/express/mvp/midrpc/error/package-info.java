/**
 * Error taxonomy and retry decisions.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.midrpc.error.MiddlewareError} - structured error with code, field, job
 *       id, log excerpt and suggestion
 *   <li>{@link express.mvp.midrpc.error.ErrorParser} - raw middleware text to structured error,
 *       plus factories for client-side failures
 *   <li>{@link express.mvp.midrpc.error.AppLifecycleLog} - extracts the actionable line from the
 *       app lifecycle log
 *   <li>{@link express.mvp.midrpc.error.RetryClassifier} - transient failure detection, one per
 *       transport family
 *   <li>{@link express.mvp.midrpc.error.RetryPolicy} - retry budget and jittered backoff
 * </ul>
 *
 * <h2>Retry Policy</h2>
 *
 * <p>Validation errors, not-found, job failures, timeouts and unrecognised errors are never
 * retried. Connection drops, server concurrency limits, busy resources and expired sessions are.
 */
package express.mvp.midrpc.error;
