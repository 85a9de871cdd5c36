package express.mvp.midrpc.ssh;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;

/**
 * Outcome of one remote command.
 *
 * @param exitStatus process exit status
 * @param stdout raw standard output
 * @param stderr standard error text
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Output bytes are produced once and handed over without copying.")
public record CommandResult(int exitStatus, byte[] stdout, String stderr) {

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public boolean isSuccess() {
        return exitStatus == 0;
    }

    /**
     * Returns the text that explains a failure: stderr when present, else stdout.
     *
     * @return the failure output
     */
    public String failureOutput() {
        if (stderr != null && !stderr.isBlank()) {
            return stderr.strip();
        }
        return stdoutText().strip();
    }
}
