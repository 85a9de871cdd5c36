package express.mvp.midrpc.ssh;

import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.rpc.Json;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds {@code midclt} command lines.
 *
 * <p>The method name is embedded unquoted, so it must match {@code ^[a-z][a-z0-9_.]*$}; anything
 * else is rejected before a command is produced. Parameters are serialized to JSON and always
 * passed through POSIX single-quote escaping. A {@link List} parameter contributes one argument
 * per element because some methods take positional arguments such as {@code (id, patch)}.
 *
 * <pre>{@code
 * CommandBuilder.call("pool.dataset.update", List.of("tank/a", Map.of("comments", "it's")), false);
 * // sudo midclt call pool.dataset.update '"tank/a"' '{"comments":"it'"'"'s"}'
 * }</pre>
 */
public final class CommandBuilder {

    /** Remote CLI that forwards calls to the middleware. */
    public static final String TOOL = "midclt";

    private static final Pattern METHOD = Pattern.compile("^[a-z][a-z0-9_.]*$");
    private static final Pattern SAFE = Pattern.compile("^[\\w@%+=:,./-]+$");

    private CommandBuilder() {
        // Utility class
    }

    /**
     * Builds a {@code sudo midclt call} command.
     *
     * @param method dotted method name
     * @param params parameters, {@code null} for none
     * @param waitForJob add the {@code -j} flag so the remote CLI waits for the job
     * @return the command line
     * @throws express.mvp.midrpc.error.MiddlewareError {@code EINVAL} if the method name is invalid
     */
    public static String call(String method, Object params, boolean waitForJob) {
        validateMethod(method);
        StringBuilder sb = new StringBuilder("sudo ").append(TOOL).append(" call ");
        if (waitForJob) {
            sb.append("-j ");
        }
        sb.append(method);
        if (params instanceof List<?> list) {
            for (Object arg : list) {
                sb.append(' ').append(quote(Json.write(arg)));
            }
        } else if (params != null) {
            sb.append(' ').append(quote(Json.write(params)));
        }
        return sb.toString();
    }

    /**
     * Builds a privileged shell command with quoted arguments.
     *
     * @param program the program, e.g. {@code rm}
     * @param args arguments, each quoted
     * @return the command line
     */
    public static String sudo(String program, String... args) {
        StringBuilder sb = new StringBuilder("sudo ").append(program);
        for (String arg : args) {
            sb.append(' ').append(quote(arg));
        }
        return sb.toString();
    }

    /**
     * Checks that a method name is safe to embed unquoted.
     *
     * @param method the method name
     * @throws express.mvp.midrpc.error.MiddlewareError {@code EINVAL} otherwise
     */
    public static void validateMethod(String method) {
        if (method == null || !METHOD.matcher(method).matches()) {
            throw ErrorParser.invalidArgument("invalid method name: " + quote(String.valueOf(method)));
        }
    }

    /**
     * Quotes a string for a POSIX shell.
     *
     * <p>Strings made only of characters that are never special are returned as is; otherwise the
     * string is wrapped in single quotes and each embedded single quote becomes {@code '"'"'}.
     *
     * @param s the string
     * @return the shell word
     */
    public static String quote(String s) {
        if (s.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(s).matches()) {
            return s;
        }
        return "'" + s.replace("'", "'\"'\"'") + "'";
    }
}
