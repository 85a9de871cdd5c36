package express.mvp.midrpc.error;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the actionable line from the middleware's app lifecycle log.
 *
 * <p>Entries look like {@code Failed 'up' action for 'web' app: <text>} where {@code <text>} holds
 * the compose output with newlines escaped as a literal backslash-n. The useful part is the last
 * non-empty segment of the most recent matching entry.
 */
public final class AppLifecycleLog {

    /** Where the middleware records app lifecycle failures. */
    public static final String DEFAULT_PATH = "/var/log/app_lifecycle.log";

    private AppLifecycleLog() {
        // Utility class
    }

    /**
     * Returns the error message for the most recent failure of {@code action} on {@code appName}.
     *
     * @param content log file content
     * @param action lifecycle action, e.g. {@code up}
     * @param appName app name
     * @return the extracted message, or an empty string if nothing matches
     */
    public static String extract(String content, String action, String appName) {
        if (isEmpty(content) || isEmpty(action) || isEmpty(appName)) {
            return "";
        }

        Pattern entry =
                Pattern.compile(
                        "Failed '" + Pattern.quote(action) + "' action for '"
                                + Pattern.quote(appName) + "' app: (.+)");
        Matcher m = entry.matcher(content);
        String last = null;
        while (m.find()) {
            last = m.group(1);
        }
        if (last == null) {
            return "";
        }

        String[] parts = last.split(Pattern.quote("\\n"), -1);
        for (int i = parts.length - 1; i >= 0; i--) {
            String trimmed = parts[i].strip();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return last;
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
