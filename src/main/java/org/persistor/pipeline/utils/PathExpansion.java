package org.persistor.pipeline.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * System properties win over environment variables, so {@code -Duser.home=...} can override
 * {@code HOME}. Used for the blob store root directory.
 * <p>
 * <strong>Examples:</strong>
 * <pre>
 * expandPath("${user.home}/persistor")     → "/home/user/persistor"
 * expandPath("${PERSISTOR_DATA}/blobs")    → "/var/lib/persistor/blobs"
 * expandPath("/absolute/path")             → "/absolute/path"
 * </pre>
 */
public final class PathExpansion {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]*)}");

    private PathExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * Expands all variables in the given path.
     *
     * @param path the path, may be {@code null}
     * @return the expanded path, or {@code null} if {@code path} was {@code null}
     * @throws IllegalArgumentException if a variable is undefined or a reference is not closed
     */
    public static String expandPath(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        Matcher matcher = VARIABLE.matcher(path);
        StringBuilder result = new StringBuilder();
        int consumed = 0;
        while (matcher.find()) {
            String varName = matcher.group(1);
            String value = resolveVariable(varName);
            if (value == null) {
                throw new IllegalArgumentException(
                    "Undefined variable '${" + varName + "}' in path: " + path
                        + ". Check that environment variable or system property exists.");
            }
            result.append(path, consumed, matcher.start()).append(value);
            consumed = matcher.end();
        }
        String rest = path.substring(consumed);
        if (rest.contains("${")) {
            throw new IllegalArgumentException("Unclosed variable in path: " + path);
        }
        return result.append(rest).toString();
    }

    private static String resolveVariable(String varName) {
        String value = System.getProperty(varName);
        return value != null ? value : System.getenv(varName);
    }
}
