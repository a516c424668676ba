package cloudfunction.common;

import java.util.regex.Pattern;

/**
 * Validation for project and function names. Names become directory and file
 * names, so anything that could escape the projects root is rejected.
 */
public final class Names {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,127}$");

    private Names() {
    }

    public static String requireValid(String kind, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(kind + " is required");
        }
        if (!VALID.matcher(value).matches() || value.contains("..")) {
            throw new IllegalArgumentException("invalid " + kind + ": " + value);
        }
        return value;
    }

    public static boolean isValid(String value) {
        return value != null && VALID.matcher(value).matches() && !value.contains("..");
    }
}
