package in.usermgmt.util;

/**
 * Configuration lookup: environment variable first, then system property, then default.
 * Blank values count as unset.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = raw(key);
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = raw(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config " + key + " is not an integer: '" + value + "'", e);
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = raw(key);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String raw(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value;
    }

    private Env() {}
}
