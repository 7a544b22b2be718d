package io.fullerstack.atom.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Atom configuration backed by {@code atom.properties}.
 *
 * <p>A system property with the same key wins over the file.
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * AtomConfig config = AtomConfig.global();
 * boolean fair = config.getBoolean("atom.lock.fair", false);
 * </pre>
 */
public class AtomConfig {

    public static final String BUNDLE_NAME = "atom";

    private final ResourceBundle bundle;
    private final String context;

    private AtomConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Get global configuration (atom.properties).
     *
     * @return Global configuration
     * @throws ConfigurationException if atom.properties is not on the classpath
     */
    public static AtomConfig global() {
        try {
            ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT,
                ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
            return new AtomConfig(bundle, "global");
        } catch (MissingResourceException e) {
            throw new ConfigurationException("No " + BUNDLE_NAME + ".properties on the classpath", e);
        }
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    private String getString(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }
        return bundle.containsKey(key) ? bundle.getString(key) : null;
    }

    /**
     * Get int value with default.
     *
     * @throws ConfigurationException if the value is not an int
     */
    public int getInt(String key, int defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "' in context " + context + ": " + value, e
            );
        }
    }

    /**
     * Get boolean value with default. Only {@code true} and {@code false} (any case) are accepted.
     *
     * @throws ConfigurationException if the value is not a boolean
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        throw new ConfigurationException(
            "Invalid boolean value for key '" + key + "' in context " + context + ": " + value
        );
    }

    /**
     * Get enum constant by name, case-insensitive.
     *
     * @param key Property key
     * @param type Enum type
     * @param defaultValue Default if not found
     * @return Matching constant or default
     * @throws ConfigurationException if the value names no constant of {@code type}
     */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid " + type.getSimpleName() + " value for key '" + key + "': " + value, e
            );
        }
    }

    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "AtomConfig[context=" + context + "]";
    }
}
