package org.finos.stitch.engine.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Deployment-level settings of the include engine.
 * 
 * Resolution order, later wins:
 * <ol>
 * <li>built-in defaults</li>
 * <li>{@code stitch.properties} on the classpath</li>
 * <li>environment variables ({@code STITCH_MAX_INCLUDE_DEPTH}, {@code STITCH_STRICT_INCLUDE},
 * {@code STITCH_DEBUG}, {@code STITCH_FANOUT})</li>
 * <li>system properties with the same keys as the properties file</li>
 * </ol>
 * 
 * @param maxIncludeDepth Nesting levels resolved; deeper requests are pruned
 * @param strictIncludes  When set, a stitch failure fails the request instead of degrading
 * @param debug           Adds diagnostic detail (cause chain, stack) to include errors
 * @param fanOut          Maximum sibling relations fetched concurrently per level
 */
public record StitchSettings(
        int maxIncludeDepth,
        boolean strictIncludes,
        boolean debug,
        int fanOut) {

    public static final String RESOURCE = "stitch.properties";

    public static final String MAX_DEPTH_KEY = "stitch.include.maxDepth";
    public static final String STRICT_KEY = "stitch.include.strict";
    public static final String DEBUG_KEY = "stitch.debug";
    public static final String FANOUT_KEY = "stitch.include.fanOut";

    private static final Map<String, String> ENV_NAMES = Map.of(
            MAX_DEPTH_KEY, "STITCH_MAX_INCLUDE_DEPTH",
            STRICT_KEY, "STITCH_STRICT_INCLUDE",
            DEBUG_KEY, "STITCH_DEBUG",
            FANOUT_KEY, "STITCH_FANOUT");

    public static final StitchSettings DEFAULTS = new StitchSettings(3, false, false, 4);

    public StitchSettings {
        if (maxIncludeDepth < 0) {
            throw new IllegalArgumentException("maxIncludeDepth must be nonnegative: " + maxIncludeDepth);
        }
        if (fanOut < 1) {
            throw new IllegalArgumentException("fanOut must be at least 1: " + fanOut);
        }
    }

    /**
     * Loads settings from the classpath, the process environment and system properties.
     */
    public static StitchSettings load() {
        return load(classpathProperties(), System.getenv(), System.getProperties());
    }

    /**
     * Loads settings from explicit sources.
     * 
     * @param fileProperties   Contents of {@code stitch.properties}
     * @param environment      Environment variables
     * @param systemProperties System properties
     */
    public static StitchSettings load(Properties fileProperties, Map<String, String> environment,
            Properties systemProperties) {
        Properties merged = new Properties();
        merged.putAll(fileProperties);
        ENV_NAMES.forEach((key, envName) -> {
            String value = environment.get(envName);
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value);
            }
        });
        for (String key : ENV_NAMES.keySet()) {
            String value = systemProperties.getProperty(key);
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value);
            }
        }

        return new StitchSettings(
                intValue(merged, MAX_DEPTH_KEY, DEFAULTS.maxIncludeDepth),
                booleanValue(merged, STRICT_KEY, DEFAULTS.strictIncludes),
                booleanValue(merged, DEBUG_KEY, DEFAULTS.debug),
                intValue(merged, FANOUT_KEY, DEFAULTS.fanOut));
    }

    public StitchSettings withStrictIncludes(boolean strict) {
        return new StitchSettings(maxIncludeDepth, strict, debug, fanOut);
    }

    public StitchSettings withDebug(boolean enabled) {
        return new StitchSettings(maxIncludeDepth, strictIncludes, enabled, fanOut);
    }

    public StitchSettings withMaxIncludeDepth(int depth) {
        return new StitchSettings(depth, strictIncludes, debug, fanOut);
    }

    private static Properties classpathProperties() {
        Properties props = new Properties();
        try (InputStream in = StitchSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return props;
    }

    private static int intValue(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    // accepts 1/0, true/false, yes/no, on/off
    private static boolean booleanValue(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            case "0", "false", "no", "off" -> false;
            default -> throw new IllegalStateException("Invalid boolean for " + key + ": " + value);
        };
    }
}
