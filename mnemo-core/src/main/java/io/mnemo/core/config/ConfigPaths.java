package io.mnemo.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static final String CONFIG_PROPERTY = "mnemo.config";

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".mnemo", "config.json");
    }

    /**
     * The file named by the {@code mnemo.config} system property, else {@link #defaultConfigPath()}.
     */
    public static Path configPath() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override == null || override.isBlank()) {
            return defaultConfigPath();
        }
        return expandHome(override.trim());
    }

    public static Path resolveGlobalRoot(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".mnemo", "knowledge");
        }
        return expandHome(rawPath);
    }

    public static Path resolveProjectStateDir(Path projectRoot, String rawPath) {
        Path root = projectRoot == null ? Path.of("").toAbsolutePath() : projectRoot;
        if (rawPath == null || rawPath.isBlank()) {
            return root.resolve(".mnemo").resolve("knowledge");
        }
        Path state = expandHome(rawPath);
        return state.isAbsolute() ? state : root.resolve(state);
    }

    public static String currentUser() {
        String user = System.getProperty("user.name");
        if (user == null || user.isBlank()) {
            return "default";
        }
        return user.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
