package io.workqueue.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class WorkQueueConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "workqueue.db";
    public static final String SETTINGS_FILE_NAME = "workqueue-settings.json";

    private final Path rootDir;

    public WorkQueueConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static WorkQueueConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new WorkQueueConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + dbFile();
    }
}
