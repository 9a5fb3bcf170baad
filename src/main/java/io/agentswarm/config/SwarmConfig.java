package io.agentswarm.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SwarmConfig {
    public static final String DEFAULT_ROOT = ".swarm";
    public static final String SETTINGS_FILE = "swarm-settings.json";

    private final Path rootDir;
    private final SwarmSettings settings;

    public SwarmConfig(Path rootDir, SwarmSettings settings) {
        if (rootDir == null) {
            throw new IllegalArgumentException("rootDir must not be null");
        }
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.settings = settings == null ? SwarmSettings.defaults() : settings;
    }

    public static SwarmConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new SwarmConfig(base, SwarmSettings.load(base.resolve(SETTINGS_FILE)));
    }

    public SwarmConfig withSettings(SwarmSettings newSettings) {
        return new SwarmConfig(rootDir, newSettings);
    }

    public Path rootDir() {
        return rootDir;
    }

    public SwarmSettings settings() {
        return settings;
    }

    public Path eventsDbFile() {
        return rootDir.resolve("events.db");
    }

    public Path subscriptionsDbFile() {
        return rootDir.resolve("subscriptions.db");
    }

    public Path swarmDbFile() {
        return rootDir.resolve("swarm.db");
    }

    public Path agentsRoot() {
        return rootDir.resolve("agents");
    }

    public Path workspacesRoot() {
        return rootDir.resolve("workspaces");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
