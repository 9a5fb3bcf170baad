package io.agentswarm.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class SwarmSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-settings-missing-");
        try {
            SwarmConfig config = SwarmConfig.fromRoot(root.toString());
            assertEquals(SwarmSettings.defaults(), config.settings());
            assertEquals(5, config.settings().maxTriggerDepth());
            assertEquals(4, config.settings().maxConcurrency());
            assertEquals(1_000L, config.settings().triggerCooldownMs());
            assertFalse(config.settings().emitSkipEvents());
        } finally {
            Files.deleteIfExists(root);
        }
    }

    @Test
    void fileOverridesOnlyWhatItNamesAndValuesAreClamped() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-settings-file-");
        Path file = root.resolve(SwarmConfig.SETTINGS_FILE);
        try {
            Files.writeString(file, """
                    {
                      "maxConcurrency": 0,
                      "maxTriggerDepth": 2,
                      "emitSkipEvents": true,
                      "swarmId": " repo-a ",
                      "scriptExecutors": {"function": ["python3", "agent.py"]},
                      "unknownKnob": 7
                    }
                    """);
            SwarmSettings settings = SwarmConfig.fromRoot(root.toString()).settings();
            assertEquals(1, settings.maxConcurrency());
            assertEquals(2, settings.maxTriggerDepth());
            assertTrue(settings.emitSkipEvents());
            assertEquals("repo-a", settings.swarmId());
            assertEquals(List.of("python3", "agent.py"), settings.scriptExecutors().get("function"));
            assertEquals(SwarmSettings.DEFAULT_TRIGGER_COOLDOWN_MS, settings.triggerCooldownMs());
            assertEquals(SwarmSettings.DEFAULT_CHAT_HISTORY_LIMIT, settings.chatHistoryLimit());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void unreadableFileIsAConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("agentswarm-test-settings-bad-");
        Path file = root.resolve(SwarmConfig.SETTINGS_FILE);
        try {
            Files.writeString(file, "{ not json");
            assertThrows(IllegalStateException.class, () -> SwarmConfig.fromRoot(root.toString()));
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void withersKeepOtherFields() {
        SwarmSettings base = SwarmSettings.defaults();
        SwarmSettings tuned = base.withMaxTriggerDepth(0).withTriggerCooldownMs(-5L).withTriggerQueue(0, 50L);
        assertEquals(0, tuned.maxTriggerDepth());
        assertEquals(0L, tuned.triggerCooldownMs());
        assertEquals(1, tuned.triggerQueueCapacity());
        assertEquals(50L, tuned.triggerPushTimeoutMs());
        assertEquals(base.maxConcurrency(), tuned.maxConcurrency());
        assertEquals(base.swarmId(), tuned.swarmId());
    }
}
