package io.redust;

import io.redust.server.config.RedisServerConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedustServerLauncherTest {

    @Test
    void testDefaults() {
        RedisServerConfig config = RedustServerLauncher.parseArgs(new String[0]);

        assertEquals(RedisServerConfig.DEFAULT_PORT, config.getPort());
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(250, config.getMaxConnections());
    }

    @Test
    void testPortAndHost() {
        RedisServerConfig config = RedustServerLauncher.parseArgs(
                new String[]{"--port", "7000", "--host", "0.0.0.0"});

        assertEquals(7000, config.getPort());
        assertEquals("0.0.0.0", config.getHost());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> RedustServerLauncher.parseArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class,
                () -> RedustServerLauncher.parseArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class,
                () -> RedustServerLauncher.parseArgs(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class,
                () -> RedustServerLauncher.parseArgs(new String[]{"--verbose"}));
    }
}
