package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.config.StatsProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClientKeysAgentInventoryTest {

    @TempDir
    Path installDir;

    @Test
    void readsActiveAgentsAndAlwaysIncludesManager() throws IOException {
        Path etc = Files.createDirectories(installDir.resolve("etc"));
        Files.writeString(etc.resolve("client.keys"), """
                001 web-01 any 5f4dcc3b5aa765d61d8327deb882cf99
                002 !removed any 0123456789abcdef
                003 db-01 10.0.0.3 fedcba9876543210

                """);

        Set<String> agents = inventory().knownAgents();

        assertEquals(Set.of("000", "001", "003"), agents);
    }

    @Test
    void missingKeysFileLeavesOnlyManager() {
        assertEquals(Set.of("000"), inventory().knownAgents());
    }

    private ClientKeysAgentInventory inventory() {
        StatsProperties properties = new StatsProperties();
        properties.setInstallPath(installDir.toString());
        return new ClientKeysAgentInventory(properties);
    }
}
