package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.config.StatsProperties;
import com.wangbin.hoststats.core.stats.daemon.DaemonStatsClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 从 client.keys 读取代理清单。
 * <p>
 * 每行格式为 {@code ID 名称 IP 密钥}；名称以 '!' 或 '#' 开头的代理已被移除。
 * 管理节点 000 总是在清单中。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClientKeysAgentInventory implements AgentInventory {

    private final StatsProperties properties;

    @Override
    public Set<String> knownAgents() {
        Set<String> agents = new LinkedHashSet<>();
        agents.add(DaemonStatsClient.MANAGER_ID);

        Path file = properties.clientKeys();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("无法读取代理清单，仅包含管理节点: {}", file);
            return agents;
        }

        for (String line : lines) {
            String[] fields = line.trim().split("\\s+");
            if (fields.length < 2 || fields[0].isEmpty()) {
                continue;
            }
            if (fields[1].startsWith("!") || fields[1].startsWith("#")) {
                continue;
            }
            agents.add(fields[0]);
        }
        return agents;
    }
}
