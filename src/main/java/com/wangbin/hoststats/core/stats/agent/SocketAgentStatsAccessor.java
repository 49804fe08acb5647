package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.core.stats.daemon.DaemonStatsClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 通过 request 套接字向代理请求组件状态
 */
@Component
@RequiredArgsConstructor
public class SocketAgentStatsAccessor implements AgentStatsAccessor {

    private final DaemonStatsClient daemonStatsClient;

    @Override
    public Map<String, Object> fetchAgentStats(String agentId, String component) {
        return daemonStatsClient.getDaemonState(agentId, component);
    }
}
