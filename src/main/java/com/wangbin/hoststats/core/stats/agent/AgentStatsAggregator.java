package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.common.exception.BusinessException;
import com.wangbin.hoststats.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 批量获取代理组件统计。
 * 单个代理的平台错误只记录在 failures 中，不影响其他代理；其他异常直接抛出。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentStatsAggregator {

    private final AgentInventory agentInventory;
    private final AgentStatsAccessor agentStatsAccessor;

    public AgentStatsResult componentStats(List<String> agentIds, String component) {
        Set<String> knownAgents = agentInventory.knownAgents();
        List<AgentFailure> failures = new ArrayList<>();
        List<Map<String, Object>> successes = new ArrayList<>();

        for (String agentId : agentIds) {
            try {
                if (!knownAgents.contains(agentId)) {
                    throw ResourceNotFoundException.agentNotFound(agentId);
                }
                successes.add(agentStatsAccessor.fetchAgentStats(agentId, component));
            } catch (BusinessException e) {
                log.debug("代理统计获取失败: agent={}, component={}, code={}", agentId, component, e.getCode());
                failures.add(new AgentFailure(agentId, e));
            }
        }

        log.info("代理组件统计完成: component={}, 成功 {}, 失败 {}", component, successes.size(), failures.size());
        return new AgentStatsResult(failures, successes);
    }
}
