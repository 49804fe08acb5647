package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.common.exception.BusinessException;

import java.util.Map;

/**
 * 单个代理组件的统计获取
 */
public interface AgentStatsAccessor {

    /**
     * @throws BusinessException 已知的失败情况
     */
    Map<String, Object> fetchAgentStats(String agentId, String component);
}
