package com.wangbin.hoststats.core.stats.agent;

import java.util.List;
import java.util.Map;

/**
 * 批量代理统计结果，failures 与 successes 均保持输入顺序
 */
public record AgentStatsResult(List<AgentFailure> failures, List<Map<String, Object>> successes) {
}
