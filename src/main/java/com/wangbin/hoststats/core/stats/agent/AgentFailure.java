package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.common.exception.BusinessException;

/**
 * 单个代理的失败记录
 */
public record AgentFailure(String agentId, BusinessException error) {
}
