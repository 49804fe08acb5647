package com.wangbin.hoststats.core.stats.agent;

import java.util.Set;

/**
 * 代理清单
 */
public interface AgentInventory {

    /**
     * 当前已登记的代理ID
     */
    Set<String> knownAgents();
}
