package com.wangbin.hoststats.core.stats.agent;

import com.wangbin.hoststats.common.exception.ResourceNotFoundException;
import com.wangbin.hoststats.common.exception.StatsException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentStatsAggregatorTest {

    @Test
    void unknownAgentIsRecordedAsNotFound() {
        AgentStatsAggregator aggregator = new AgentStatsAggregator(
                () -> Set.of("agentA"),
                (agentId, component) -> Map.of("agent", agentId, "component", component));

        AgentStatsResult result = aggregator.componentStats(List.of("agentA", "agentB"), "logcollector");

        assertEquals(1, result.failures().size());
        assertEquals("agentB", result.failures().get(0).agentId());
        assertInstanceOf(ResourceNotFoundException.class, result.failures().get(0).error());
        assertEquals(List.of(Map.of("agent", "agentA", "component", "logcollector")), result.successes());
    }

    @Test
    void platformErrorsDoNotAbortTheBatchAndOrderIsKept() {
        AgentStatsAggregator aggregator = new AgentStatsAggregator(
                () -> Set.of("001", "002", "003", "004"),
                (agentId, component) -> {
                    if (agentId.equals("002") || agentId.equals("004")) {
                        throw StatsException.daemonError("agent " + agentId + " disconnected");
                    }
                    return Map.of("id", agentId);
                });

        AgentStatsResult result = aggregator.componentStats(List.of("004", "001", "002", "003", "009"), "agent");

        assertEquals(List.of("004", "002", "009"),
                result.failures().stream().map(AgentFailure::agentId).toList());
        assertEquals(List.of(Map.of("id", "001"), Map.of("id", "003")), result.successes());
        assertEquals(5, result.failures().size() + result.successes().size());
    }

    @Test
    void unexpectedErrorsPropagate() {
        AgentStatsAggregator aggregator = new AgentStatsAggregator(
                () -> Set.of("001"),
                (agentId, component) -> {
                    throw new IllegalStateException("boom");
                });

        assertThrows(IllegalStateException.class, () -> aggregator.componentStats(List.of("001"), "agent"));
    }
}
