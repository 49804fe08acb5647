package com.wangbin.hoststats.api.controller;

import com.wangbin.hoststats.common.web.result.ApiResult;
import com.wangbin.hoststats.core.stats.agent.AgentFailure;
import com.wangbin.hoststats.core.stats.agent.AgentStatsAggregator;
import com.wangbin.hoststats.core.stats.agent.AgentStatsResult;
import com.wangbin.hoststats.core.stats.average.AverageStatsReader;
import com.wangbin.hoststats.core.stats.average.DayAverage;
import com.wangbin.hoststats.core.stats.average.HourlyAverage;
import com.wangbin.hoststats.core.stats.daemon.DaemonStatsClient;
import com.wangbin.hoststats.core.stats.daemon.DaemonStatsFileParser;
import com.wangbin.hoststats.core.stats.totals.TotalsLogParser;
import com.wangbin.hoststats.core.stats.totals.TotalsResult;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 统计相关接口。
 */
@RestController
@RequestMapping("/stats")
@RequiredArgsConstructor
public class StatsController {

    private final AverageStatsReader averageStatsReader;
    private final TotalsLogParser totalsLogParser;
    private final DaemonStatsFileParser daemonStatsFileParser;
    private final AgentStatsAggregator agentStatsAggregator;
    private final DaemonStatsClient daemonStatsClient;

    @GetMapping("/hourly")
    public ApiResult<List<HourlyAverage>> hourly() {
        return ApiResult.success(averageStatsReader.hourly());
    }

    @GetMapping("/weekly")
    public ApiResult<List<Map<String, DayAverage>>> weekly() {
        return ApiResult.success(averageStatsReader.weekly());
    }

    @GetMapping("/totals")
    public ApiResult<TotalsResult> totals(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ApiResult.success(date == null ? totalsLogParser.totals() : totalsLogParser.totals(date));
    }

    @GetMapping("/analysisd")
    public ApiResult<List<Map<String, Double>>> analysisd() {
        return ApiResult.success(daemonStatsFileParser.analysisdStats().getOrThrow());
    }

    @GetMapping("/remoted")
    public ApiResult<List<Map<String, Double>>> remoted() {
        return ApiResult.success(daemonStatsFileParser.remotedStats().getOrThrow());
    }

    @GetMapping("/agents/{component}")
    public ApiResult<Map<String, Object>> agentComponent(@PathVariable String component,
                                                        @RequestParam("agents_list") List<String> agentIds) {
        AgentStatsResult result = agentStatsAggregator.componentStats(agentIds, component);

        List<Map<String, Object>> failed = result.failures().stream()
                .map(StatsController::toFailedItem)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("affected_items", result.successes());
        body.put("total_affected_items", result.successes().size());
        body.put("failed_items", failed);
        body.put("total_failed_items", failed.size());
        return ApiResult.success(body);
    }

    @GetMapping("/daemons/{agentId}/{daemon}")
    public ApiResult<Map<String, Object>> daemonState(@PathVariable String agentId, @PathVariable String daemon) {
        return ApiResult.success(daemonStatsClient.getDaemonState(agentId, daemon));
    }

    private static Map<String, Object> toFailedItem(AgentFailure failure) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", failure.agentId());
        item.put("code", failure.error().getCode());
        item.put("message", failure.error().getMessage());
        return item;
    }
}
