package com.wangbin.hoststats.core.stats.daemon;

import com.wangbin.hoststats.common.exception.InternalStatsException;

import java.util.List;
import java.util.Map;

/**
 * 守护进程统计文件的解析结果：统计项或内部错误，二者只有一个非空
 */
public record DaemonStatsResult(List<Map<String, Double>> items, InternalStatsException error) {

    public static DaemonStatsResult ok(Map<String, Double> stats) {
        return new DaemonStatsResult(List.of(stats), null);
    }

    public static DaemonStatsResult failed(InternalStatsException error) {
        return new DaemonStatsResult(null, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * 取出统计项，失败时抛出内部错误
     */
    public List<Map<String, Double>> getOrThrow() {
        if (error != null) {
            throw error;
        }
        return items;
    }
}
