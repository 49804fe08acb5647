package com.wangbin.hoststats.core.stats.totals;

/**
 * 单条告警统计：规则ID、级别、触发次数
 */
public record AlertRecord(int sigid, int level, int times) {
}
