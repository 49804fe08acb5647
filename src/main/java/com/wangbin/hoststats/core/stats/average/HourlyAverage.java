package com.wangbin.hoststats.core.stats.average;

import java.util.List;

/**
 * 小时平均值：24个小时桶计数及累计次数
 */
public record HourlyAverage(List<Long> averages, long interactions) {
}
