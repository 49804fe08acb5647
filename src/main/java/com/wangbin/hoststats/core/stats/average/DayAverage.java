package com.wangbin.hoststats.core.stats.average;

import java.util.List;

/**
 * 某个星期日的小时平均值
 */
public record DayAverage(List<Long> hours, long interactions) {
}
