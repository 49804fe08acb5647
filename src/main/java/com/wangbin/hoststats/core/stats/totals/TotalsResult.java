package com.wangbin.hoststats.core.stats.totals;

import java.util.List;

/**
 * 汇总日志解析结果。failed 为 true 时 records 只包含遇到格式错误之前的记录。
 */
public record TotalsResult(boolean failed, List<TotalsRecord> records) {
}
