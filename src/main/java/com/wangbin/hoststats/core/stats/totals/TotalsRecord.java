package com.wangbin.hoststats.core.stats.totals;

import java.util.List;

/**
 * 某一小时的告警汇总
 */
public record TotalsRecord(int hour,
                           List<AlertRecord> alerts,
                           int totalAlerts,
                           int events,
                           int syscheck,
                           int firewall) {
}
