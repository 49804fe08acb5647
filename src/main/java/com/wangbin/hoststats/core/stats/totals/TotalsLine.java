package com.wangbin.hoststats.core.stats.totals;

/**
 * 汇总日志单行的解析结果
 */
public record TotalsLine(Kind kind, AlertRecord alert, HourTotals hour) {

    public enum Kind {
        /** 告警行 */
        ALERT,
        /** 小时汇总行 */
        HOUR,
        /** 空行或噪声 */
        SKIP,
        /** 格式错误 */
        MALFORMED
    }

    /**
     * 小时汇总行中的数值部分
     */
    public record HourTotals(int hour, int totalAlerts, int events, int syscheck, int firewall) {
    }

    private static final TotalsLine SKIP_LINE = new TotalsLine(Kind.SKIP, null, null);
    private static final TotalsLine MALFORMED_LINE = new TotalsLine(Kind.MALFORMED, null, null);

    public static TotalsLine alert(AlertRecord alert) {
        return new TotalsLine(Kind.ALERT, alert, null);
    }

    public static TotalsLine hour(HourTotals hour) {
        return new TotalsLine(Kind.HOUR, null, hour);
    }

    public static TotalsLine skip() {
        return SKIP_LINE;
    }

    public static TotalsLine malformed() {
        return MALFORMED_LINE;
    }
}
