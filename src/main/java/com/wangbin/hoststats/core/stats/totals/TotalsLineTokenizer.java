package com.wangbin.hoststats.core.stats.totals;

import java.util.regex.Pattern;

/**
 * 汇总日志行解析器。
 * <ul>
 *     <li>按 "-" 切分恰好4段：告警行 hour-sigid-level-times</li>
 *     <li>否则按 "--" 切分恰好5段：小时汇总行 hour--totalAlerts--events--syscheck--firewall</li>
 *     <li>"--" 切分得到0或1段：跳过</li>
 *     <li>其余情况以及任何非整数字段：格式错误</li>
 * </ul>
 */
public final class TotalsLineTokenizer {

    private static final Pattern SINGLE_DASH = Pattern.compile("-");
    private static final Pattern DOUBLE_DASH = Pattern.compile("--");

    private TotalsLineTokenizer() {
    }

    public static TotalsLine tokenize(String line) {
        // limit -1 保留末尾空字段
        String[] fields = SINGLE_DASH.split(line, -1);
        if (fields.length == 4) {
            Integer sigid = toInt(fields[1]);
            Integer level = toInt(fields[2]);
            Integer times = toInt(fields[3]);
            if (sigid == null || level == null || times == null) {
                return TotalsLine.malformed();
            }
            return TotalsLine.alert(new AlertRecord(sigid, level, times));
        }

        fields = DOUBLE_DASH.split(line, -1);
        if (fields.length <= 1) {
            return TotalsLine.skip();
        }
        if (fields.length != 5) {
            return TotalsLine.malformed();
        }

        int[] values = new int[5];
        for (int i = 0; i < fields.length; i++) {
            Integer value = toInt(fields[i]);
            if (value == null) {
                return TotalsLine.malformed();
            }
            values[i] = value;
        }
        return TotalsLine.hour(new TotalsLine.HourTotals(values[0], values[1], values[2], values[3], values[4]));
    }

    private static Integer toInt(String field) {
        try {
            return Integer.parseInt(field.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
