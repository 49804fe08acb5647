package com.wangbin.hoststats.core.stats.totals;

import com.wangbin.hoststats.common.exception.InternalStatsException;
import com.wangbin.hoststats.common.exception.StatsException;
import com.wangbin.hoststats.common.utils.DateUtil;
import com.wangbin.hoststats.config.StatsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 每日告警汇总日志解析服务
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TotalsLogParser {

    private final StatsProperties properties;

    /**
     * 当天的汇总
     */
    public TotalsResult totals() {
        return totals(LocalDate.now());
    }

    /**
     * 指定日期的汇总
     *
     * @throws StatsException         汇总日志不存在或无法打开
     * @throws InternalStatsException 汇总日志存在但不是有效的UTF-8文本
     */
    public TotalsResult totals(LocalDate date) {
        Path file = totalsFile(date);
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.warn("汇总日志编码错误: {}", file);
            throw InternalStatsException.parseError("invalid UTF-8 content: " + file, e);
        } catch (IOException e) {
            throw StatsException.sourceUnavailable(file.toString(), e);
        }
        return parse(lines);
    }

    /**
     * 解析汇总日志的所有行。
     * 最后一个小时汇总行之后的告警行不会出现在结果中。
     */
    public TotalsResult parse(List<String> lines) {
        List<TotalsRecord> records = new ArrayList<>();
        List<AlertRecord> pending = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            TotalsLine line = TotalsLineTokenizer.tokenize(lines.get(i));
            switch (line.kind()) {
                case ALERT -> pending.add(line.alert());
                case HOUR -> {
                    TotalsLine.HourTotals hour = line.hour();
                    records.add(new TotalsRecord(hour.hour(), List.copyOf(pending), hour.totalAlerts(),
                            hour.events(), hour.syscheck(), hour.firewall()));
                    pending = new ArrayList<>();
                }
                case SKIP -> {
                }
                case MALFORMED -> {
                    log.warn("汇总日志第 {} 行格式错误，停止解析，已解析 {} 条", i + 1, records.size());
                    return new TotalsResult(true, records);
                }
            }
        }
        return new TotalsResult(false, records);
    }

    Path totalsFile(LocalDate date) {
        return properties.statsRoot()
                .resolve("totals")
                .resolve(String.valueOf(date.getYear()))
                .resolve(DateUtil.monthAbbreviation(date))
                .resolve("ossec-totals-" + DateUtil.dayOfMonth(date) + ".log");
    }
}
