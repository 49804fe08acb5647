package com.wangbin.hoststats.core.stats.average;

import com.wangbin.hoststats.config.StatsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 历史平均值读取服务。
 * <p>
 * 每个桶文件只包含一个整数；0..23 为小时桶，24 为累计次数。
 * 文件缺失或无法读取时按0处理，平台冷启动阶段这是常态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AverageStatsReader {

    public static final List<String> DAYS = List.of("Sun", "Mon", "Tue", "Wed", "Thu", "Fri", "Sat");

    static final int HOURS = 24;
    static final int INTERACTIONS_BUCKET = 24;

    private static final Pattern DIGITS = Pattern.compile("[+-]?\\d+");

    private final StatsProperties properties;

    /**
     * 小时平均值
     */
    public List<HourlyAverage> hourly() {
        Path dir = properties.statsRoot().resolve("hourly-average");
        List<Long> averages = readBuckets(dir);
        long interactions = readBucket(dir.resolve(String.valueOf(INTERACTIONS_BUCKET)));
        return List.of(new HourlyAverage(averages, interactions));
    }

    /**
     * 每周各天的小时平均值，按 Sun..Sat 顺序
     */
    public List<Map<String, DayAverage>> weekly() {
        Path root = properties.statsRoot().resolve("weekly-average");
        List<Map<String, DayAverage>> results = new ArrayList<>(DAYS.size());
        for (int i = 0; i < DAYS.size(); i++) {
            Path dir = root.resolve(String.valueOf(i));
            List<Long> hours = readBuckets(dir);
            long interactions = readBucket(dir.resolve(String.valueOf(INTERACTIONS_BUCKET)));

            Map<String, DayAverage> day = new LinkedHashMap<>();
            day.put(DAYS.get(i), new DayAverage(hours, interactions));
            results.add(day);
        }
        return results;
    }

    private List<Long> readBuckets(Path dir) {
        List<Long> buckets = new ArrayList<>(HOURS);
        for (int i = 0; i < HOURS; i++) {
            buckets.add(readBucket(dir.resolve(String.valueOf(i))));
        }
        return buckets;
    }

    private long readBucket(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.debug("桶文件不可读，按0处理: {}", file);
            return 0L;
        }
        try {
            return Long.parseLong(content);
        } catch (NumberFormatException e) {
            if (DIGITS.matcher(content).matches()) {
                log.error("桶文件计数超出long范围，按0处理: {} = {}", file, content);
            } else {
                log.warn("桶文件内容不是整数，按0处理: {}", file);
            }
            return 0L;
        }
    }
}
