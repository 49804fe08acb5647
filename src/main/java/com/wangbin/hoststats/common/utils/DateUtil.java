package com.wangbin.hoststats.common.utils;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * 日期时间工具类
 */
@Slf4j
public class DateUtil {

    /**
     * 守护进程上报时间戳的格式
     */
    public static final String DEFAULT_DATETIME_FORMAT = "yyyy-MM-dd HH:mm:ss";

    /**
     * 平台统一日期格式
     */
    public static final String CANONICAL_DATETIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ss'Z'";

    private static final String[] MONTHS = {
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    private DateUtil() {
        // 工具类，防止实例化
    }

    /**
     * 按目标格式格式化时间
     */
    public static String format(LocalDateTime dateTime, String pattern) {
        if (dateTime == null) {
            return null;
        }
        return dateTime.format(DateTimeFormatter.ofPattern(pattern, Locale.ROOT));
    }

    /**
     * 把源格式的时间字符串转换为目标格式
     *
     * @throws DateTimeParseException 源字符串与源格式不匹配
     */
    public static String reformat(String value, String sourcePattern, String targetPattern) {
        LocalDateTime parsed = LocalDateTime.parse(value, DateTimeFormatter.ofPattern(sourcePattern, Locale.ROOT));
        return format(parsed, targetPattern);
    }

    /**
     * 月份英文缩写（Jan..Dec）
     */
    public static String monthAbbreviation(LocalDate date) {
        return MONTHS[date.getMonthValue() - 1];
    }

    /**
     * 两位补零的日
     */
    public static String dayOfMonth(LocalDate date) {
        return String.format("%02d", date.getDayOfMonth());
    }
}
