package com.wangbin.hoststats.core.stats.daemon;

import com.wangbin.hoststats.common.utils.DateUtil;
import com.wangbin.hoststats.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 守护进程响应解码器。
 * <p>
 * 成功响应是带 data 字段的JSON对象；错误响应是 "状态 描述" 形式的文本。
 */
@Slf4j
public final class DaemonReplyDecoder {

    static final Set<String> TIMESTAMP_FIELDS = Set.of("last_keepalive", "last_ack");

    private DaemonReplyDecoder() {
    }

    public static DaemonReply decode(String raw, String dateFormat) {
        Map<String, Object> body = JsonUtil.parseMap(raw);
        if (body != null && body.get("data") instanceof Map<?, ?> payload) {
            Map<String, Object> data = new LinkedHashMap<>();
            payload.forEach((key, value) -> data.put(String.valueOf(key), value));
            for (String field : TIMESTAMP_FIELDS) {
                if (data.get(field) instanceof String text) {
                    data.put(field, reformat(field, text, dateFormat));
                }
            }
            return DaemonReply.ok(data);
        }
        return DaemonReply.error(errorMessage(raw));
    }

    /**
     * 错误响应中第一个空格之后的部分；没有空格时取整个文本
     */
    static String errorMessage(String raw) {
        if (raw == null) {
            return "";
        }
        int space = raw.indexOf(' ');
        return space < 0 ? raw : raw.substring(space + 1);
    }

    private static String reformat(String field, String value, String dateFormat) {
        try {
            return DateUtil.reformat(value, DateUtil.DEFAULT_DATETIME_FORMAT, dateFormat);
        } catch (DateTimeParseException e) {
            log.warn("时间字段格式无法识别，保留原值: {}={}", field, value);
            return value;
        }
    }
}
