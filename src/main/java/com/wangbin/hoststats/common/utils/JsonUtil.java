package com.wangbin.hoststats.common.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    // 严格模式：不接受单引号、未加引号的字段名以及对象后的多余内容
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * JSON字符串转Map，不是JSON对象时返回null
     */
    public static Map<String, Object> parseMap(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.debug("不是JSON对象: {}", json);
            return null;
        }
    }
}
