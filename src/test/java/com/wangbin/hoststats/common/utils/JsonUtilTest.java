package com.wangbin.hoststats.common.utils;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilTest {

    @Test
    void parsesJsonObject() {
        Map<String, Object> map = JsonUtil.parseMap("{\"error\":0,\"data\":{\"a\":1}}");

        assertNotNull(map);
        assertEquals(0, ((Number) map.get("error")).intValue());
        assertInstanceOf(Map.class, map.get("data"));
    }

    @Test
    void plainTextIsNotAJsonObject() {
        assertNull(JsonUtil.parseMap("ERROR invalid target"));
        assertNull(JsonUtil.parseMap(""));
        assertNull(JsonUtil.parseMap(null));
    }

    @Test
    void lenientJsonIsRejected() {
        assertNull(JsonUtil.parseMap("{'data':{'a':1}}"));
        assertNull(JsonUtil.parseMap("{data:{}}"));
        assertNull(JsonUtil.parseMap("{\"data\":{}} trailing"));
        assertNull(JsonUtil.parseMap("[1,2]"));
    }
}
