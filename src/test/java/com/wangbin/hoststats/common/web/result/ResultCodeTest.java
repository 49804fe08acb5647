package com.wangbin.hoststats.common.web.result;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ResultCodeTest {

    @Test
    void genericHttpCodesAreNotPlatformCodes() {
        assertEquals(ResultCode.UNKNOWN_ERROR, ResultCode.fromCode(400));
        assertEquals(ResultCode.UNKNOWN_ERROR, ResultCode.fromCode(404));
        assertEquals(ResultCode.AGENT_NOT_FOUND, ResultCode.fromCode(1701));
    }

    @Test
    void codesAreUnique() {
        long distinct = Arrays.stream(ResultCode.values()).mapToInt(ResultCode::getCode).distinct().count();

        assertEquals(ResultCode.values().length, distinct);
    }

    @Test
    void internalErrorsAreParseAndSocketFailures() {
        assertTrue(ResultCode.STATS_PARSE_ERROR.isInternalError());
        assertTrue(ResultCode.SOCKET_CONNECT_ERROR.isInternalError());
        assertTrue(ResultCode.SOCKET_RECEIVE_ERROR.isInternalError());
        assertFalse(ResultCode.SOURCE_UNAVAILABLE.isInternalError());
        assertFalse(ResultCode.DAEMON_ERROR.isInternalError());
    }
}
