package com.wangbin.hoststats.common.exception;

import com.wangbin.hoststats.common.web.result.ResultCode;

/**
 * 内部错误：文件结构损坏、套接字连接或接收失败
 */
public class InternalStatsException extends BusinessException {

    public InternalStatsException(ResultCode resultCode, String detail) {
        super(resultCode, detail);
    }

    public InternalStatsException(ResultCode resultCode, String detail, Throwable cause) {
        super(resultCode, detail, cause);
    }

    public static InternalStatsException parseError(String detail, Throwable cause) {
        return new InternalStatsException(ResultCode.STATS_PARSE_ERROR, detail, cause);
    }

    public static InternalStatsException connectError(String socketPath, Throwable cause) {
        return new InternalStatsException(ResultCode.SOCKET_CONNECT_ERROR, socketPath, cause);
    }

    public static InternalStatsException receiveError(Throwable cause) {
        return new InternalStatsException(ResultCode.SOCKET_RECEIVE_ERROR, "Data could not be received", cause);
    }
}
