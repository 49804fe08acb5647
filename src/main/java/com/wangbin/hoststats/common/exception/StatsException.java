package com.wangbin.hoststats.common.exception;

import com.wangbin.hoststats.common.web.result.ResultCode;

/**
 * 统计异常，调用方可见的错误（参数、数据源、目标或守护进程返回的错误）
 */
public class StatsException extends BusinessException {

    public StatsException(ResultCode resultCode) {
        super(resultCode);
    }

    public StatsException(ResultCode resultCode, String detail) {
        super(resultCode, detail);
    }

    public StatsException(ResultCode resultCode, String detail, Throwable cause) {
        super(resultCode, detail, cause);
    }

    // 数据源不可用
    public static StatsException sourceUnavailable(String path, Throwable cause) {
        return new StatsException(ResultCode.SOURCE_UNAVAILABLE, path, cause);
    }

    // 参数无效
    public static StatsException invalidParameters() {
        return new StatsException(ResultCode.INVALID_PARAMETERS);
    }

    // 目标不支持
    public static StatsException unsupportedTarget(String detail) {
        return new StatsException(ResultCode.UNSUPPORTED_TARGET, detail);
    }

    // 守护进程返回的错误
    public static StatsException daemonError(String message) {
        return new StatsException(ResultCode.DAEMON_ERROR, message);
    }
}
