package com.wangbin.hoststats.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),

    // 统计相关错误
    STATS_PARSE_ERROR(1104, "统计文件格式错误"),
    DAEMON_ERROR(1117, "守护进程返回错误"),
    SOCKET_RECEIVE_ERROR(1118, "套接字数据接收失败"),
    SOCKET_CONNECT_ERROR(1121, "无法连接到套接字"),
    INVALID_PARAMETERS(1307, "参数无效"),
    SOURCE_UNAVAILABLE(1308, "统计数据源不可用"),
    UNSUPPORTED_TARGET(1310, "该目标不支持此操作"),
    AGENT_NOT_FOUND(1701, "代理不存在"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),

    // 其他错误
    UNKNOWN_ERROR(9999, "未知错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 根据code获取枚举
     */
    public static ResultCode fromCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    /**
     * 判断是否为平台内部错误
     */
    public boolean isInternalError() {
        return this == STATS_PARSE_ERROR || this == SOCKET_RECEIVE_ERROR
                || this == SOCKET_CONNECT_ERROR || this == SYSTEM_ERROR;
    }
}
