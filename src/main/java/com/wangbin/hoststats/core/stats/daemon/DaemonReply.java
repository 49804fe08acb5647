package com.wangbin.hoststats.core.stats.daemon;

import java.util.Map;

/**
 * 守护进程响应解码结果：成功时 data 非空，失败时 error 为守护进程给出的错误描述
 */
public record DaemonReply(Map<String, Object> data, String error) {

    public static DaemonReply ok(Map<String, Object> data) {
        return new DaemonReply(data, null);
    }

    public static DaemonReply error(String message) {
        return new DaemonReply(null, message);
    }

    public boolean isOk() {
        return data != null;
    }
}
