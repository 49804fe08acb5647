package com.wangbin.hoststats.core.stats.daemon;

import com.wangbin.hoststats.common.exception.InternalStatsException;
import com.wangbin.hoststats.common.exception.StatsException;
import com.wangbin.hoststats.config.StatsProperties;
import com.wangbin.hoststats.core.socket.SocketConnection;
import com.wangbin.hoststats.core.socket.SocketTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * 通过控制套接字查询守护进程的实时状态。
 * <p>
 * 管理节点（代理ID 000）直接连接守护进程自己的套接字并发送 {@code getstate}；
 * 远程代理通过 request 套接字转发 {@code "<代理ID> <守护进程> getstate"}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DaemonStatsClient {

    public static final String MANAGER_ID = "000";
    static final String REQUEST_SOCKET = "request";
    static final String GETSTATE = "getstate";

    // 管理节点上不存在的守护进程
    static final Set<String> MANAGER_UNSUPPORTED_DAEMONS = Set.of("agent");

    private final StatsProperties properties;
    private final SocketTransport transport;

    /**
     * 获取守护进程状态
     *
     * @param agentId 代理ID，不足3位时左侧补0
     * @param daemon  守护进程名
     * @return 状态字段，last_keepalive / last_ack 已转换为平台日期格式
     * @throws StatsException         参数为空、目标不支持或守护进程返回错误
     * @throws InternalStatsException 套接字连接或接收失败
     */
    public Map<String, Object> getDaemonState(String agentId, String daemon) {
        if (!StringUtils.hasLength(agentId) || !StringUtils.hasLength(daemon)) {
            throw StatsException.invalidParameters();
        }

        String id = normalizeAgentId(agentId);
        Path socket;
        String command;
        if (MANAGER_ID.equals(id)) {
            if (MANAGER_UNSUPPORTED_DAEMONS.contains(daemon)) {
                throw StatsException.unsupportedTarget(daemon);
            }
            socket = properties.socketsDir().resolve(daemon);
            command = GETSTATE;
        } else {
            socket = properties.socketsDir().resolve(REQUEST_SOCKET);
            command = id + " " + daemon + " " + GETSTATE;
        }

        String response = request(socket, command);
        DaemonReply reply = DaemonReplyDecoder.decode(response, properties.getDateFormat());
        if (!reply.isOk()) {
            log.warn("守护进程返回错误: agent={}, daemon={}, error={}", id, daemon, reply.error());
            throw StatsException.daemonError(reply.error());
        }
        return reply.data();
    }

    static String normalizeAgentId(String agentId) {
        if (agentId.length() >= 3) {
            return agentId;
        }
        return "0".repeat(3 - agentId.length()) + agentId;
    }

    private String request(Path socket, String command) {
        SocketConnection connection;
        try {
            connection = transport.open(socket);
        } catch (IOException e) {
            throw InternalStatsException.connectError(socket.toString(), e);
        }

        try {
            log.debug("发送命令: {} -> {}", command, socket);
            try {
                connection.send(command.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw InternalStatsException.connectError(socket.toString(), e);
            }

            byte[] response;
            try {
                response = connection.receive();
            } catch (IOException e) {
                throw InternalStatsException.receiveError(e);
            }
            return new String(response, StandardCharsets.UTF_8);
        } finally {
            connection.close();
        }
    }
}
