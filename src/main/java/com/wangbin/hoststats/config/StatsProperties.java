package com.wangbin.hoststats.config;

import com.wangbin.hoststats.common.utils.DateUtil;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * stats 配置映射
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "stats")
public class StatsProperties {

    /**
     * 平台安装目录
     */
    @NotBlank
    private String installPath = "/var/ossec";

    /**
     * 统计文件根目录，为空时取 installPath/stats
     */
    private String statsPath;

    /**
     * 平台统一日期格式
     */
    @NotBlank
    private String dateFormat = DateUtil.CANONICAL_DATETIME_FORMAT;

    /**
     * 控制套接字配置
     */
    private SocketConfig socket = new SocketConfig();

    public Path statsRoot() {
        if (statsPath == null || statsPath.isBlank()) {
            return Paths.get(installPath, "stats");
        }
        return Paths.get(statsPath);
    }

    public Path socketsDir() {
        return Paths.get(installPath, "queue", "sockets");
    }

    public Path runDir() {
        return Paths.get(installPath, "var", "run");
    }

    public Path clientKeys() {
        return Paths.get(installPath, "etc", "client.keys");
    }

    @Data
    public static class SocketConfig {
        /**
         * 连接超时（毫秒）
         */
        private int connectTimeoutMs = 3000;

        /**
         * 读取超时（毫秒），0 表示一直等待
         */
        private long readTimeoutMs = 0;

        /**
         * 单帧最大长度
         */
        private int maxFrameLength = 64 * 1024 * 1024;
    }
}
