package com.wangbin.hoststats.core.stats.daemon;

import com.wangbin.hoststats.common.exception.InternalStatsException;
import com.wangbin.hoststats.common.exception.StatsException;
import com.wangbin.hoststats.config.StatsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 守护进程状态文件解析服务。
 * <p>
 * 文件每行形如 {@code key='value'}，含 '#' 的行为注释。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DaemonStatsFileParser {

    static final String ANALYSISD_STATE = "wazuh-analysisd.state";
    static final String REMOTED_STATE = "wazuh-remoted.state";

    private final StatsProperties properties;

    /**
     * 分析守护进程的统计
     */
    public DaemonStatsResult analysisdStats() {
        return daemonStats(properties.runDir().resolve(ANALYSISD_STATE));
    }

    /**
     * 远程守护进程的统计
     */
    public DaemonStatsResult remotedStats() {
        return daemonStats(properties.runDir().resolve(REMOTED_STATE));
    }

    /**
     * 解析指定的状态文件。
     * 文件存在但内容损坏时返回带内部错误的结果而不是抛出。
     *
     * @throws StatsException 文件不存在或无法打开
     */
    public DaemonStatsResult daemonStats(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            return corrupted(file, "invalid UTF-8 content", e);
        } catch (IOException e) {
            throw StatsException.sourceUnavailable(file.toString(), e);
        }

        Map<String, Double> items = new LinkedHashMap<>();
        for (String line : lines) {
            if (line.isEmpty() || line.contains("#")) {
                continue;
            }
            String[] fields = line.split("=", -1);
            if (fields.length < 2) {
                return corrupted(file, "missing '=' in line: " + line, null);
            }
            String quoted = fields[1];
            if (quoted.length() < 2) {
                return corrupted(file, "could not convert string to float: '" + quoted + "'", null);
            }
            String value = quoted.substring(1, quoted.length() - 1);
            try {
                items.put(fields[0], Double.parseDouble(value));
            } catch (NumberFormatException e) {
                return corrupted(file, "could not convert string to float: '" + value + "'", e);
            }
        }
        return DaemonStatsResult.ok(items);
    }

    private DaemonStatsResult corrupted(Path file, String detail, Throwable cause) {
        log.warn("状态文件内容损坏: {} - {}", file, detail);
        return DaemonStatsResult.failed(InternalStatsException.parseError(detail, cause));
    }
}
