package com.wangbin.hoststats.core.stats.daemon;

import com.wangbin.hoststats.common.exception.InternalStatsException;
import com.wangbin.hoststats.common.exception.StatsException;
import com.wangbin.hoststats.common.web.result.ResultCode;
import com.wangbin.hoststats.config.StatsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DaemonStatsFileParserTest {

    @TempDir
    Path installDir;

    private DaemonStatsFileParser parser;

    @BeforeEach
    void setUp() {
        StatsProperties properties = new StatsProperties();
        properties.setInstallPath(installDir.toString());
        parser = new DaemonStatsFileParser(properties);
    }

    @Test
    void parsesQuotedValuesAndIgnoresComments() throws IOException {
        Path file = write("daemon.state", """
                # State file
                key="1.5"

                total_events_decoded='1024'
                # queue usage
                event_queue_usage='0.25'
                """);

        DaemonStatsResult result = parser.daemonStats(file);

        assertFalse(result.isFailed());
        List<Map<String, Double>> items = result.items();
        assertEquals(1, items.size());
        assertEquals(Map.of("key", 1.5, "total_events_decoded", 1024.0, "event_queue_usage", 0.25), items.get(0));
    }

    @Test
    void duplicateKeyKeepsLastValue() throws IOException {
        Path file = write("dup.state", "queued='1'\nqueued='7'\n");

        assertEquals(7.0, parser.daemonStats(file).items().get(0).get("queued"));
    }

    @Test
    void nonNumericValueIsReturnedAsInternalError() throws IOException {
        Path file = write("bad.state", "ok='1'\nbroken='abc'\n");

        DaemonStatsResult result = parser.daemonStats(file);

        assertTrue(result.isFailed());
        assertNull(result.items());
        assertEquals(ResultCode.STATS_PARSE_ERROR.getCode(), result.error().getCode());
        assertTrue(result.error().getDetail().contains("abc"));
        assertThrows(InternalStatsException.class, result::getOrThrow);
    }

    @Test
    void lineWithoutSeparatorIsInternalError() throws IOException {
        Path file = write("noeq.state", "justtext\n");

        assertTrue(parser.daemonStats(file).isFailed());
    }

    @Test
    void undecodableFileIsInternalErrorResult() throws IOException {
        Path file = installDir.resolve("binary.state");
        Files.write(file, new byte[]{'k', '=', '\'', (byte) 0xFF, '\'', '\n'});

        DaemonStatsResult result = parser.daemonStats(file);

        assertTrue(result.isFailed());
        assertEquals(ResultCode.STATS_PARSE_ERROR.getCode(), result.error().getCode());
    }

    @Test
    void missingFileIsSourceUnavailable() {
        Path file = installDir.resolve("absent.state");

        StatsException e = assertThrows(StatsException.class, () -> parser.daemonStats(file));

        assertEquals(ResultCode.SOURCE_UNAVAILABLE.getCode(), e.getCode());
        assertEquals(file.toString(), e.getDetail());
    }

    @Test
    void analysisdStatsReadsRunDirectoryStateFile() throws IOException {
        Path runDir = Files.createDirectories(installDir.resolve("var").resolve("run"));
        Files.writeString(runDir.resolve(DaemonStatsFileParser.ANALYSISD_STATE), "events_received='12'\n");

        assertEquals(12.0, parser.analysisdStats().getOrThrow().get(0).get("events_received"));
        assertThrows(StatsException.class, () -> parser.remotedStats());
    }

    private Path write(String name, String content) throws IOException {
        Path file = installDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
