package com.xingest.core.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    @TempDir
    Path tmp;

    @AfterEach
    void resetJul() throws IOException {
        LogManager.getLogManager().readConfiguration(); // 기본 설정으로 복구(파일 핸들러 닫힘)
    }

    @Test
    void init_installs_console_and_rolling_file() throws Exception {
        Path logs = tmp.resolve("logs");
        LoggingConfigurator.init(logs, Level.INFO, 1024 * 1024, 2);

        Logger root = LogManager.getLogManager().getLogger("");
        assertThat(root.getHandlers()).hasSize(2);
        assertThat(root.getLevel()).isEqualTo(Level.INFO);

        StructuredLog.get(LoggingConfiguratorTest.class).info("file-check", "k", "v");
        for (Handler h : root.getHandlers()) h.flush();

        Path file = logs.resolve("xingest-0.log");
        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("\"event\":\"file-check\"");
    }

    @Test
    void null_dir_means_console_only() {
        LoggingConfigurator.init((Path) null, Level.WARNING, 1024, 1);
        Logger root = LogManager.getLogManager().getLogger("");
        assertThat(root.getHandlers()).hasSize(1);
        assertThat(root.getLevel()).isEqualTo(Level.WARNING);
    }

    @Test
    void parseLevel_maps_common_names() {
        assertThat(LoggingConfigurator.parseLevel("debug")).isEqualTo(Level.FINE);
        assertThat(LoggingConfigurator.parseLevel("WARN")).isEqualTo(Level.WARNING);
        assertThat(LoggingConfigurator.parseLevel("error")).isEqualTo(Level.SEVERE);
        assertThat(LoggingConfigurator.parseLevel("info")).isEqualTo(Level.INFO);
        assertThat(LoggingConfigurator.parseLevel("whatever")).isEqualTo(Level.INFO);
        assertThat(LoggingConfigurator.parseLevel(null)).isEqualTo(Level.INFO);
    }
}
