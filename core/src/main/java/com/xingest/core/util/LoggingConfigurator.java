package com.xingest.core.util;

import com.xingest.core.model.ScrapeConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * JUL 루트 핸들러 구성(콘솔 + 롤링 파일).
 * SLF4J 는 slf4j-jdk14 바인딩으로 같은 핸들러를 탄다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static final String FILE_PATTERN = "xingest-%g.log";

    /** 메시지만 출력(StructuredLog 가 이미 JSON 한 줄을 만든다) */
    private static final Formatter LINE = new Formatter() {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            if (r.getThrown() == null) return msg + System.lineSeparator();
            return msg + " | " + r.getThrown() + System.lineSeparator();
        }
    };

    public static final int DEFAULT_MAX_BYTES = 5 * 1024 * 1024;
    public static final int DEFAULT_FILE_COUNT = 3;

    /** log.dir / log.level 설정으로 초기화 */
    public static void init(ScrapeConfig cfg) {
        init(cfg.getLogDir(), parseLevel(cfg.getLogLevel()), DEFAULT_MAX_BYTES, DEFAULT_FILE_COUNT);
    }

    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(LINE);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                FileHandler file = new FileHandler(logDir.resolve(FILE_PATTERN).toString(), maxBytes, fileCount, true);
                file.setLevel(rootLevel);
                file.setFormatter(LINE);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 콘솔만으로 계속
                System.err.println("Failed to init file log handler in " + logDir + ": " + e.getMessage());
            }
        }

        root.setLevel(rootLevel);
    }

    /** "debug" / "INFO" / "warn" / "error" → JUL Level. 모르는 값은 INFO. */
    public static Level parseLevel(String name) {
        if (name == null) return Level.INFO;
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":
            case "WARNING": return Level.WARNING;
            case "ERROR":
            case "SEVERE": return Level.SEVERE;
            case "OFF": return Level.OFF;
            default: return Level.INFO;
        }
    }
}
