package com.codehealth.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (SLF4J는 slf4j-jdk14로 여기 연결됨).
 * 콘솔 핸들러는 stderr: stdout은 보고서 JSON 전용.
 *
 * System props:
 *  -Dch.log.level=FINE|INFO|WARNING|SEVERE (기본 INFO)
 *  -Dch.log.dir=<dir>   지정 시 <dir>/merge-%g.log 롤링 파일 추가
 *  -Dch.log.sizeMb=2
 *  -Dch.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init() {
        String dir = System.getProperty("ch.log.dir");
        init(levelOf(System.getProperty("ch.log.level", "INFO")),
             (dir == null || dir.isBlank()) ? null : Path.of(dir.trim()));
    }

    /** @param logDir null이면 콘솔만 */
    public static synchronized void init(Level level, Path logDir) {
        if (initialized) return;
        initialized = true;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler(); // System.err
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                int sizeMb  = parseInt(System.getProperty("ch.log.sizeMb"), 2);
                int fileCnt = parseInt(System.getProperty("ch.log.files"), 5);
                String pattern = logDir.resolve("merge-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 실패는 치명적이지 않음: 콘솔만으로 진행
                Logger.getLogger(LogSetup.class.getName())
                        .log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }

        root.setLevel(level);
        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. level=" + level.getName() + (logDir == null ? "" : ", dir=" + logDir.toAbsolutePath()));
    }

    /** 문자열을 Level로(실패 시 INFO). "debug"/"warn"/"error" 별칭 허용 */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] %3$s - %4$s%n",
                    r.getMillis(), r.getLevel().getName(), r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
