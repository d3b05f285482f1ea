package com.carcoverscraper.app.logging;

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
 * CLI용 java.util.logging 전역 설정.
 * 파일: {out}/logs/scrape-%g.log, 사이즈 롤링(기본 2MB x 5). 콘솔: stderr.
 * SLF4J 로그는 slf4j-jdk14 바인딩으로 같은 핸들러를 탄다.
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false;
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** 요청 단위 로그가 많은 서드파티 로거. 파일 레벨과 무관하게 INFO 이상만 */
    private static final String[] NOISY = {"jdk.internal.httpclient", "org.apache.hadoop", "org.apache.parquet"};

    /**
     * System props:
     *  -Dcc.log.level=DEBUG|INFO|WARN|ERROR (JUL 이름도 가능, 파일 기준)
     *  -Dcc.log.consoleLevel=... (기본: cc.log.level과 동일)
     *  -Dcc.log.sizeMb=2
     *  -Dcc.log.files=5
     *  -Dcc.log.console=true|false
     */
    public static synchronized void configure(Path outRoot) {
        if (initialized) return;
        initialized = true;

        Path logDir = outRoot.resolve("logs");
        Level fileLevel = levelOf(System.getProperty("cc.log.level", "INFO"));
        Level consoleLevel = levelOf(System.getProperty("cc.log.consoleLevel", fileLevel.getName()));
        int sizeMb = parseInt(System.getProperty("cc.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("cc.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("cc.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(moreVerbose(fileLevel, toConsole ? consoleLevel : fileLevel));

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(consoleLevel);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            FileHandler file = new FileHandler(logDir.resolve("scrape-%g.log").toString(),
                    sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(fileLevel);
            file.setFormatter(LINE_FORMATTER);
            file.setEncoding("UTF-8");
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "File log setup failed under " + logDir + ": " + e.getMessage(), e);
        }

        for (String name : NOISY) {
            Logger.getLogger(name).setLevel(Level.INFO);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG, () ->
                "Log initialized. dir=" + logDir.toAbsolutePath()
                        + ", file=" + fileLevel.getName() + ", console=" + (toConsole ? consoleLevel.getName() : "off"));
    }

    /** 문자열을 Level로(실패 시 INFO). DEBUG/WARN 같은 SLF4J식 이름도 받는다. */
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

    static Level moreVerbose(Level a, Level b) {
        return a.intValue() <= b.intValue() ? a : b;
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** "시각 [레벨] (스레드) 로거 - 메시지" 한 줄 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String logger = r.getLoggerName() == null ? "" : r.getLoggerName();
            int dot = logger.lastIndexOf('.');
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    dot >= 0 ? logger.substring(dot + 1) : logger,
                    formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw;
        }
    }
}
