package com.ashscreener.app;

import com.ashscreener.config.Config;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.data.RateLimiter;
import com.ashscreener.data.SlidingWindowRateLimiter;
import com.ashscreener.data.http.EastmoneyDataProvider;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressSnapshot;
import com.ashscreener.model.ScreeningReport;
import com.ashscreener.model.SessionState;
import com.ashscreener.output.ReportJson;
import com.ashscreener.runner.ScreeningPipeline;
import com.ashscreener.session.SessionCoordinator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：ScreenerApplication（class）。
 * 主要职责：命令行入口，启动一次筛选会话，轮询进度并把漏斗报告写成 JSON。
 * 使用建议：退出码 0 成功，1 运行失败，2 参数错误。
 */
public final class ScreenerApplication {
    private static final Logger LOG = LogManager.getLogger(ScreenerApplication.class);
    private static final long POLL_MILLIS = 1000L;
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new ScreenerApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("ashscreener", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("ashscreener", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);

        Set<Criterion> criteria;
        try {
            criteria = Criterion.parseSelection(cmd.getOptionValue("criteria", config.getString("screen.criteria.default")));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        installLogRoutingIfNeeded(config);
        SessionCoordinator sessions = null;
        try {
            RateLimiter limiter = SlidingWindowRateLimiter.perMinute(config);
            MarketDataService data = MarketDataService.fromConfig(
                    config, new EastmoneyDataProvider(config, limiter), limiter);
            ScreeningPipeline pipeline = new ScreeningPipeline(config, data);
            sessions = new SessionCoordinator(pipeline::run);

            String token = sessions.startSession(criteria);
            LOG.info("screening session {} started, criteria={}", token, cmd.getOptionValue("criteria", "default"));
            ProgressSnapshot snapshot = awaitCompletion(sessions);
            if (snapshot.state == SessionState.FAILED) {
                LOG.error("screening session {} failed: {}", token, snapshot.error);
                return 1;
            }
            Optional<ScreeningReport> report = sessions.getResult(token);
            if (report.isEmpty()) {
                LOG.error("screening session {} produced no result", token);
                return 1;
            }
            Path output = resolveOutput(cmd, config);
            ReportJson.write(report.get(), output);
            LOG.info("screening done: {} of {} passed, report={}",
                    report.get().finalCount, report.get().totalInitial, output);
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("interrupted while waiting for screening");
            return 1;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return 1;
        } finally {
            if (sessions != null) {
                sessions.shutdown();
            }
        }
    }

    private ProgressSnapshot awaitCompletion(SessionCoordinator sessions) throws InterruptedException {
        String lastMessage = "";
        while (true) {
            ProgressSnapshot snapshot = sessions.getProgress();
            if (!snapshot.message.equals(lastMessage)) {
                LOG.info("[{}] {} (remaining={})", snapshot.stage, snapshot.message, snapshot.remaining);
                lastMessage = snapshot.message;
            }
            if (!snapshot.running) {
                return snapshot;
            }
            Thread.sleep(POLL_MILLIS);
        }
    }

    private Path resolveOutput(CommandLine cmd, Config config) {
        String raw = cmd.getOptionValue("output");
        if (raw != null && !raw.trim().isEmpty()) {
            return config.workingDir().resolve(raw.trim()).normalize();
        }
        String stamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        return config.getPath("outputs.dir").resolve("screening_" + stamp + ".json");
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (ScreenerApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("ashscreener.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(ScreenerApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("criteria").hasArg().argName("ids")
                .desc("comma-separated criterion ids 1-8 (default: all)").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("file")
                .desc("path of the JSON report (default: outputs/screening_<time>.json)").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
