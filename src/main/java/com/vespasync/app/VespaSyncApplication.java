package com.vespasync.app;

import com.vespasync.sync.checkpoint.CancellationToken;
import com.vespasync.sync.checkpoint.CheckpointStore;
import com.vespasync.sync.checkpoint.ShutdownManager;
import com.vespasync.sync.config.Config;
import com.vespasync.sync.db.Database;
import com.vespasync.sync.db.MigrationRunner;
import com.vespasync.sync.db.PostgresSyncStore;
import com.vespasync.sync.output.ReportMailer;
import com.vespasync.sync.period.PeriodCalculator;
import com.vespasync.sync.runner.SyncOutcome;
import com.vespasync.sync.runner.SyncRunner;
import com.vespasync.sync.source.KnackClient;
import com.vespasync.sync.source.KnackRecordParser;
import com.vespasync.sync.source.QuestionCatalog;
import com.vespasync.sync.stats.StatisticsAggregator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

public final class VespaSyncApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

public static void main(String[] args) {
        int exit = new VespaSyncApplication().run(args);
        System.exit(exit);
    }

/**
 * 方法说明：run，负责解析命令行并执行一次同步。
 * 处理流程：加载配置与日志路由，校验凭据，迁移表结构，获取同步锁，运行同步并发送报告邮件。
 * 维护提示：返回值即进程退出码：0 成功，1 失败，2 参数或配置错误，130 被中断。
 */
public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("vespa-sync", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("vespa-sync", options);
            return 0;
        }
        if (cmd.hasOption("stats-only") && cmd.hasOption("skip-stats")) {
            System.err.println("ERROR: --stats-only and --skip-stats cannot be combined.");
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            String appId = firstNonBlank(System.getenv("KNACK_APP_ID"), config.getString("knack.app_id"));
            String apiKey = firstNonBlank(System.getenv("KNACK_API_KEY"), config.getString("knack.api_key"));
            boolean statsOnly = cmd.hasOption("stats-only");
            if (!statsOnly && (appId.isEmpty() || apiKey.isEmpty())) {
                System.err.println("ERROR: Knack credentials missing (KNACK_APP_ID / KNACK_API_KEY or knack.app_id / knack.api_key).");
                return 2;
            }

            QuestionCatalog catalog;
            try {
                catalog = QuestionCatalog.load(workingDir, config.getString("source.question_catalog"));
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("ERROR: question catalog unreadable: " + e.getMessage());
                return 2;
            }

            Database database = Database.fromConfig(config, System.getenv());
            System.out.println("DB url=" + database.maskedJdbcUrl() + ", schema=" + database.schema());
            new MigrationRunner().run(database);

            PostgresSyncStore store = new PostgresSyncStore(database);
            int recovered = store.recoverDanglingRuns();
            if (recovered > 0) {
                System.out.println("Recovered dangling runs: " + recovered);
            }

            CheckpointStore checkpoints = new CheckpointStore(config.getPath("checkpoint.path"));
            if (cmd.hasOption("reset-checkpoint")) {
                boolean deleted = checkpoints.delete();
                System.out.println("Checkpoint reset. path=" + checkpoints.path() + " deleted=" + deleted);
            }

            boolean lockEnabled = config.getBoolean("sync.lock.enabled", true);
            if (lockEnabled && !store.tryAcquireRunLock()) {
                System.err.println("ERROR: another sync run holds the run lock; exiting.");
                return 1;
            }

            ShutdownManager shutdown = new ShutdownManager(
                    new CancellationToken(),
                    Math.max(1L, config.getLong("shutdown.grace_sec", 30L))
            );
            shutdown.install();
            SyncOutcome outcome;
            try {
                Clock clock = Clock.systemDefaultZone();
                PeriodCalculator periods = new PeriodCalculator(config, clock);
                SyncRunner runner = new SyncRunner(
                        config,
                        store,
                        statsOnly ? null : new KnackClient(config, appId, apiKey),
                        new KnackRecordParser(catalog, config),
                        periods,
                        new StatisticsAggregator(config, periods),
                        checkpoints,
                        shutdown.token(),
                        clock
                );
                outcome = runner.run(resolveMode(cmd));
            } finally {
                shutdown.markFinished();
                if (lockEnabled) {
                    store.releaseRunLock();
                }
            }

            ReportMailer mailer = ReportMailer.fromConfig(config);
            if (mailer.isEnabled()) {
                boolean sent = mailer.sendReport(outcome);
                System.out.println("Report mail delivered=" + sent);
            }
            return outcome.exitCode;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    static String resolveMode(CommandLine cmd) {
        if (cmd.hasOption("stats-only")) {
            return SyncRunner.MODE_STATS_ONLY;
        }
        if (cmd.hasOption("skip-stats")) {
            return SyncRunner.MODE_SKIP_STATS;
        }
        return SyncRunner.MODE_FULL;
    }

private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (VespaSyncApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path outputsDir = config.getPath("outputs.dir");
                Path logDir = outputsDir.resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("vespasync.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must start before the swap so its console appender binds the original streams.
                LogManager.getLogger(VespaSyncApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("reset-checkpoint").desc("delete the resume checkpoint before running").build());
        options.addOption(Option.builder().longOpt("stats-only").desc("skip the source stages; backfill periods and recompute statistics only").build());
        options.addOption(Option.builder().longOpt("skip-stats").desc("sync source data but do not recompute statistics").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
