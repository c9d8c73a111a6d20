package com.vespasync.sync.runner;

import com.vespasync.core.FatalSyncException;
import com.vespasync.core.StageResult;
import com.vespasync.core.StageStatus;
import com.vespasync.core.SyncReporter;
import com.vespasync.sync.checkpoint.CancellationToken;
import com.vespasync.sync.checkpoint.CheckpointStore;
import com.vespasync.sync.checkpoint.SyncCheckpoint;
import com.vespasync.sync.config.Config;
import com.vespasync.sync.identity.IdentityResolver;
import com.vespasync.sync.identity.InstitutionRef;
import com.vespasync.sync.identity.MappingException;
import com.vespasync.sync.identity.PersonResolution;
import com.vespasync.sync.model.Institution;
import com.vespasync.sync.model.Person;
import com.vespasync.sync.model.PersonAlias;
import com.vespasync.sync.model.ResponseRecord;
import com.vespasync.sync.model.ScoreRecord;
import com.vespasync.sync.model.StaffMember;
import com.vespasync.sync.period.PeriodCalculator;
import com.vespasync.sync.source.FetchSummary;
import com.vespasync.sync.source.KnackRecordParser;
import com.vespasync.sync.source.PageSource;
import com.vespasync.sync.source.PagedFetcher;
import com.vespasync.sync.source.ParsedRecords;
import com.vespasync.sync.source.SourceFilter;
import com.vespasync.sync.source.SourcePage;
import com.vespasync.sync.stats.StatisticsAggregator;
import com.vespasync.sync.store.RowStore;
import com.vespasync.sync.store.SyncStore;
import com.vespasync.sync.writer.BatchUpsertWriter;
import com.vespasync.sync.writer.SyncTable;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 模块说明：SyncRunner（class）。
 * 主要职责：按固定阶段顺序驱动一次同步：身份引导、机构、人员与得分、员工、超级用户、问卷响应、周期回填、就绪度与得分统计。
 * 使用建议：在单个线程上调用 run；分页抓取可以并发，但页处理、写入与断点保存都在调用线程完成。
 * 维护提示：机构阶段失败或目标库不可达属于致命错误，此时断点文件保持原样，不删除。
 */
public final class SyncRunner {
    public static final String MODE_FULL = "FULL";
    public static final String MODE_STATS_ONLY = "STATS_ONLY";
    public static final String MODE_SKIP_STATS = "SKIP_STATS";

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_PARTIAL = "PARTIAL";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_CANCELLED = "CANCELLED";

    static final String COLLECTION_INSTITUTIONS = "institutions";
    static final String COLLECTION_PERSONS = "persons";
    static final String COLLECTION_STAFF_ADMINS = "staff_admins";
    static final String COLLECTION_SUPER_USERS = "super_users";
    static final String COLLECTION_RESPONSES = "responses";

    static final String STAGE_IDENTITY = "identity_bootstrap";
    static final String STAGE_INSTITUTIONS = "institutions";
    static final String STAGE_PERSONS = "persons_and_scores";
    static final String STAGE_STAFF_ADMINS = "staff_admins";
    static final String STAGE_SUPER_USERS = "super_users";
    static final String STAGE_RESPONSES = "responses";
    static final String STAGE_BACKFILL = "response_period_backfill";
    static final String STAGE_READINESS = "readiness_statistics";
    static final String STAGE_STATISTICS = "score_statistics";

    private final Config config;
    private final SyncStore store;
    private final PageSource source;
    private final KnackRecordParser parser;
    private final PeriodCalculator periods;
    private final StatisticsAggregator aggregator;
    private final CheckpointStore checkpoints;
    private final CancellationToken token;
    private final Clock clock;
    private final Supplier<UUID> idFactory;

    public SyncRunner(
            Config config,
            SyncStore store,
            PageSource source,
            KnackRecordParser parser,
            PeriodCalculator periods,
            StatisticsAggregator aggregator,
            CheckpointStore checkpoints,
            CancellationToken token,
            Clock clock
    ) {
        this(config, store, source, parser, periods, aggregator, checkpoints, token, clock, UUID::randomUUID);
    }

    public SyncRunner(
            Config config,
            SyncStore store,
            PageSource source,
            KnackRecordParser parser,
            PeriodCalculator periods,
            StatisticsAggregator aggregator,
            CheckpointStore checkpoints,
            CancellationToken token,
            Clock clock,
            Supplier<UUID> idFactory
    ) {
        this.config = config;
        this.store = store;
        this.source = source;
        this.parser = parser;
        this.periods = periods;
        this.aggregator = aggregator;
        this.checkpoints = checkpoints;
        this.token = token == null ? new CancellationToken() : token;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.idFactory = idFactory == null ? UUID::randomUUID : idFactory;
    }

/**
 * 方法说明：run，负责执行一次指定模式的同步。
 * 处理流程：登记 sync_runs，加载断点，依次执行各阶段，最后写出报告并回写运行记录。
 * 维护提示：返回值中的 exitCode 直接作为进程退出码使用。
 */
    public SyncOutcome run(String mode) {
        String runMode = normalizeMode(mode);
        return new Execution(runMode, clock.instant()).execute();
    }

    static String normalizeMode(String mode) {
        String value = mode == null ? "" : mode.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (MODE_STATS_ONLY.equals(value) || MODE_SKIP_STATS.equals(value)) {
            return value;
        }
        return MODE_FULL;
    }

    static boolean isConnectionFailure(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    @FunctionalInterface
    private interface StageBody {
        StageResult run() throws SQLException;
    }

    @FunctionalInterface
    private interface RecordSink {
        void accept(JSONObject record) throws MappingException;
    }

    /**
     * State of one run: reporter, identity maps, checkpoint and stage bookkeeping.
     */
    private final class Execution {
        private final String mode;
        private final Instant startedAt;
        private final SyncReporter reporter;
        private final IdentityResolver identity;
        private final SyncTable<Institution> institutionTable;
        private final SyncTable<Person> personTable;
        private final SyncTable<PersonAlias> aliasTable;
        private final SyncTable<ScoreRecord> scoreTable;
        private final SyncTable<ResponseRecord> responseTable;
        private final SyncTable<StaffMember> staffAdminTable;
        private final SyncTable<StaffMember> superUserTable;
        private SyncCheckpoint checkpoint;
        private long runId;
        private int failedStages;
        private boolean fetchIncomplete;

        private Execution(String mode, Instant startedAt) {
            this.mode = mode;
            this.startedAt = startedAt;
            this.reporter = new SyncReporter(mode, startedAt);
            this.identity = new IdentityResolver(idFactory);

            this.institutionTable = SyncTable.of(store.institutions(), batchSize(store.institutions()))
                    .withCarryOver((stored, incoming) -> incoming.toBuilder().id(stored.getId()).build());
            this.personTable = SyncTable.of(store.persons(), batchSize(store.persons()))
                    .withCarryOver(SyncRunner::keepStoredPersonFields);
            this.aliasTable = SyncTable.of(store.personAliases(), batchSize(store.personAliases()));
            this.scoreTable = SyncTable.of(store.scoreRecords(), batchSize(store.scoreRecords()))
                    .withGuard(row -> !row.hasAnyScore())
                    .withDedup((older, newer) -> newer.filledFields() >= older.filledFields() ? newer : older)
                    .withCarryOver((stored, incoming) -> incoming.getCompletionDate() == null
                            ? incoming.toBuilder().completionDate(stored.getCompletionDate()).build()
                            : incoming);
            this.responseTable = SyncTable.of(store.responseRecords(), batchSize(store.responseRecords()))
                    .withGuard(row -> row.getValue() == null)
                    .withCarryOver((stored, incoming) -> incoming.getPeriod() == null
                            ? incoming.toBuilder().period(stored.getPeriod()).build()
                            : incoming);
            this.staffAdminTable = SyncTable.of(store.staffAdmins(), batchSize(store.staffAdmins()));
            this.superUserTable = SyncTable.of(store.superUsers(), batchSize(store.superUsers()));
        }

        SyncOutcome execute() {
            String status;
            boolean fatal = false;
            try {
                runId = store.startRun(mode, startedAt);
                reporter.setRunId(runId);
                System.out.println("Sync run started. run_id=" + runId + " mode=" + mode);

                recordCounts(true);
                if (!MODE_STATS_ONLY.equals(mode)) {
                    checkpoint = loadCheckpoint();
                    stage(STAGE_IDENTITY, this::bootstrapIdentity);
                    syncSourceCollections();
                } else {
                    for (String name : List.of(STAGE_IDENTITY, STAGE_INSTITUTIONS, STAGE_PERSONS,
                            STAGE_STAFF_ADMINS, STAGE_SUPER_USERS, STAGE_RESPONSES)) {
                        skip(name, "stats_only");
                    }
                }
                stage(STAGE_BACKFILL, this::backfillPeriods);
                if (MODE_SKIP_STATS.equals(mode)) {
                    skip(STAGE_READINESS, "skip_stats");
                    skip(STAGE_STATISTICS, "skip_stats");
                } else {
                    stage(STAGE_READINESS, this::readinessStatistics);
                    stage(STAGE_STATISTICS, this::scoreStatistics);
                }
                recordCounts(false);
            } catch (FatalSyncException e) {
                fatal = true;
                System.err.println("FATAL: sync aborted: " + e.getMessage());
                reporter.warn("fatal", e.getMessage());
            } catch (SQLException e) {
                fatal = true;
                System.err.println("FATAL: sync aborted: " + e.getMessage());
                reporter.warn("fatal", "target store unavailable: " + e.getMessage());
            }

            int exitCode;
            if (fatal) {
                status = STATUS_FAILED;
                exitCode = SyncOutcome.EXIT_FAILED;
            } else if (token.isCancelled()) {
                status = STATUS_CANCELLED;
                exitCode = SyncOutcome.EXIT_CANCELLED;
            } else if (failedStages > 0) {
                status = STATUS_PARTIAL;
                exitCode = SyncOutcome.EXIT_FAILED;
            } else {
                status = STATUS_SUCCESS;
                exitCode = SyncOutcome.EXIT_OK;
            }

            boolean cleared = false;
            if (!fatal && checkpoint != null) {
                if (STATUS_SUCCESS.equals(status) && !fetchIncomplete) {
                    cleared = clearCheckpoint();
                } else {
                    saveCheckpoint();
                }
            }

            reporter.finish(status);
            SyncReporter.Artifacts artifacts = writeReport();
            finishRun(status, artifacts);
            System.out.println(String.format(Locale.US,
                    "Sync finished. run_id=%d status=%s exit_code=%d errors=%d warnings=%d elapsed_ms=%d",
                    runId, status, exitCode, reporter.totalErrors(), reporter.totalWarnings(), reporter.totalElapsedMs()));
            System.out.println(reporter.getSummary());
            return new SyncOutcome(
                    runId,
                    status,
                    exitCode,
                    reporter,
                    artifacts == null ? null : artifacts.textReport(),
                    artifacts == null ? null : artifacts.jsonReport(),
                    cleared
            );
        }

        private void syncSourceCollections() {
            StageResult institutions = stage(STAGE_INSTITUTIONS, this::syncInstitutions);
            if (institutions.status() == StageStatus.FAILED) {
                throw new FatalSyncException("institution stage failed: " + institutions.reason());
            }
            stage(STAGE_PERSONS, this::syncPersons);
            stage(STAGE_STAFF_ADMINS, () -> syncStaff(COLLECTION_STAFF_ADMINS, STAGE_STAFF_ADMINS, staffAdminTable, false));
            stage(STAGE_SUPER_USERS, () -> syncStaff(COLLECTION_SUPER_USERS, STAGE_SUPER_USERS, superUserTable, true));
            stage(STAGE_RESPONSES, this::syncResponses);
        }

        private StageResult bootstrapIdentity() {
            try {
                identity.bootstrap(store.loadInstitutions(), store.loadPersons(), store.loadPersonAliases());
            } catch (SQLException e) {
                throw new FatalSyncException("identity bootstrap failed: " + e.getMessage(), e);
            }
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("institutions", identity.institutionCount());
            evidence.put("persons", identity.personCount());
            return StageResult.ok(STAGE_IDENTITY, evidence);
        }

        private StageResult syncInstitutions() {
            BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
            writer.register(institutionTable);
            SourceFilter filter = SourceFilter.parse(config.getString("source.filter.institutions"));
            StageResult result = fetchCollection(STAGE_INSTITUTIONS, COLLECTION_INSTITUTIONS, filter, writer,
                    institutionTable.name(), record -> {
                        ParsedRecords.InstitutionRecord parsed = parser.parseInstitution(record);
                        Institution row = Institution.builder()
                                .id(identity.institutionId(parsed.externalId()))
                                .externalId(parsed.externalId())
                                .name(parsed.name())
                                .status(parsed.status())
                                .usesCalendarYear(parsed.usesCalendarYear())
                                .build();
                        identity.registerInstitution(row);
                        writer.stage(institutionTable, row);
                    });
            if (result.status() == StageStatus.PARTIAL && result.reason().startsWith("first_page_failed")) {
                throw new FatalSyncException("institution fetch failed: " + result.reason());
            }
            long errors = reporter.table(institutionTable.name()).errors();
            if (errors > 0) {
                throw new FatalSyncException("institution writes failed: errors=" + errors);
            }
            return result;
        }

        private StageResult syncPersons() {
            BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
            writer.register(personTable);
            writer.register(aliasTable);
            writer.register(scoreTable);
            return fetchCollection(STAGE_PERSONS, COLLECTION_PERSONS, SourceFilter.none(), writer,
                    personTable.name(), record -> ingestPerson(record, writer));
        }

/**
 * 方法说明：ingestPerson，负责把一条人员记录映射为人员、别名与各周期得分行。
 * 处理流程：机构未知时计为待定并跳过；邮箱决定内部 id；所有周期共用由完成日期推导的 period。
 */
        private void ingestPerson(JSONObject record, BatchUpsertWriter writer) throws MappingException {
            ParsedRecords.PersonRecord parsed = parser.parsePerson(record);
            Optional<InstitutionRef> institution = identity.institution(parsed.institutionExternalId());
            if (institution.isEmpty()) {
                reporter.table(personTable.name()).addPending(1);
                reporter.warn("pending_institution", "person " + parsed.externalId()
                        + " references unknown institution " + parsed.institutionExternalId());
                return;
            }
            PersonResolution resolved = identity.resolvePerson(parsed.externalId(), parsed.email());
            if (resolved.rebound()) {
                reporter.warn("identity_rebound", "external id " + parsed.externalId()
                        + " now resolves to " + resolved.personId() + " via " + resolved.email());
            }

            String period = periods.periodForSourceDate(parsed.completionDate(), institution.get().usesCalendarYear());
            LocalDate completion = PeriodCalculator.parseSourceDate(parsed.completionDate()).orElse(null);
            List<ScoreRecord> scores = new ArrayList<>();
            Integer currentCycle = null;
            for (ParsedRecords.CycleScores cycle : parsed.cycles()) {
                for (String rejected : cycle.rejectedFields()) {
                    reporter.table(scoreTable.name()).addRejected(1);
                    reporter.warn("score_out_of_range", "person " + parsed.externalId()
                            + " cycle " + cycle.cycle() + " " + rejected);
                }
                List<Integer> values = cycle.scores();
                ScoreRecord row = ScoreRecord.builder()
                        .personId(resolved.personId())
                        .cycle(cycle.cycle())
                        .period(period)
                        .vision(values.get(0))
                        .effort(values.get(1))
                        .systems(values.get(2))
                        .practice(values.get(3))
                        .attitude(values.get(4))
                        .overall(values.get(5))
                        .completionDate(completion)
                        .build();
                if (row.hasAnyScore()) {
                    currentCycle = currentCycle == null ? cycle.cycle() : Math.max(currentCycle, cycle.cycle());
                }
                scores.add(row);
            }

            Person person = Person.builder()
                    .id(resolved.personId())
                    .email(resolved.email())
                    .externalId(parsed.externalId())
                    .name(parsed.name())
                    .institutionId(institution.get().id())
                    .groupName(parsed.groupName())
                    .yearGroup(parsed.yearGroup())
                    .course(parsed.course())
                    .faculty(parsed.faculty())
                    .currentCycle(currentCycle)
                    .currentPeriod(currentCycle == null ? null : period)
                    .build();
            writer.stage(personTable, person);
            writer.stage(aliasTable, new PersonAlias(parsed.externalId(), resolved.personId()));
            for (ScoreRecord row : scores) {
                writer.stage(scoreTable, row);
            }
        }

        private StageResult syncStaff(String collection, String stageName, SyncTable<StaffMember> table, boolean superUsers) {
            BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
            writer.register(table);
            return fetchCollection(stageName, collection, SourceFilter.none(), writer, table.name(), record -> {
                ParsedRecords.StaffRecord parsed = superUsers ? parser.parseSuperUser(record) : parser.parseStaffAdmin(record);
                UUID institutionId = identity.institutionByName(parsed.institutionName())
                        .map(InstitutionRef::id)
                        .orElse(null);
                if (institutionId == null && parsed.institutionName() != null) {
                    reporter.warn("unknown_institution", table.name() + " " + parsed.externalId()
                            + " names unknown institution '" + parsed.institutionName() + "'");
                }
                writer.stage(table, StaffMember.builder()
                        .externalId(parsed.externalId())
                        .email(parsed.email())
                        .name(parsed.name())
                        .institutionId(institutionId)
                        .institutionName(parsed.institutionName())
                        .build());
            });
        }

        private StageResult syncResponses() {
            BatchUpsertWriter writer = new BatchUpsertWriter(reporter);
            writer.register(responseTable);
            return fetchCollection(STAGE_RESPONSES, COLLECTION_RESPONSES, SourceFilter.none(), writer,
                    responseTable.name(), record -> {
                        ParsedRecords.ResponseSet parsed = parser.parseResponses(record);
                        for (String rejected : parsed.rejectedFields()) {
                            reporter.table(responseTable.name()).addRejected(1);
                            reporter.warn("response_out_of_range", "response " + parsed.externalId() + " " + rejected);
                        }
                        Optional<UUID> person = identity.resolve(parsed.personExternalId());
                        if (person.isEmpty()) {
                            reporter.table(responseTable.name()).addPending(Math.max(1, parsed.answers().size()));
                            reporter.warn("pending_person", "response " + parsed.externalId()
                                    + " references unknown person " + parsed.personExternalId());
                            return;
                        }
                        for (ParsedRecords.Answer answer : parsed.answers()) {
                            writer.stage(responseTable, ResponseRecord.builder()
                                    .personId(person.get())
                                    .cycle(answer.cycle())
                                    .questionId(answer.questionId())
                                    .value(answer.value())
                                    .build());
                        }
                    });
        }

        private StageResult backfillPeriods() throws SQLException {
            int changed = store.backfillResponsePeriods();
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("rows_updated", changed);
            return StageResult.ok(STAGE_BACKFILL, evidence);
        }

        private StageResult readinessStatistics() throws SQLException {
            StatisticsAggregator.Result result = aggregator.recomputeReadiness(store);
            if (result.suppressedBenchmarks() > 0) {
                reporter.warn("readiness_suppressed", String.format(Locale.US,
                        "benchmarks=%d below min_observations=%d",
                        result.suppressedBenchmarks(), aggregator.minReadinessObservations()));
            }
            return StageResult.ok(STAGE_READINESS, statisticsEvidence(result));
        }

        private StageResult scoreStatistics() throws SQLException {
            StatisticsAggregator.Result result = aggregator.recomputeScores(store);
            return StageResult.ok(STAGE_STATISTICS, statisticsEvidence(result));
        }

/**
 * 方法说明：fetchCollection，负责抓取一个集合并逐页写入。
 * 处理流程：断点已完成则跳过；否则从断点页续抓，每页处理后 flush 并保存断点，集合抓完标记完成。
 * 维护提示：首页失败不标记完成，下次运行会从同一页重试；中间页被放弃时集合重新打开，下次从第 1 页补抓，已写入的记录按断点跳过。
 */
        private StageResult fetchCollection(
                String stageName,
                String collection,
                SourceFilter filter,
                BatchUpsertWriter writer,
                String skipTable,
                RecordSink sink
        ) {
            if (checkpoint.isCompleted(collection)) {
                return StageResult.skipped(stageName, "completed_in_checkpoint");
            }
            int startPage = checkpoint.resumePage(collection);
            if (startPage > 1) {
                System.out.println("Resuming " + collection + " from page " + startPage);
            }
            PagedFetcher fetcher = new PagedFetcher(source, config.getInt("fetch.concurrent", 4), reporter, token);
            FetchSummary summary = fetcher.fetch(collection, filter, startPage,
                    page -> consumePage(collection, page, writer, skipTable, sink));
            writer.flushAll();

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("start_page", startPage);
            evidence.put("last_page", summary.lastPage);
            evidence.put("pages_ok", summary.pagesOk);
            evidence.put("pages_failed", summary.pagesFailed);
            evidence.put("records", summary.records);
            if (summary.cancelled) {
                saveCheckpoint();
                return StageResult.cancelled(stageName, evidence);
            }
            if (summary.firstPageFailed) {
                fetchIncomplete = true;
                return StageResult.partial(stageName, "first_page_failed: " + summary.firstPageError, evidence);
            }
            if (summary.pagesFailed > 0) {
                fetchIncomplete = true;
                checkpoint.reopen(collection, clock.instant());
                saveCheckpoint();
                return StageResult.partial(stageName, "pages_failed", evidence);
            }
            checkpoint.markCompleted(collection, clock.instant());
            saveCheckpoint();
            return StageResult.ok(stageName, evidence);
        }

        private void consumePage(String collection, SourcePage page, BatchUpsertWriter writer, String skipTable, RecordSink sink) {
            List<String> processed = new ArrayList<>(page.size());
            for (JSONObject record : page.records) {
                String sourceId = record.optString("id", "").trim();
                if (!sourceId.isEmpty() && checkpoint.isProcessed(collection, sourceId)) {
                    reporter.table(skipTable).addSkipped(1);
                    continue;
                }
                try {
                    sink.accept(record);
                } catch (MappingException e) {
                    reporter.table(skipTable).addSkipped(1);
                    reporter.warn(e.category(), collection + ": " + e.getMessage());
                }
                processed.add(sourceId);
            }
            writer.flushAll();
            checkpoint.markPage(collection, page.page, processed, clock.instant());
            saveCheckpoint();
        }

        private StageResult stage(String name, StageBody body) {
            reporter.startStage(name);
            if (token.isCancelled()) {
                StageResult cancelled = StageResult.cancelled(name, Map.of("reason", token.reason()));
                reporter.endStage(cancelled);
                return cancelled;
            }
            StageResult result;
            try {
                result = body.run();
            } catch (SQLException e) {
                if (isConnectionFailure(e)) {
                    reporter.endStage(StageResult.failed(name, "store_unreachable: " + e.getMessage()));
                    throw new FatalSyncException("target store unreachable during " + name, e);
                }
                result = StageResult.failed(name, "SQLException: " + e.getMessage());
            } catch (FatalSyncException e) {
                reporter.endStage(StageResult.failed(name, e.getMessage()));
                throw e;
            } catch (RuntimeException e) {
                result = StageResult.failed(name, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (result.status() == StageStatus.FAILED) {
                failedStages++;
                System.err.println("ERROR: stage " + name + " failed: " + result.reason());
            }
            reporter.endStage(result);
            return result;
        }

        private void skip(String name, String reason) {
            reporter.startStage(name);
            reporter.endStage(StageResult.skipped(name, reason));
        }

        private SyncCheckpoint loadCheckpoint() {
            Optional<SyncCheckpoint> existing = checkpoints == null ? Optional.empty() : checkpoints.load();
            if (existing.isPresent()) {
                SyncCheckpoint cp = existing.get();
                System.out.println("Checkpoint found. run_started_at=" + cp.runStartedAt()
                        + " collections=" + cp.collections());
                return cp;
            }
            return new SyncCheckpoint(startedAt);
        }

        private void saveCheckpoint() {
            if (checkpoints == null || checkpoint == null) {
                return;
            }
            try {
                checkpoints.save(checkpoint);
            } catch (IOException e) {
                reporter.warn("checkpoint_write_failed", checkpoints.path() + ": " + e.getMessage());
            }
        }

        private boolean clearCheckpoint() {
            if (checkpoints == null) {
                return false;
            }
            try {
                return checkpoints.delete();
            } catch (IOException e) {
                reporter.warn("checkpoint_write_failed", "delete " + checkpoints.path() + ": " + e.getMessage());
                return false;
            }
        }

        private void recordCounts(boolean before) throws SQLException {
            for (RowStore<?> rows : List.of(
                    store.institutions(),
                    store.persons(),
                    store.personAliases(),
                    store.scoreRecords(),
                    store.responseRecords(),
                    store.staffAdmins(),
                    store.superUsers())) {
                long count;
                try {
                    count = rows.count();
                } catch (SQLException e) {
                    if (isConnectionFailure(e)) {
                        throw e;
                    }
                    reporter.warn("count_failed", rows.tableName() + ": " + e.getMessage());
                    continue;
                }
                SyncReporter.TableCounters counters = reporter.table(rows.tableName());
                if (before) {
                    counters.setBefore(count);
                } else {
                    counters.setAfter(count);
                }
            }
        }

        private SyncReporter.Artifacts writeReport() {
            Path dir = config.getPath("report.dir");
            ZoneId zone = ZoneId.of(config.getString("app.zone", ZoneId.systemDefault().getId()));
            try {
                SyncReporter.Artifacts artifacts = reporter.writeArtifacts(dir, zone);
                System.out.println("Sync report written: " + artifacts.textReport().toAbsolutePath());
                return artifacts;
            } catch (IOException e) {
                System.err.println("WARN: failed to write sync report to " + dir + ": " + e.getMessage());
                return null;
            }
        }

        private void finishRun(String status, SyncReporter.Artifacts artifacts) {
            if (runId <= 0L) {
                return;
            }
            try {
                store.finishRun(
                        runId,
                        status,
                        reporter.toJson().toString(),
                        artifacts == null ? null : artifacts.textReport().toAbsolutePath().toString()
                );
            } catch (SQLException e) {
                System.err.println("WARN: failed to record run result run_id=" + runId + ": " + e.getMessage());
            }
        }

        private int batchSize(RowStore<?> rows) {
            return config.getInt("batch." + rows.tableName(), 100);
        }
    }

    private static Map<String, Object> statisticsEvidence(StatisticsAggregator.Result result) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("group_rows", result.groups().size());
        evidence.put("benchmark_rows", result.benchmarks().size());
        evidence.put("suppressed_groups", result.suppressedGroups());
        evidence.put("suppressed_benchmarks", result.suppressedBenchmarks());
        evidence.put("skipped_observations", result.skippedObservations());
        return evidence;
    }

    /**
     * Keeps the stored internal id, and the stored cycle progress when the source sent no scores.
     */
    static Person keepStoredPersonFields(Person stored, Person incoming) {
        Person.PersonBuilder merged = incoming.toBuilder().id(stored.getId());
        if (incoming.getCurrentCycle() == null) {
            merged.currentCycle(stored.getCurrentCycle()).currentPeriod(stored.getCurrentPeriod());
        }
        return merged.build();
    }
}
