package com.vespasync.sync.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 → classpath vespasync.properties → 工作目录 vespasync.properties → 环境变量 的顺序合并同步配置。
 * 使用建议：环境变量名为 VESPASYNC_ 加上大写键名，键名中的 '.' 替换为 '_'。
 */
public final class Config {
    public static final String FILE_NAME = "vespasync.properties";
    public static final String ENV_PREFIX = "VESPASYNC_";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Map<String, String> envProps = new HashMap<>();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置或数据。
 * 处理流程：依次读取 classpath 配置、工作目录覆盖文件与进程环境变量，后者优先。
 * 维护提示：读取失败的覆盖文件只输出 WARN，不中断启动。
 */
    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    public static Config load(Path workingDir, Map<String, String> environment) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath " + FILE_NAME + ": " + e.getMessage());
        }

        Path local = workingDir.resolve(FILE_NAME);
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read " + FILE_NAME + ": " + e.getMessage());
            }
        }

        config.applyEnvironment(environment);
        return config;
    }

    /**
     * Builds a config from an explicit key/value map, ignoring classpath, local file and environment.
     */
    public static Config fromProperties(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : entry.getValue();
                config.overrideProps.setProperty(entry.getKey().trim(), value);
                config.props.setProperty(entry.getKey().trim(), value);
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

/**
 * 方法说明：getPath，负责获取数据并返回结果。
 * 处理流程：相对路径以工作目录为基准解析，空值返回工作目录本身。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

/**
 * 方法说明：sourceOf，返回键值最终来自哪一层配置。
 * 处理流程：按 env → override → resource → default 顺序判断。
 */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(envProps.get(key)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    /**
     * Environment variable name that overrides the given key.
     */
    public static String envName(String key) {
        return ENV_PREFIX + key.trim().replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private void applyEnvironment(Map<String, String> environment) {
        if (environment == null || environment.isEmpty()) {
            return;
        }
        List<String> keys = new ArrayList<>(DEFAULTS.keySet());
        for (String name : props.stringPropertyNames()) {
            if (!keys.contains(name)) {
                keys.add(name);
            }
        }
        for (String key : keys) {
            String value = nonBlank(environment.get(envName(key)));
            if (!value.isEmpty()) {
                envProps.put(key, value);
                props.setProperty(key, value);
            }
        }
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("report.dir", "outputs/reports");
        defaults.put("checkpoint.path", "outputs/sync_checkpoint.json");
        defaults.put("shutdown.grace_sec", "30");
        defaults.put("sync.lock.enabled", "true");

        defaults.put("db.url", "jdbc:postgresql://localhost:5432/vespa");
        defaults.put("db.user", "vespa");
        defaults.put("db.pass", "vespa");
        defaults.put("db.schema", "vespa");
        defaults.put("db.sql_log.enabled", "true");

        defaults.put("knack.base_url", "https://api.knack.com/v1");
        defaults.put("knack.app_id", "");
        defaults.put("knack.api_key", "");
        defaults.put("knack.rows_per_page", "500");
        defaults.put("knack.request_timeout_sec", "30");
        defaults.put("knack.retry_count", "3");
        defaults.put("knack.retry_sleep_ms", "2000");
        defaults.put("knack.request_pause_ms", "100");
        defaults.put("fetch.concurrent", "4");

        defaults.put("source.object.institutions", "object_2");
        defaults.put("source.object.persons", "object_10");
        defaults.put("source.object.responses", "object_29");
        defaults.put("source.object.staff_admins", "object_5");
        defaults.put("source.object.super_users", "object_21");
        defaults.put("source.filter.institutions", "field_2209|is not|Cancelled");
        defaults.put("source.question_catalog", "question_catalog.json");
        defaults.put("source.calendar_year.field", "field_2300");
        defaults.put("source.calendar_year.values", "Australia");

        defaults.put("batch.institutions", "50");
        defaults.put("batch.persons", "100");
        defaults.put("batch.person_aliases", "200");
        defaults.put("batch.score_records", "200");
        defaults.put("batch.response_records", "500");
        defaults.put("batch.staff_admins", "50");
        defaults.put("batch.super_users", "50");

        defaults.put("period.fiscal_start_month", "8");
        defaults.put("stats.readiness.min_observations", "11");
        defaults.put("stats.readiness.questions", "outcome_q_confident,outcome_q_equipped,outcome_q_support");

        defaults.put("email.enabled", "false");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.smtp_user", "");
        defaults.put("email.smtp_pass", "");
        defaults.put("email.from", "");
        defaults.put("email.to", "");
        defaults.put("email.subject_prefix", "[VESPA Sync]");
        defaults.put("mail.dry_run", "false");
        defaults.put("mail.fail_fast", "false");
        defaults.put("mail.dry_run.dir", "outputs/mail_dry_run");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
