package com.vespasync.sync.output;

import com.vespasync.core.SyncReporter;
import com.vespasync.sync.config.Config;
import com.vespasync.sync.runner.SyncOutcome;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 模块说明：ReportMailer（class）。
 * 主要职责：把一次同步运行的结果（状态、计数摘要、JSON 报告附件）组装为邮件，经 SMTP 发送或在 dry-run 下落盘为 .eml。
 * 使用建议：通过 fromConfig 构建；调用方只需在运行结束后交出 SyncOutcome。
 * 维护提示：发送失败默认只打印 WARN，不影响同步退出码；mail.fail_fast=true 时改为抛出 MessagingException。
 */
public final class ReportMailer {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Settings settings;

    public ReportMailer(Settings settings) {
        this.settings = settings;
    }

    public static ReportMailer fromConfig(Config config) {
        return new ReportMailer(Settings.from(config));
    }

    public boolean isEnabled() {
        return settings.enabled;
    }

    public Settings settings() {
        return settings;
    }

/**
 * 方法说明：sendReport，负责投递一次运行的报告邮件。
 * 处理流程：未启用直接返回；dry-run 写出 .eml；否则校验 SMTP 配置后发送。
 * 维护提示：返回 true 表示已发送或已落盘。
 */
    public boolean sendReport(SyncOutcome outcome) throws MessagingException {
        if (!settings.enabled) {
            return false;
        }
        if (settings.dryRun) {
            try {
                Path eml = writeDryRun(outcome);
                System.out.println("Mail dry-run saved. file=" + eml.toAbsolutePath());
                return true;
            } catch (IOException e) {
                deliveryFailed("dry_run_write_failed", e);
                return false;
            }
        }

        List<String> missing = missingSmtpSettings();
        if (!missing.isEmpty()) {
            deliveryFailed("smtp_settings_incomplete", new MessagingException("missing " + String.join(",", missing)));
            return false;
        }
        try {
            MimeMessage message = compose(Session.getInstance(smtpProperties()), outcome);
            Transport.send(message, settings.user, settings.pass);
            System.out.println("Report mail sent. run_id=" + outcome.runId + " to=" + maskAddresses(settings.to));
            return true;
        } catch (MessagingException e) {
            deliveryFailed("smtp_send_failed", e);
            return false;
        }
    }

    public String subjectFor(SyncOutcome outcome) {
        SyncReporter reporter = outcome.reporter;
        return String.format(Locale.US, "%s %s run_id=%d errors=%d warnings=%d",
                settings.subjectPrefix,
                outcome.status,
                outcome.runId,
                reporter.totalErrors(),
                reporter.totalWarnings()).trim();
    }

    String bodyFor(SyncOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("Sync run ").append(outcome.runId)
                .append(" finished: status=").append(outcome.status)
                .append(" exit=").append(outcome.exitCode)
                .append(" checkpoint_cleared=").append(outcome.checkpointCleared)
                .append('\n');
        if (outcome.textReport != null) {
            sb.append("report=").append(outcome.textReport.toAbsolutePath()).append('\n');
        }
        sb.append('\n').append(outcome.reporter.getSummary());
        return sb.toString();
    }

    MimeMessage compose(Session session, SyncOutcome outcome) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        if (!settings.from.isEmpty()) {
            message.setFrom(new InternetAddress(settings.from));
        }
        if (!settings.to.isEmpty()) {
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(String.join(",", settings.to)));
        }
        message.setSubject(subjectFor(outcome), "UTF-8");
        Instant finished = outcome.reporter.finishedAt();
        message.setSentDate(Date.from(finished == null ? Instant.now() : finished));

        MimeMultipart mixed = new MimeMultipart("mixed");
        MimeBodyPart body = new MimeBodyPart();
        body.setText(bodyFor(outcome), "UTF-8");
        mixed.addBodyPart(body);
        if (outcome.jsonReport != null && Files.isRegularFile(outcome.jsonReport)) {
            MimeBodyPart json = new MimeBodyPart();
            try {
                json.attachFile(outcome.jsonReport.toFile(), "application/json", null);
                mixed.addBodyPart(json);
            } catch (IOException e) {
                System.err.println("WARN: report attachment skipped " + outcome.jsonReport + ": " + e.getMessage());
            }
        }
        message.setContent(mixed);
        message.saveChanges();
        return message;
    }

    private Path writeDryRun(SyncOutcome outcome) throws IOException {
        Files.createDirectories(settings.dryRunDir);
        Path eml = settings.dryRunDir.resolve(
                "sync_mail_run" + outcome.runId + "_" + STAMP.format(outcome.reporter.startedAt()) + ".eml");
        try (OutputStream out = Files.newOutputStream(eml)) {
            compose(Session.getInstance(smtpProperties()), outcome).writeTo(out);
        } catch (MessagingException e) {
            throw new IOException("cannot compose report mail: " + e.getMessage(), e);
        }
        return eml;
    }

    private Properties smtpProperties() {
        Properties props = new Properties();
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.host", settings.host);
        props.put("mail.smtp.port", String.valueOf(settings.port));
        props.put("mail.smtp.connectiontimeout", String.valueOf(settings.timeoutMs));
        props.put("mail.smtp.timeout", String.valueOf(settings.timeoutMs));
        return props;
    }

    private List<String> missingSmtpSettings() {
        List<String> missing = new ArrayList<>();
        if (settings.host.isEmpty()) {
            missing.add("email.smtp_host");
        }
        if (settings.user.isEmpty()) {
            missing.add("email.smtp_user");
        }
        if (settings.pass.isEmpty()) {
            missing.add("email.smtp_pass");
        }
        if (settings.to.isEmpty()) {
            missing.add("email.to");
        }
        return missing;
    }

    private void deliveryFailed(String stage, Exception cause) throws MessagingException {
        String message = "Report mail failed stage=" + stage
                + " smtp=" + settings.host + ":" + settings.port
                + " to=" + maskAddresses(settings.to)
                + " err=" + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        if (settings.failFast) {
            throw cause instanceof MessagingException
                    ? (MessagingException) cause
                    : new MessagingException(message, cause);
        }
        System.err.println("WARN: " + message);
    }

    private static String maskAddresses(List<String> addresses) {
        return addresses.stream().map(ReportMailer::maskAddress).collect(Collectors.joining(","));
    }

    static String maskAddress(String raw) {
        String value = raw == null ? "" : raw;
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String domain = value.substring(at + 1);
        return at == 1 ? "*@" + domain : value.charAt(0) + "***@" + domain;
    }

    /**
     * Mail settings read once per run.
     */
    public static final class Settings {
        public final boolean enabled;
        public final String host;
        public final int port;
        public final String user;
        public final String pass;
        public final String from;
        public final List<String> to;
        public final String subjectPrefix;
        public final boolean dryRun;
        public final boolean failFast;
        public final Path dryRunDir;
        public final int timeoutMs;

        private Settings(Config config) {
            this.enabled = config.getBoolean("email.enabled", false);
            this.host = config.getString("email.smtp_host", "smtp.gmail.com").trim();
            this.port = config.getInt("email.smtp_port", 587);
            this.user = config.getString("email.smtp_user", "").trim();
            this.pass = config.getString("email.smtp_pass", "");
            this.from = config.getString("email.from", user).trim();
            this.to = List.copyOf(config.getList("email.to"));
            this.subjectPrefix = config.getString("email.subject_prefix", "[VESPA Sync]").trim();
            this.dryRun = config.getBoolean("mail.dry_run", false);
            this.failFast = config.getBoolean("mail.fail_fast", false);
            this.dryRunDir = config.workingDir().resolve(config.getString("mail.dry_run.dir", "outputs/mail_dry_run")).normalize();
            this.timeoutMs = Math.max(1000, config.getInt("email.smtp_timeout_ms", 15000));
        }

        public static Settings from(Config config) {
            return new Settings(config);
        }
    }
}
