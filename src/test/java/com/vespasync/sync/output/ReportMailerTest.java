package com.vespasync.sync.output;

import com.vespasync.core.SyncReporter;
import com.vespasync.sync.config.Config;
import com.vespasync.sync.runner.SyncOutcome;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportMailerTest {

    @TempDir
    Path tempDir;

    @Test
    void sendReport_shouldWriteRunMessageInDryRun() throws Exception {
        ReportMailer mailer = mailer(Map.of(
                "email.enabled", "true",
                "email.to", "ops@example.org",
                "email.from", "sync@example.org",
                "mail.dry_run", "true",
                "mail.dry_run.dir", "mail"
        ));

        assertTrue(mailer.sendReport(outcome()));

        Path eml = tempDir.resolve("mail/sync_mail_run7_20250310_090000.eml");
        assertTrue(Files.isRegularFile(eml));
        MimeMessage message;
        try (InputStream in = Files.newInputStream(eml)) {
            message = new MimeMessage(Session.getInstance(new Properties()), in);
        }
        assertEquals("[VESPA Sync] PARTIAL run_id=7 errors=0 warnings=1", message.getSubject());
        assertEquals("ops@example.org", message.getAllRecipients()[0].toString());

        MimeMultipart parts = (MimeMultipart) message.getContent();
        assertEquals(2, parts.getCount());
        String body = (String) parts.getBodyPart(0).getContent();
        assertTrue(body.startsWith("Sync run 7 finished: status=PARTIAL exit=1 checkpoint_cleared=false"), body);
        assertTrue(body.contains("pending_person count=1"), body);
        MimeBodyPart attachment = (MimeBodyPart) parts.getBodyPart(1);
        assertEquals("sync_report_20250310_090000.json", attachment.getFileName());
        assertTrue(attachment.getContentType().startsWith("application/json"), attachment.getContentType());
    }

    @Test
    void sendReport_shouldDoNothingWhenDisabled() throws Exception {
        ReportMailer mailer = mailer(Map.of("mail.dry_run", "true", "mail.dry_run.dir", "mail"));

        assertFalse(mailer.isEnabled());
        assertFalse(mailer.sendReport(outcome()));
        assertFalse(Files.exists(tempDir.resolve("mail")));
    }

    @Test
    void sendReport_shouldWarnOnIncompleteSmtpSettings() throws Exception {
        ReportMailer mailer = mailer(Map.of("email.enabled", "true", "email.to", "ops@example.org"));

        assertFalse(mailer.sendReport(outcome()));
    }

    @Test
    void sendReport_shouldThrowOnIncompleteSmtpSettingsWhenFailFast() throws Exception {
        ReportMailer mailer = mailer(Map.of(
                "email.enabled", "true",
                "email.to", "ops@example.org",
                "mail.fail_fast", "true"
        ));
        SyncOutcome outcome = outcome();

        MessagingException e = assertThrows(MessagingException.class, () -> mailer.sendReport(outcome));
        assertTrue(e.getMessage().contains("email.smtp_user"), e.getMessage());
    }

    @Test
    void settings_shouldFallBackToSmtpUserAndWorkingDirectory() {
        ReportMailer.Settings settings = mailer(Map.of("email.smtp_user", "robot@example.org")).settings();

        assertEquals("smtp.gmail.com", settings.host);
        assertEquals(587, settings.port);
        assertEquals("robot@example.org", settings.from);
        assertEquals("[VESPA Sync]", settings.subjectPrefix);
        assertEquals(tempDir.resolve("outputs/mail_dry_run"), settings.dryRunDir);
    }

    @Test
    void maskAddress_shouldHideLocalPart() {
        assertEquals("o***@example.org", ReportMailer.maskAddress("ops@example.org"));
        assertEquals("*@example.org", ReportMailer.maskAddress("o@example.org"));
        assertEquals("not-an-address", ReportMailer.maskAddress("not-an-address"));
    }

    private ReportMailer mailer(Map<String, String> properties) {
        return ReportMailer.fromConfig(Config.fromProperties(tempDir, properties));
    }

    private SyncOutcome outcome() throws Exception {
        SyncReporter reporter = new SyncReporter("FULL", Instant.parse("2025-03-10T09:00:00Z"));
        reporter.setRunId(7L);
        reporter.warn("pending_person", "response r3 references unknown person p9");
        reporter.finish("PARTIAL");
        SyncReporter.Artifacts artifacts = reporter.writeArtifacts(tempDir.resolve("reports"), ZoneOffset.UTC);
        return new SyncOutcome(7L, "PARTIAL", SyncOutcome.EXIT_FAILED, reporter,
                artifacts.textReport(), artifacts.jsonReport(), false);
    }
}
