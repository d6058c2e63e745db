/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.courier.integration.email;

import java.util.Locale;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.mailer.Mail;
import io.quarkus.mailer.Mailer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.courier.config.NotificationConfig;
import villagecompute.courier.integration.GatewayResult;

/**
 * Email gateway backed by the Quarkus Mailer (SMTP).
 *
 * <p>
 * Sends are blocking; the dispatcher already runs on a worker thread. SMTP rejections naming an unknown mailbox
 * (5.1.1, 550) are reported as invalid targets, everything else as transient.
 */
@ApplicationScoped
public class MailerEmailClient implements EmailGateway {

    private static final Logger LOG = Logger.getLogger(MailerEmailClient.class);

    @Inject
    Mailer mailer;

    @ConfigProperty(
            name = "courier.email.from",
            defaultValue = "noreply@villagecompute.com")
    String fromEmail;

    @Override
    public GatewayResult sendEmail(String address, String subject, String html, String text) {
        if (!NotificationConfig.isValidEmail(address)) {
            return GatewayResult.invalidTarget("invalid email address");
        }

        Mail mail = Mail.withHtml(address, subject, html).setText(text).setFrom(fromEmail)
                .addHeader("X-Mailer", "Village Courier");
        try {
            mailer.send(mail);
            LOG.debugf("Email sent to %s: %s", address, subject);
            return GatewayResult.ok();
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.warnf(e, "Email send to %s failed", address);
            if (isUnknownMailbox(message)) {
                return GatewayResult.invalidTarget(message);
            }
            return GatewayResult.transientFailure(message);
        }
    }

    static boolean isUnknownMailbox(String smtpError) {
        String lower = smtpError.toLowerCase(Locale.ROOT);
        return lower.contains("5.1.1") || lower.contains("550") || lower.contains("user unknown")
                || lower.contains("mailbox unavailable");
    }
}
