package com.rebalancer.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Sends the run summary as an HTML e-mail through Spring's {@link JavaMailSender}.
 *
 * <p>Spring Boot only creates the mail sender when {@code spring.mail.host} is set, so the
 * channel counts as disabled without one.
 */
@Component
public class EmailNotifier implements RunSummaryNotifier {

    private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

    private final EmailConfig emailConfig;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public EmailNotifier(EmailConfig emailConfig, ObjectProvider<JavaMailSender> mailSenderProvider) {
        this.emailConfig = emailConfig;
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public String channel() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        if (!emailConfig.isEnabled()) {
            return false;
        }
        if (emailConfig.getRecipients().isEmpty()) {
            log.warn("E-mail notifications enabled but no recipients configured");
            return false;
        }
        if (mailSenderProvider.getIfAvailable() == null) {
            log.warn("E-mail notifications enabled but spring.mail.host is not set");
            return false;
        }
        return true;
    }

    @Override
    public void send(String subject, String body) {
        JavaMailSender mailSender = mailSenderProvider.getObject();
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
            helper.setFrom(emailConfig.getFrom());
            helper.setTo(emailConfig.getRecipients().toArray(String[]::new));
            helper.setSubject(subject);
            helper.setText(toHtml(body), true);
        } catch (MessagingException e) {
            throw new MailPreparationException("Could not build summary e-mail", e);
        }
        mailSender.send(message);
        log.debug("Summary e-mail sent to {} recipient(s)", emailConfig.getRecipients().size());
    }

    static String toHtml(String body) {
        return "<html><body><pre style=\"font-family: Arial, sans-serif; font-size: 14px\">"
                + body
                + "</pre></body></html>";
    }
}
