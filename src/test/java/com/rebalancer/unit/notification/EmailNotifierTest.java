package com.rebalancer.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rebalancer.notification.EmailConfig;
import com.rebalancer.notification.EmailNotifier;
import jakarta.mail.Address;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class EmailNotifierTest {

    @Mock
    private JavaMailSender mailSender;

    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;

    private EmailConfig config;
    private EmailNotifier notifier;

    @BeforeEach
    void setUp() {
        config = new EmailConfig();
        notifier = new EmailNotifier(config, mailSenderProvider);
    }

    @Test
    @DisplayName("Disabled by default")
    void disabledByDefault() {
        assertThat(notifier.isEnabled()).isFalse();
        assertThat(notifier.channel()).isEqualTo("email");
    }

    @Test
    @DisplayName("Needs recipients and a mail sender to be enabled")
    void enabledRequiresRecipientsAndSender() {
        config.setEnabled(true);
        assertThat(notifier.isEnabled()).isFalse();

        config.setRecipients(List.of("ops@example.com"));
        when(mailSenderProvider.getIfAvailable()).thenReturn(null, mailSender);
        assertThat(notifier.isEnabled()).isFalse();
        assertThat(notifier.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Sends an HTML message to every recipient")
    void sendsMessage() throws Exception {
        config.setEnabled(true);
        config.setFrom("rebalancer@example.com");
        config.setRecipients(List.of("ops@example.com", "owner@example.com"));
        MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
        when(mailSenderProvider.getObject()).thenReturn(mailSender);
        when(mailSender.createMimeMessage()).thenReturn(message);

        notifier.send("Rebalance completed: 5 executed, 0 skipped", "<b>REBALANCE</b>");

        verify(mailSender).send(message);
        assertThat(message.getSubject()).isEqualTo("Rebalance completed: 5 executed, 0 skipped");
        assertThat(message.getFrom()).extracting(Address::toString).containsExactly("rebalancer@example.com");
        assertThat(message.getAllRecipients())
                .extracting(Address::toString)
                .containsExactly("ops@example.com", "owner@example.com");
        assertThat((String) message.getContent()).contains("<pre").contains("<b>REBALANCE</b>");
    }
}
