package com.rebalancer.notification;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Recipients of the run summary e-mail. The SMTP connection itself is Spring Boot's
 * {@code spring.mail.*}.
 *
 * <pre>
 * notifications.email.enabled=false
 * notifications.email.from=rebalancer@localhost
 * notifications.email.recipients=${NOTIFICATION_EMAIL:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "notifications.email")
public class EmailConfig {

    private boolean enabled = false;
    private String from = "rebalancer@localhost";
    private List<String> recipients = new ArrayList<>();
}
