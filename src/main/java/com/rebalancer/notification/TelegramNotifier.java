package com.rebalancer.notification;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Sends the run summary via the Telegram Bot API {@code sendMessage} method.
 *
 * <p>Messages longer than Telegram's 4096 character limit are cut and marked as truncated.
 */
@Component
public class TelegramNotifier implements RunSummaryNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    static final int MAX_MESSAGE_LENGTH = 4096;
    private static final String TRUNCATED = "\n...(truncated)";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;

    @Autowired
    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplateBuilder restTemplateBuilder) {
        this(telegramConfig, restTemplateBuilder.build());
    }

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
    }

    @Override
    public String channel() {
        return "telegram";
    }

    @Override
    public boolean isEnabled() {
        return telegramConfig.isEnabled();
    }

    @Override
    public void send(String subject, String body) {
        String url = telegramConfig.getApiUrl() + "/bot" + telegramConfig.getBotToken() + "/sendMessage";

        String text = "<b>" + NotificationTemplateEngine.escape(subject) + "</b>\n\n" + body;
        if (text.length() > MAX_MESSAGE_LENGTH) {
            text = text.substring(0, MAX_MESSAGE_LENGTH - TRUNCATED.length()) + TRUNCATED;
        }

        Map<String, Object> payload = Map.of(
                "chat_id",
                telegramConfig.getChatId(),
                "text",
                text,
                "parse_mode",
                "HTML",
                "disable_web_page_preview",
                true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
        log.debug("Telegram message sent to chat {}", telegramConfig.getChatId());
    }
}
