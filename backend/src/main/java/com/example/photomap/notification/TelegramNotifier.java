package com.example.photomap.notification;

import com.example.photomap.config.NotifierProps;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

@Component
@ConditionalOnProperty(prefix = "app.notifier", name = "channel", havingValue = "telegram")
public class TelegramNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private final NotifierProps.Telegram props;
    private final RestClient restClient;

    @Autowired
    public TelegramNotifier(NotifierProps notifierProps) {
        this(notifierProps, RestClient.create());
    }

    TelegramNotifier(NotifierProps notifierProps, RestClient restClient) {
        this.props = Objects.requireNonNull(notifierProps, "notifierProps").getTelegram();
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public boolean send(String subject, String message) {
        if (!props.isConfigured()) {
            log.warn("Telegram notifier selected without bot token or chat id, message '{}' dropped", subject);
            return false;
        }

        try {
            TelegramResponse response = restClient.post()
                    .uri(props.getApiBaseUrl() + "/bot{token}/sendMessage", props.getBotToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new TelegramMessage(props.getChatId(), "<b>" + subject + "</b>\n\n" + message, "HTML"))
                    .retrieve()
                    .body(TelegramResponse.class);
            boolean ok = response != null && response.ok();
            if (!ok) {
                log.error("Telegram rejected message '{}': {}", subject,
                        response == null ? "empty response" : response.description());
            }
            return ok;
        } catch (RestClientException ex) {
            log.error("Telegram delivery of '{}' failed: {}", subject, ex.getMessage());
            return false;
        }
    }

    record TelegramMessage(@JsonProperty("chat_id") String chatId,
                           String text,
                           @JsonProperty("parse_mode") String parseMode) {
    }

    record TelegramResponse(boolean ok, String description) {
    }
}
