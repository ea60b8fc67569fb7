package com.example.photomap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.notifier")
public class NotifierProps {

    /** log, telegram or smtp. */
    private String channel = "log";
    private final Telegram telegram = new Telegram();
    private final Smtp smtp = new Smtp();

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public Telegram getTelegram() {
        return telegram;
    }

    public Smtp getSmtp() {
        return smtp;
    }

    public static class Telegram {

        private String apiBaseUrl = "https://api.telegram.org";
        private String botToken;
        private String chatId;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getChatId() {
            return chatId;
        }

        public void setChatId(String chatId) {
            this.chatId = chatId;
        }

        public boolean isConfigured() {
            return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
        }
    }

    public static class Smtp {

        /** Operator mailbox that receives recovery codes. */
        private String recipient;

        public String getRecipient() {
            return recipient;
        }

        public void setRecipient(String recipient) {
            this.recipient = recipient;
        }
    }
}
