package com.example.photomap.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.Properties;

/**
 * Mail transport for the operator notification channel. Only built when {@code app.notifier.channel=smtp},
 * so the log and Telegram channels start without any SMTP settings.
 */
@Configuration
public class EmailSenderConfiguration {

    static final String SMTP_TIMEOUT_MILLIS = "5000";

    @Bean
    @ConditionalOnProperty(prefix = "app.notifier", name = "channel", havingValue = "smtp")
    public JavaMailSender operatorMailSender(EmailSenderProperties mail) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(mail.getHost());
        sender.setPort(mail.getPort());
        if (mail.isAuth()) {
            sender.setUsername(mail.getUsername());
            sender.setPassword(mail.getPassword());
        }

        Properties transport = sender.getJavaMailProperties();
        transport.put("mail.transport.protocol", "smtp");
        transport.put("mail.smtp.auth", String.valueOf(mail.isAuth()));
        transport.put("mail.smtp.starttls.enable", String.valueOf(mail.isStartTls()));
        for (String key : new String[] {"mail.smtp.connectiontimeout", "mail.smtp.timeout", "mail.smtp.writetimeout"}) {
            transport.put(key, SMTP_TIMEOUT_MILLIS);
        }
        return sender;
    }
}
