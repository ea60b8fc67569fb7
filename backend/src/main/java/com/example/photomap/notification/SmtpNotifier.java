package com.example.photomap.notification;

import com.example.photomap.config.EmailSenderProperties;
import com.example.photomap.config.NotifierProps;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/** Mails notifications to the operator mailbox configured under {@code app.notifier.smtp.recipient}. */
@Component
@ConditionalOnProperty(prefix = "app.notifier", name = "channel", havingValue = "smtp")
public class SmtpNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(SmtpNotifier.class);

    private final JavaMailSender mailSender;
    private final EmailSenderProperties mailProperties;
    private final NotifierProps notifierProps;

    public SmtpNotifier(JavaMailSender mailSender, EmailSenderProperties mailProperties, NotifierProps notifierProps) {
        this.mailSender = mailSender;
        this.mailProperties = mailProperties;
        this.notifierProps = notifierProps;
    }

    @Override
    public boolean send(String subject, String message) {
        String recipient = notifierProps.getSmtp().getRecipient();
        if (recipient == null || recipient.isBlank()) {
            log.warn("SMTP notifier selected without recipient, message '{}' dropped", subject);
            return false;
        }

        MimeMessage mime = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            helper.setFrom(mailProperties.getFrom());
            helper.setTo(recipient);
            helper.setSubject(mailProperties.getSubjectPrefix() + " " + subject);
            helper.setText(message, false);
            mailSender.send(mime);
            return true;
        } catch (MessagingException | MailException ex) {
            log.error("Mail delivery of '{}' failed: {}", subject, ex.getMessage());
            return false;
        }
    }
}
