package com.example.photomap.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Development channel: writes the message to the application log. */
@Component
@ConditionalOnProperty(prefix = "app.notifier", name = "channel", havingValue = "log", matchIfMissing = true)
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public boolean send(String subject, String message) {
        log.info("Notification '{}':\n{}", subject, message);
        return true;
    }
}
