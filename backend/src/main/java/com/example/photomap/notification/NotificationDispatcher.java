package com.example.photomap.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Hands notifications to the configured {@link Notifier} off the request thread. */
@Component
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;

    public NotificationDispatcher(Notifier notifier) {
        this.notifier = notifier;
    }

    @Async
    public void dispatch(String subject, String message) {
        try {
            if (!notifier.send(subject, message)) {
                log.error("Notification '{}' was not delivered", subject);
            }
        } catch (RuntimeException ex) {
            log.error("Notifier failed for '{}'", subject, ex);
        }
    }
}
