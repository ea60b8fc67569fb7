package com.example.photomap.notification;

/** Out-of-band channel to the operator. */
public interface Notifier {

    /** Returns {@code false} when the message could not be delivered; never throws. */
    boolean send(String subject, String message);
}
