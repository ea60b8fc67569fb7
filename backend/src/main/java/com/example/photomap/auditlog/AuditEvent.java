package com.example.photomap.auditlog;

public enum AuditEvent {
    IDENTITY_CREATED(Category.AUTH),
    PASSKEY_REGISTERED(Category.AUTH),
    PASSKEY_DELETED(Category.AUTH),
    LOGIN_SUCCEEDED(Category.AUTH),
    LOGIN_FAILED(Category.AUTH),
    RECOVERY_REQUESTED(Category.RECOVERY),
    RECOVERY_FAILED(Category.RECOVERY),
    RECOVERY_COMPLETED(Category.RECOVERY),
    INVITE_CREATED(Category.INVITE),
    INVITE_REVOKED(Category.INVITE),
    INVITE_CONSUMED(Category.INVITE),
    ACCESS_GRANTED(Category.TRIP_ACCESS),
    ACCESS_UPDATED(Category.TRIP_ACCESS),
    ACCESS_REVOKED(Category.TRIP_ACCESS);

    public enum Category { AUTH, RECOVERY, INVITE, TRIP_ACCESS }

    private final Category category;

    AuditEvent(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
