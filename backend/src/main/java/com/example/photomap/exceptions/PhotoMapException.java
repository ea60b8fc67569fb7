package com.example.photomap.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.function.Supplier;

/**
 * The single business exception of the service.
 *
 * Every failure a caller can observe is one of the {@link Errors} constants. The constant
 * decides the HTTP status and the error code written by the exception handler, the message is
 * the human readable text and never contains codes, tokens or key material.
 */
public class PhotoMapException extends RuntimeException {

    /** Broad failure category, used for logging and for deciding what a client may learn. */
    public enum Kind {
        VALIDATION,
        AUTHENTICATION,
        AUTHORIZATION,
        CONFLICT,
        NOT_FOUND,
        RATE_LIMIT,
        CONFIGURATION,
        TRANSIENT_INFRASTRUCTURE
    }

    public enum Errors {
        VALIDATION_FAILED(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        CHALLENGE_EXPIRED(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        INVALID_INVITE(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        INVITE_NOT_REVOCABLE(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        ADMIN_GRANT_REJECTED(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        LAST_PASSKEY(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        RECOVERY_CODE_INVALID(HttpStatus.BAD_REQUEST, Kind.VALIDATION),
        RECOVERY_LOCKED(HttpStatus.BAD_REQUEST, Kind.VALIDATION),

        AUTHENTICATION_FAILED(HttpStatus.UNAUTHORIZED, Kind.AUTHENTICATION),   // one generic answer for every login failure
        REGISTRATION_FAILED(HttpStatus.UNAUTHORIZED, Kind.AUTHENTICATION),
        UNAUTHORIZED(HttpStatus.UNAUTHORIZED, Kind.AUTHENTICATION),

        FORBIDDEN(HttpStatus.FORBIDDEN, Kind.AUTHORIZATION),
        REGISTRATION_CLOSED(HttpStatus.FORBIDDEN, Kind.AUTHORIZATION),

        EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT, Kind.CONFLICT),
        PASSKEY_ALREADY_REGISTERED(HttpStatus.CONFLICT, Kind.CONFLICT),
        ACCESS_ALREADY_GRANTED(HttpStatus.CONFLICT, Kind.CONFLICT),
        INVITE_ALREADY_ACTIVE(HttpStatus.CONFLICT, Kind.CONFLICT),

        NOT_FOUND(HttpStatus.NOT_FOUND, Kind.NOT_FOUND),

        RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, Kind.RATE_LIMIT),

        MISSING_PROXY_HEADERS(HttpStatus.BAD_REQUEST, Kind.CONFIGURATION),
        CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, Kind.CONFIGURATION),

        STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, Kind.TRANSIENT_INFRASTRUCTURE),
        INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, Kind.TRANSIENT_INFRASTRUCTURE);

        @Getter
        private final HttpStatus status;

        @Getter
        private final Kind kind;

        Errors(HttpStatus status, Kind kind) {
            this.status = status;
            this.kind = kind;
        }
    }

    @Getter
    private final Errors error;

    public PhotoMapException(Errors error, String message) {
        super(message);
        this.error = error;
    }

    public PhotoMapException(Errors error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public static Supplier<PhotoMapException> notFound(String message) {
        return () -> new PhotoMapException(Errors.NOT_FOUND, message);
    }

    public static Supplier<PhotoMapException> supply(Errors error, String message) {
        return () -> new PhotoMapException(error, message);
    }

    public static void checkOrThrow(boolean condition, Errors error, String message) {
        if (!condition) {
            throw new PhotoMapException(error, message);
        }
    }
}
