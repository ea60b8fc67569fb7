package com.example.photomap;

import com.example.photomap.exceptions.ErrorResponse;
import com.example.photomap.exceptions.PhotoMapException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.MongoTransactionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.stream.Collectors;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PhotoMapException.class)
    public ResponseEntity<ErrorResponse> handlePhotoMapException(PhotoMapException ex) {
        switch (ex.getError().getKind()) {
            case CONFIGURATION, TRANSIENT_INFRASTRUCTURE -> log.error("{}: {}", ex.getError(), ex.getMessage(), ex);
            case AUTHENTICATION, AUTHORIZATION, RATE_LIMIT -> log.info("{}: {}", ex.getError(), ex.getMessage());
            default -> log.debug("{}: {}", ex.getError(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getError().getStatus()).body(ErrorResponse.of(ex));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
    public ResponseEntity<ErrorResponse> handleValidationExceptions(Exception ex) {
        BindingResult bindingResult = ex instanceof MethodArgumentNotValidException manve
                ? manve.getBindingResult()
                : ((BindException) ex).getBindingResult();

        String details = bindingResult.getFieldErrors().stream()
                .collect(Collectors.groupingBy(FieldError::getField, LinkedHashMap::new,
                        Collectors.mapping(FieldError::getDefaultMessage, Collectors.toList())))
                .entrySet()
                .stream()
                .map(entry -> entry.getKey() + ": " + String.join(", ", entry.getValue()))
                .collect(Collectors.joining("; "));

        if (details.isBlank()) {
            details = "Validation failed";
        }

        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                PhotoMapException.Errors.VALIDATION_FAILED.name(),
                details));
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequestExceptions(Exception ex) {
        String details;
        if (ex instanceof ConstraintViolationException violationException) {
            details = violationException.getConstraintViolations().stream()
                    .map(this::formatConstraintViolation)
                    .collect(Collectors.joining("; "));
        } else if (ex instanceof HttpMessageNotReadableException) {
            details = "Malformed request body";
        } else {
            details = ex.getMessage() != null ? ex.getMessage() : "Bad request";
        }

        if (details.isBlank()) {
            details = "Bad request";
        }

        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                PhotoMapException.Errors.VALIDATION_FAILED.name(),
                details));
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        log.info("Unique constraint rejected a write: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(
                HttpStatus.CONFLICT.value(), "CONFLICT", "Resource already exists"));
    }

    @ExceptionHandler({
            DataAccessResourceFailureException.class,
            TransientDataAccessException.class,
            MongoTransactionException.class
    })
    public ResponseEntity<ErrorResponse> handleStorageFailure(DataAccessException ex) {
        log.error("Storage unavailable: {}", ex.getClass().getSimpleName());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                PhotoMapException.Errors.STORAGE_UNAVAILABLE.name(),
                "Storage temporarily unavailable, please retry"));
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleRoutingExceptions(org.springframework.web.ErrorResponse ex) {
        HttpStatusCode status = ex.getStatusCode();
        String error = status.value() == HttpStatus.NOT_FOUND.value()
                ? PhotoMapException.Errors.NOT_FOUND.name()
                : PhotoMapException.Errors.VALIDATION_FAILED.name();
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, ex.getBody().getDetail()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(),
                        PhotoMapException.Errors.INTERNAL_ERROR.name(),
                        "An unexpected error occurred. Please try again later."));
    }

    private String formatConstraintViolation(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath() != null ? violation.getPropertyPath().toString() : "";
        String message = violation.getMessage();
        if (path.isBlank()) {
            return message;
        }
        return path + ": " + message;
    }
}
