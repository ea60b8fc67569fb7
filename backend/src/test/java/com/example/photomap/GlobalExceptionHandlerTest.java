package com.example.photomap;

import com.example.photomap.exceptions.ErrorResponse;
import com.example.photomap.exceptions.PhotoMapException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void businessErrorUsesStatusAndCodeOfItsConstant() {
        ResponseEntity<ErrorResponse> response = handler.handlePhotoMapException(
                new PhotoMapException(PhotoMapException.Errors.ACCESS_ALREADY_GRANTED, "User already has access"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().error()).isEqualTo("ACCESS_ALREADY_GRANTED");
        assertThat(response.getBody().type()).isEqualTo("ACCESS_ALREADY_GRANTED");
        assertThat(response.getBody().message()).isEqualTo("User already has access");
    }

    @Test
    void duplicateKeyBecomesConflict() {
        ResponseEntity<ErrorResponse> response = handler.handleDuplicateKey(new DuplicateKeyException("E11000 email_1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).doesNotContain("E11000");
    }

    @Test
    void storageOutageIsServiceUnavailableWithoutDriverDetail() {
        ResponseEntity<ErrorResponse> response = handler.handleStorageFailure(
                new DataAccessResourceFailureException("Timed out connecting to mongodb://admin:secret@db"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().error()).isEqualTo("STORAGE_UNAVAILABLE");
        assertThat(response.getBody().message()).doesNotContain("secret");
    }

    @Test
    void unsupportedMethodKeepsItsStatus() {
        ResponseEntity<ErrorResponse> response = handler.handleRoutingExceptions(
                new HttpRequestMethodNotSupportedException("PUT"));

        assertThat(response.getStatusCode().value()).isEqualTo(405);
        assertThat(response.getBody().status()).isEqualTo(405);
    }

    @Test
    void unexpectedFailureIsGenericServerError() {
        ResponseEntity<ErrorResponse> response = handler.handleException(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).doesNotContain("boom");
    }
}
