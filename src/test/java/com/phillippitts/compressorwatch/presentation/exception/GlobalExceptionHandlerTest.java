package com.phillippitts.compressorwatch.presentation.exception;

import com.phillippitts.compressorwatch.exception.DetectorNotInitializedException;
import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesValidationReturns400WithReason() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleValidation(new ValidationException("samples", "must not be empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ValidationException");
        assertThat(response.getBody().details()).contains("samples").contains("must not be empty");
    }

    @Test
    void verifiesMissingParameterReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleMalformedRequest(new MissingServletRequestParameterException("limit", "int"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("MalformedRequest");
    }

    @Test
    void verifiesNotInitializedReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleNotInitialized(new DetectorNotInitializedException("baseline"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().message()).isEqualTo("Detector not initialized");
        assertThat(response.getBody().details()).contains("baseline");
    }

    @Test
    void verifiesScorerFailureReturns503WithoutProcessDetails() {
        ScorerException ex = new ScorerException("Non-zero exit: 2 (stderr=/secret/model.pkl missing)", "adaptive");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleScorerFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("temporarily unavailable").contains("retry");
        assertThat(response.getBody().toString()).doesNotContain("/secret/model.pkl");
    }

    @Test
    void verifiesUnexpectedErrorReturns500() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("boom");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
