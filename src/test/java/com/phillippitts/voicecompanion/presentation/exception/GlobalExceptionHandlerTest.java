package com.phillippitts.voicecompanion.presentation.exception;

import com.phillippitts.voicecompanion.exception.EmptyInputException;
import com.phillippitts.voicecompanion.exception.OwnerOnlyException;
import com.phillippitts.voicecompanion.exception.RateLimitedException;
import com.phillippitts.voicecompanion.exception.RetriesExhaustedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void rateLimitedReturns429() {
        ResponseEntity<?> response = handler.handleRateLimited(new RateLimitedException("g1", 150));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("RateLimitedException");
    }

    @Test
    void retryAfterRoundsUpToWholeSeconds() {
        assertThat(handler.handleRateLimited(new RateLimitedException("g1", 150))
                .getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
        assertThat(handler.handleRateLimited(new RateLimitedException("g1", 1001))
                .getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("2");
        assertThat(handler.handleRateLimited(new RateLimitedException("g1", 0))
                .getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
    }

    @Test
    void emptyInputReturns400() {
        ResponseEntity<?> response = handler.handleEmptyInput(new EmptyInputException("g1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("EmptyInputException");
        assertThat(response.getBody().toString()).contains("Nothing to say");
    }

    @Test
    void retriesExhaustedReturns503WithRetryHint() {
        RetriesExhaustedException ex = new RetriesExhaustedException("g1", "c1", 4,
                new IllegalStateException("gateway password: hunter2"));

        ResponseEntity<?> response = handler.handleRetriesExhausted(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("retry");
        // Should NOT leak the underlying cause
        assertThat(response.getBody().toString()).doesNotContain("hunter2");
    }

    @Test
    void ownerOnlyReturns403() {
        ResponseEntity<?> response = handler.handleOwnerOnly(new OwnerOnlyException());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("OwnerOnlyException");
    }

    @Test
    void badRequestUsesGenericCode() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("field x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("errorCode=BadRequest");
    }

    @Test
    void unexpectedReturns500WithoutDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("Internal stack trace"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("IllegalStateException");
        assertThat(response.getBody().toString()).doesNotContain("stack trace");
    }

    @Test
    void errorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleEmptyInput(new EmptyInputException("g1"));

        assertThat(response.getBody()).isNotNull();
        String bodyStr = response.getBody().toString();
        assertThat(bodyStr).contains("errorCode=");
        assertThat(bodyStr).contains("message=");
        assertThat(bodyStr).contains("details=");
        assertThat(bodyStr).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
