package me.golemcore.reports.adapter.inbound.web;

import me.golemcore.reports.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.reports.port.outbound.ReportStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Report not found: AB12");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Report not found: AB12", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapValidationErrorsToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("title is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("title is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldTreatIllegalStateAsInternalError() {
        assertTrue(Arrays.stream(GlobalExceptionHandler.class.getMethods())
                .map(method -> method.getAnnotation(ExceptionHandler.class))
                .filter(Objects::nonNull)
                .flatMap(annotation -> Arrays.stream(annotation.value()))
                .noneMatch(IllegalStateException.class::equals));

        StepVerifier.create(handler.handleGeneric(new IllegalStateException("SMTP settings missing")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapStorageFailuresToBadGateway() {
        ReportStorageException ex = new ReportStorageException("Failed to upload to S3: a/index.html");

        StepVerifier.create(handler.handleStorage(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    assertEquals(502, response.getBody().getStatus());
                    assertEquals("Failed to upload to S3: a/index.html", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE at line 42")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
