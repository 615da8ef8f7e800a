package me.golemcore.apollo.adapter.inbound.web;

import me.golemcore.apollo.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.apollo.domain.exception.ConversationNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Token expired");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(401, body.getStatus());
                    assertEquals("Token expired", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideConversationIdInNotFound() {
        ConversationNotFoundException ex = new ConversationNotFoundException("conv-secret");

        StepVerifier.create(handler.handleConversationNotFound(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("Conversation not found", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        IllegalArgumentException ex = new IllegalArgumentException("Message must not be blank");

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("Message must not be blank", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalStateException() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Resource conflict")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
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
