package com.minichat.common.web;

import com.minichat.common.api.ApiCodes;
import com.minichat.common.api.Result;
import com.minichat.common.error.AuthenticationException;
import com.minichat.common.error.NotFoundException;
import com.minichat.common.error.PermissionDeniedException;
import com.minichat.common.error.StorageException;
import com.minichat.common.error.ValidationException;
import com.minichat.domain.enums.Permission;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "messages/x/y"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void chatExceptionsMapToTheirOwnStatusAndCode() {
        assertStatus(handler.handleChat(new AuthenticationException()), HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED);
        assertStatus(handler.handleChat(new PermissionDeniedException(Permission.ADMIN_ACCESS, "nope")),
                HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN);
        assertStatus(handler.handleChat(new ValidationException("Missing content field")),
                HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST);
        assertStatus(handler.handleChat(new NotFoundException("Message 1 not found")),
                HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND);
        assertStatus(handler.handleChat(new StorageException("Failed to store message", new RuntimeException("db down"))),
                HttpStatus.INTERNAL_SERVER_ERROR, ApiCodes.INTERNAL_ERROR);
    }

    @Test
    void validationMessageIsPassedThrough() {
        ResponseEntity<Result<Void>> resp = handler.handleChat(new ValidationException("Cannot send messages to viewer user v"));
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().message()).isEqualTo("Cannot send messages to viewer user v");
    }

    @Test
    void unexpectedExceptionBecomesInternalError() {
        ResponseEntity<Result<Void>> resp = handler.handleAny(new IllegalStateException("boom"));
        assertStatus(resp, HttpStatus.INTERNAL_SERVER_ERROR, ApiCodes.INTERNAL_ERROR);
        assertThat(resp.getBody().message()).isEqualTo("internal_error");
    }

    private static void assertStatus(ResponseEntity<Result<Void>> resp, HttpStatus status, int code) {
        assertThat(resp.getStatusCode()).isEqualTo(status);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(code);
    }
}
