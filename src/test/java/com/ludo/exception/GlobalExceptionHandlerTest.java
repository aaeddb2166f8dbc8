package com.ludo.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should return 404 NOT_FOUND for an unknown game")
    void shouldHandle404ForInvalidGame() {
        ResponseEntity<Map<String, String>> response =
                handler.handleGameRule(new GameRuleException(Rejection.INVALID_GAME));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Invalid game id", response.getBody().get("error"));
        assertEquals("invalid-game", response.getBody().get("code"));
    }

    @Test
    @DisplayName("should return 409 CONFLICT for other rule rejections")
    void shouldHandle409ForRuleRejection() {
        ResponseEntity<Map<String, String>> response =
                handler.handleGameRule(new GameRuleException(Rejection.ALREADY_FINISHED, 2));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("You are already the top 2", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 400 BAD_REQUEST for IllegalArgumentException")
    void shouldHandle400ForIllegalArgument() {
        var ex = new IllegalArgumentException("Invalid square id: road-99");

        ResponseEntity<Map<String, String>> response = handler.handleIllegalArgument(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Invalid square id: road-99", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 409 CONFLICT for IllegalStateException")
    void shouldHandle409ForIllegalState() {
        var ex = new IllegalStateException("Game is locked");

        ResponseEntity<Map<String, String>> response = handler.handleIllegalState(ex);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("Game is locked", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return generic error message for unexpected exceptions")
    void shouldHandle500ForGenericException() {
        var ex = new NullPointerException("some null value");

        ResponseEntity<Map<String, String>> response = handler.handleGeneral(ex);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("error"),
                "Should not leak exception details to client");
    }

    @Test
    @DisplayName("should return 400 with field errors for MethodArgumentNotValidException")
    @SuppressWarnings("unchecked")
    void shouldHandle400ForValidationErrors() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "gameId", "must not be blank"));

        MethodParameter methodParameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("shouldHandle400ForValidationErrors"), -1);

        ResponseEntity<Map<String, Object>> response =
                handler.handleValidation(new MethodArgumentNotValidException(methodParameter, bindingResult));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Validation failed", response.getBody().get("error"));
        Map<String, String> details = (Map<String, String>) response.getBody().get("details");
        assertEquals("must not be blank", details.get("gameId"));
    }

    @Test
    @DisplayName("should return 404 NOT_FOUND for NoResourceFoundException")
    void shouldHandle404ForNoResourceFound() {
        var ex = new NoResourceFoundException(HttpMethod.GET, "api/games/unknown/path", null);

        ResponseEntity<Map<String, String>> response = handler.handleNoResourceFound(ex);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody().get("error"));
    }
}
