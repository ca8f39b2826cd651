package com.starscape.mentana.common.exception;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void mapsEveryErrorKindToAStatus() {
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.CONFLICT));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorKind.VALIDATION));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, GlobalExceptionHandler.statusFor(ErrorKind.UNAVAILABLE));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(ErrorKind.PERMISSION_DENIED));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.statusFor(ErrorKind.CONFIGURATION));
    }

    @Test
    void domainExceptionBodyCarriesKindAndOperation() {
        DomainException ex = new DomainException(
                DomainError.conflict("Email is already registered: a@b.io").withOperation("createUser"));

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleDomainException(ex);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("CONFLICT", body.code());
        assertEquals("Email is already registered: a@b.io", body.message());
        assertEquals("createUser", body.details().get("operation"));
        assertNotNull(body.timestamp());
    }

    @Test
    void configurationErrorsAreServerErrors() {
        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
                handler.handleConfiguration(ConfigurationException.unknownBackend("cassandra"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertTrue(response.getBody().message().contains("cassandra"));
    }
}
