package com.delta.ingestion.incremental.api;

import com.delta.ingestion.incremental.model.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class IngestionExceptionHandlerTest {
    private final IngestionExceptionHandler handler = new IngestionExceptionHandler();

    @Test
    void storeFailureNamesProviderAndRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/incremental/providers/pager/trigger");
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("provider", "pager"));

        ResponseEntity<ErrorResponse> response = handler.handleDataAccess(
            new DataAccessResourceFailureException("connection refused"),
            request
        );

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        ErrorResponse body = response.getBody();
        assertFalse(body.success());
        assertEquals("pager", body.provider());
        assertEquals(
            "Ingestion store unavailable during POST /incremental/providers/pager/trigger: connection refused",
            body.message()
        );
    }

    @Test
    void storeFailureOutsideProviderRoutesKeepsRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/incremental/health");

        ResponseEntity<ErrorResponse> response = handler.handleDataAccess(
            new DataAccessResourceFailureException("connection refused"),
            request
        );

        ErrorResponse body = response.getBody();
        assertNull(body.provider());
        assertEquals("Ingestion store unavailable during GET /incremental/health: connection refused", body.message());
    }
}
